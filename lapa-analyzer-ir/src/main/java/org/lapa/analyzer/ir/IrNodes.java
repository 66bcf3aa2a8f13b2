package org.lapa.analyzer.ir;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/**
 * Factory methods for the node shapes the passes recognise. Front ends and tests use them so that the attribute
 * keys are spelled in one place.
 */
public final class IrNodes {

    private IrNodes() {
    }

    // -- declarations

    public static IrNode function(String name, String returnType, List<?> parameters, Position position) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (returnType != null) attributes.put(RETURN_TYPE, returnType);
        if (parameters != null) attributes.put(PARAMETERS, parameters);
        return new IrNode(NodeKind.FUNCTION, name, position, attributes);
    }

    public static IrNode function(String name) {
        return function(name, null, null, null);
    }

    public static IrNode struct(String name, List<?> fields, Position position) {
        return new IrNode(NodeKind.STRUCT, name, position, fields == null ? null : Map.of(FIELDS, fields));
    }

    public static IrNode enumeration(String name, List<?> variants, Position position) {
        return new IrNode(NodeKind.ENUM, name, position, variants == null ? null : Map.of(VARIANTS, variants));
    }

    public static IrNode trait(String name, List<?> methods, Position position) {
        return new IrNode(NodeKind.TRAIT, name, position, methods == null ? null : Map.of(METHODS, methods));
    }

    public static IrNode macro(String name, Position position) {
        return new IrNode(NodeKind.MACRO, name, position, null);
    }

    public static IrNode implementation(String type, String trait, List<?> items, Position position) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (type != null) attributes.put(TYPE, type);
        if (items != null) attributes.put(ITEMS, items);
        String name = trait == null ? type : trait + " for " + type;
        return new IrNode(NodeKind.IMPLEMENTATION, name, position, attributes);
    }

    /**
     * A variable declaration, marked as such with the DECLARATION attribute.
     *
     * @param definition the node computing the initial value, or null
     */
    public static IrNode variable(String name, String type, Ownership ownership, IrNode definition) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(DECLARATION, true);
        if (type != null) attributes.put(TYPE, type);
        if (ownership != null) attributes.put(OWNERSHIP, ownership);
        if (definition != null) attributes.put(DEFINITION, definition);
        return new IrNode(NodeKind.VARIABLE, name, null, attributes);
    }

    // -- expressions and statements

    public static IrNode literal(Object value) {
        return new IrNode(NodeKind.LITERAL, String.valueOf(value), null, valueMap(value));
    }

    private static Map<String, Object> valueMap(Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(VALUE, value);
        return map;
    }

    /**
     * A read of a variable.
     */
    public static IrNode ref(String name) {
        return new IrNode(NodeKind.VARIABLE, name);
    }

    public static IrNode assignment(String target, IrNode value) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TARGET, target);
        attributes.put(VALUE, value);
        return new IrNode(NodeKind.ASSIGNMENT, target, null, attributes);
    }

    /**
     * Binary operation with its operands both as attributes and as children; constant folding reads the children,
     * the data flow passes read the attributes.
     */
    public static IrNode binaryOp(String operator, IrNode left, IrNode right) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(OPERATOR, operator);
        attributes.put(LEFT_OPERAND, left);
        attributes.put(RIGHT_OPERAND, right);
        IrNode node = new IrNode(NodeKind.BINARY_OP, operator, null, attributes);
        node.addChild(left);
        node.addChild(right);
        return node;
    }

    public static IrNode unaryOp(String operator, IrNode operand) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(OPERATOR, operator);
        attributes.put(OPERAND, operand);
        return new IrNode(NodeKind.UNARY_OP, operator, null, attributes);
    }

    public static IrNode call(String function, IrNode... arguments) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(FUNCTION, function);
        attributes.put(ARGUMENTS, List.of(arguments));
        return new IrNode(NodeKind.CALL, function, null, attributes);
    }

    public static IrNode arrayAccess(IrNode array, IrNode index) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(ARRAY, array);
        attributes.put(INDEX, index);
        return new IrNode(NodeKind.ARRAY_ACCESS, null, null, attributes);
    }

    /**
     * A control flow marker; type is one of if, else, try, except, finally.
     */
    public static IrNode controlFlow(String type) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TYPE, type);
        return new IrNode(NodeKind.CONTROL_FLOW, type, null, attributes);
    }

    public static IrNode controlFlow(String type, IrNode condition) {
        IrNode node = controlFlow(type);
        node.setAttribute(CONDITION, condition);
        return node;
    }

    public static IrNode loop(IrNode condition) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (condition != null) attributes.put(CONDITION, condition);
        return new IrNode(NodeKind.LOOP, "loop", null, attributes);
    }

    public static IrNode noOp() {
        return new IrNode(NodeKind.NO_OP);
    }

    /**
     * Convenience: appends the children in order and returns the parent.
     */
    public static IrNode with(IrNode parent, IrNode... children) {
        for (IrNode child : children) {
            parent.addChild(child);
        }
        return parent;
    }
}
