package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;

import java.util.LinkedHashSet;
import java.util.Set;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Helpers shared by the passes: which variables an expression reads, and which variable a statement writes.
 */
final class Variables {

    private Variables() {
    }

    /**
     * @return the variable written by an assignment or phi node, or null
     */
    static String target(IrNode statement) {
        if (statement.kind() == NodeKind.ASSIGNMENT || statement.kind() == NodeKind.PHI) {
            String target = statement.stringAttribute(TARGET);
            return target == null || target.isEmpty() ? null : target;
        }
        return null;
    }

    /**
     * The name of a variable node: its NAME attribute when present, else the node's name.
     */
    static String variableName(IrNode variable) {
        String name = variable.stringAttribute(NAME);
        return name == null || name.isEmpty() ? variable.name() : name;
    }

    static Set<String> extract(Object expression) {
        Set<String> result = new LinkedHashSet<>();
        if (expression instanceof IrNode node) extract(node, result);
        return result;
    }

    private static void extract(IrNode node, Set<String> result) {
        switch (node.kind()) {
            case VARIABLE -> {
                String name = variableName(node);
                if (name != null) result.add(name);
            }
            case BINARY_OP, UNARY_OP -> {
                node.nodeListAttribute(OPERANDS).forEach(o -> extract(o, result));
                extractAttribute(node, LEFT_OPERAND, result);
                extractAttribute(node, RIGHT_OPERAND, result);
                extractAttribute(node, OPERAND, result);
            }
            case CALL, FUNCTION_CALL -> node.nodeListAttribute(ARGUMENTS).forEach(a -> extract(a, result));
            case ARRAY_ACCESS -> {
                extractAttribute(node, ARRAY, result);
                extractAttribute(node, INDEX, result);
            }
            default -> {
            }
        }
        for (IrNode child : node.children()) {
            extract(child, result);
        }
    }

    private static void extractAttribute(IrNode node, String key, Set<String> result) {
        IrNode value = node.nodeAttribute(key);
        if (value != null) extract(value, result);
    }
}
