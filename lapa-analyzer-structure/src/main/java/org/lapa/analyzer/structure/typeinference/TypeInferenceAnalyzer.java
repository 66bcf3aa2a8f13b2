package org.lapa.analyzer.structure.typeinference;

import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.lapa.analyzer.ir.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.*;
import static org.lapa.analyzer.structure.typeinference.TypeTags.*;

/*
One top-down pass, memoized per node. There is no fixed point: a loop body is visited once.

A node met again while its own type is being computed, through a definition that reads itself, counts as
"unknown" at that point; the outer computation still stores its result.

Every node of the tree except the program root ends up in the result, most of them as "unknown". Nodes reached
through attributes (operands, definitions, branches) are typed as well, and so are the left-hand sides of
assignments, which receive the type of the right-hand side.
 */
public class TypeInferenceAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeInferenceAnalyzer.class);

    private static final String UNKNOWN_CLASS = "UnknownClass";

    private static class Run {
        final Map<IrNode, String> types = new LinkedHashMap<>();
        final Map<String, IrNode> functionsByName = new HashMap<>();
        final Set<IrNode> inProgress = new HashSet<>();
    }

    public Map<IrNode, String> analyze(Ir ir) {
        return analyze(ir.root());
    }

    public Map<IrNode, String> analyze(IrNode root) {
        Run run = new Run();
        collectFunctions(root, run.functionsByName);
        traverse(run, root);
        LOGGER.debug("Inferred types for {} nodes", run.types.size());
        return run.types;
    }

    private static void collectFunctions(IrNode node, Map<String, IrNode> functionsByName) {
        if (node.kind().isFunction() && node.name() != null) functionsByName.put(node.name(), node);
        for (IrNode child : node.children()) {
            collectFunctions(child, functionsByName);
        }
    }

    private void traverse(Run run, IrNode node) {
        infer(run, node);
        for (IrNode child : node.children()) {
            traverse(run, child);
        }
    }

    private String infer(Run run, IrNode node) {
        if (node == null || node.kind() == NodeKind.PROGRAM) return null;
        String known = run.types.get(node);
        if (known != null) return known;
        // a definition that reads itself, as in x = x + 1
        if (!run.inProgress.add(node)) return UNKNOWN;
        try {
            String type = compute(run, node);
            if (type != null) run.types.put(node, type);
            return type;
        } finally {
            run.inProgress.remove(node);
        }
    }

    private String compute(Run run, IrNode node) {
        return switch (node.kind()) {
            case LITERAL -> ofValue(node.attribute(VALUE));
            case VARIABLE -> variable(run, node);
            case BINARY_OP -> binaryOperation(run, node);
            case FUNCTION_CALL, CALL -> call(run, node);
            case ASSIGNMENT -> assignment(run, node);
            case CONDITIONAL -> conditional(run, node);
            case LOOP -> {
                infer(run, node.nodeAttribute(CONDITION));
                infer(run, node.nodeAttribute(BODY));
                yield VOID;
            }
            case FUNCTION_DEF, FUNCTION -> functionDefinition(run, node);
            case CLASS_DEF, CLASS -> classDefinition(run, node);
            case COLLECTION -> collection(run, node);
            default -> UNKNOWN;
        };
    }

    private String inferOrUnknown(Run run, IrNode node) {
        String type = infer(run, node);
        return type == null ? UNKNOWN : type;
    }

    private String variable(Run run, IrNode node) {
        IrNode definition = node.nodeAttribute(DEFINITION);
        if (definition == null) return UNKNOWN;
        return infer(run, definition);
    }

    private String binaryOperation(Run run, IrNode node) {
        IrNode left = node.nodeAttribute(LEFT_OPERAND);
        IrNode right = node.nodeAttribute(RIGHT_OPERAND);
        String leftType = left == null ? UNKNOWN : infer(run, left);
        String rightType = right == null ? UNKNOWN : infer(run, right);
        return resolveBinary(node.stringAttribute(OPERATOR), leftType, rightType);
    }

    // the callee is a function node, or the name of one
    private String call(Run run, IrNode node) {
        Object function = node.attribute(FUNCTION);
        IrNode callee = function instanceof String name ? run.functionsByName.get(name)
                : function instanceof IrNode f ? f : null;
        if (callee == null) return UNKNOWN;
        String returnType = typeName(callee.attribute(RETURN_TYPE));
        return returnType == null ? UNKNOWN : returnType;
    }

    private String assignment(Run run, IrNode node) {
        IrNode right = node.nodeAttribute(RIGHT);
        String type = infer(run, right == null ? node.nodeAttribute(VALUE) : right);
        IrNode left = node.nodeAttribute(LEFT);
        if (left != null && type != null) run.types.put(left, type);
        return type;
    }

    private String conditional(Run run, IrNode node) {
        infer(run, node.nodeAttribute(CONDITION));
        String trueType = infer(run, node.nodeAttribute(TRUE_BRANCH));
        String falseType = infer(run, node.nodeAttribute(FALSE_BRANCH));
        return Objects.equals(trueType, falseType) ? trueType : UNKNOWN;
    }

    private String functionDefinition(Run run, IrNode node) {
        for (IrNode parameter : node.nodeListAttribute(PARAMETERS)) {
            infer(run, parameter);
        }
        infer(run, node.nodeAttribute(BODY));
        String returnType = typeName(node.attribute(RETURN_TYPE));
        return returnType == null ? VOID : returnType;
    }

    private String classDefinition(Run run, IrNode node) {
        for (IrNode member : node.nodeListAttribute(MEMBERS)) {
            infer(run, member);
        }
        String name = node.nameOrNameAttribute();
        return name == null ? UNKNOWN_CLASS : name;
    }

    private String collection(Run run, IrNode node) {
        String collectionType = node.stringAttribute(COLLECTION_TYPE);
        if (collectionType == null) return UNKNOWN;
        List<Object> elements = node.listAttribute(ELEMENTS);
        return switch (collectionType) {
            case "list" -> list(unify(elementTypes(run, elements)));
            case "set" -> set(unify(elementTypes(run, elements)));
            case "tuple" -> tuple(elementTypes(run, elements));
            case "dict" -> dictionary(run, elements);
            default -> UNKNOWN;
        };
    }

    private List<String> elementTypes(Run run, List<Object> elements) {
        List<String> types = new ArrayList<>(elements.size());
        for (Object element : elements) {
            types.add(element instanceof IrNode n ? inferOrUnknown(run, n) : UNKNOWN);
        }
        return types;
    }

    // each element is a (key, value) pair, as a Tuple or a two-element list
    private String dictionary(Run run, List<Object> elements) {
        List<String> keyTypes = new ArrayList<>();
        List<String> valueTypes = new ArrayList<>();
        for (Object element : elements) {
            List<Object> pair = element instanceof Tuple t ? t.elements()
                    : element instanceof List<?> l ? new ArrayList<>(l) : List.of();
            if (pair.size() == 2) {
                keyTypes.add(pair.get(0) instanceof IrNode k ? inferOrUnknown(run, k) : UNKNOWN);
                valueTypes.add(pair.get(1) instanceof IrNode v ? inferOrUnknown(run, v) : UNKNOWN);
            }
        }
        return dict(unify(keyTypes), unify(valueTypes));
    }

    private static String typeName(Object type) {
        if (type instanceof String s) return s;
        if (type instanceof IrNode node) return node.name();
        return null;
    }
}
