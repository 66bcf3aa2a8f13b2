package org.lapa.analyzer.structure.dependency;

import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Recursive descent over the whole tree. Every node, except the program root, gets an entry; the attributes that
carry dependencies depend on the kind of the node. Only node-valued attributes (or collections of nodes) count;
plain strings are skipped.

A node reached through an attribute is expanded once: the visited set stops the second expansion, but the edge
into the node is always recorded.

Cycle detection is limited to class definitions: a class is pushed onto the current path while its bases, body,
decorators and type parameters are expanded. Meeting a class that is already on the path records the suffix of
the path starting at that class as a circular dependency.
 */
public class DependencyAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyAnalyzer.class);

    // state of one run
    private static class Run {
        final Map<IrNode, Set<IrNode>> dependencies = new LinkedHashMap<>();
        final List<Set<IrNode>> circularDependencies = new ArrayList<>();
        final Set<IrNode> visited = new HashSet<>();
        final List<IrNode> path = new ArrayList<>();

        Set<IrNode> of(IrNode node) {
            return dependencies.computeIfAbsent(node, n -> new LinkedHashSet<>());
        }
    }

    public DependencyGraph analyze(Ir ir) {
        return analyze(ir.root());
    }

    public DependencyGraph analyze(IrNode root) {
        Run run = new Run();
        traverse(run, root);
        DependencyGraph graph = new DependencyGraph(run.dependencies, run.circularDependencies);
        LOGGER.debug("Dependency analysis done: {}", graph);
        return graph;
    }

    private void traverse(Run run, IrNode node) {
        if (node.kind() != NodeKind.PROGRAM) {
            process(run, node);
        }
        for (IrNode child : node.children()) {
            traverse(run, child);
        }
    }

    private void process(Run run, IrNode node) {
        run.of(node);
        switch (node.kind()) {
            case FUNCTION_DEF, FUNCTION -> addAll(run, node, PARAMETERS, BODY, RETURN_TYPE, DECORATORS);
            case FUNCTION_CALL, CALL -> addAll(run, node, FUNCTION, ARGUMENTS, TYPE_ARGS);
            case VARIABLE -> addAll(run, node, TYPE, INITIALIZER, ANNOTATIONS);
            case ASSIGNMENT -> assignment(run, node);
            case IMPORT -> importStatement(run, node);
            case CLASS_DEF, CLASS -> classDefinition(run, node);
            case IF -> addAll(run, node, TEST, BODY, ELSE);
            case WHILE -> addAll(run, node, TEST, BODY);
            case FOR -> addAll(run, node, TARGET, ITER, BODY);
            case TRY -> addAll(run, node, BODY, HANDLERS, ELSE, FINALLY);
            case LOOP -> addAll(run, node, CONDITION, BODY);
            case CONDITIONAL -> addAll(run, node, CONDITION, TRUE_BRANCH, FALSE_BRANCH);
            case BINARY_OP -> addAll(run, node, LEFT, RIGHT, LEFT_OPERAND, RIGHT_OPERAND);
            case UNARY_OP -> addAll(run, node, OPERAND);
            default -> {
            }
        }
    }

    private void addAll(Run run, IrNode node, String... keys) {
        for (String key : keys) {
            Object value = node.attribute(key);
            if (value instanceof IrNode dependency) {
                add(run, node, dependency);
            } else if (value instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof IrNode dependency) add(run, node, dependency);
                }
            }
        }
    }

    private void add(Run run, IrNode from, IrNode to) {
        run.of(from).add(to);
        processOnce(run, to);
    }

    private void processOnce(Run run, IrNode node) {
        if (run.visited.add(node)) {
            process(run, node);
        }
    }

    // the left-hand side depends on the right-hand side, not the assignment itself
    private void assignment(Run run, IrNode node) {
        IrNode left = node.nodeAttribute(LEFT);
        IrNode right = node.nodeAttribute(RIGHT);
        if (left != null && right != null) {
            run.of(left).add(right);
            processOnce(run, left);
            processOnce(run, right);
        }
        IrNode typeAnnotation = node.nodeAttribute(TYPE_ANNOTATION);
        if (typeAnnotation != null) add(run, node, typeAnnotation);
    }

    /*
    The imported module, the aliases and the from-list items are not part of the tree; placeholder nodes stand in
    for them.
     */
    private void importStatement(Run run, IrNode node) {
        Set<IrNode> set = run.of(node);
        String moduleName = node.stringAttribute(MODULE_NAME);
        if (moduleName != null && !moduleName.isEmpty()) {
            set.add(new IrNode(NodeKind.MODULE, moduleName, Map.of(MODULE_NAME, moduleName)));
        }
        if (node.attribute(ALIASES) instanceof Map<?, ?> aliases) {
            for (Map.Entry<?, ?> entry : aliases.entrySet()) {
                Map<String, Object> attributes = new HashMap<>();
                attributes.put(ORIGINAL_NAME, entry.getValue());
                set.add(new IrNode(NodeKind.ALIAS, String.valueOf(entry.getKey()), attributes));
            }
        }
        for (Object item : node.listAttribute(FROM_LIST)) {
            Map<String, Object> attributes = new HashMap<>();
            attributes.put(MODULE, moduleName);
            set.add(new IrNode(NodeKind.IMPORT_FROM, String.valueOf(item), attributes));
        }
    }

    private void classDefinition(Run run, IrNode node) {
        int index = run.path.indexOf(node);
        if (index >= 0) {
            Set<IrNode> cycle = new LinkedHashSet<>(run.path.subList(index, run.path.size()));
            if (!run.circularDependencies.contains(cycle)) {
                run.circularDependencies.add(cycle);
                LOGGER.debug("Circular dependency: {}", cycle);
            }
            return;
        }
        run.path.add(node);
        try {
            addAll(run, node, BASES, BODY, DECORATORS, TYPE_PARAMS);
        } finally {
            run.path.remove(run.path.size() - 1);
        }
    }
}
