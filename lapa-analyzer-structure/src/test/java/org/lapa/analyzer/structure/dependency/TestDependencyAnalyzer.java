package org.lapa.analyzer.structure.dependency;

import org.junit.jupiter.api.Test;
import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.lapa.analyzer.structure.CommonTest;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.lapa.analyzer.ir.AttributeKeys.*;
import static org.lapa.analyzer.ir.IrNodes.*;

public class TestDependencyAnalyzer extends CommonTest {

    @Test
    public void testImport() {
        Ir ir = new Ir();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(MODULE_NAME, "os");
        attributes.put(ALIASES, Map.of("p", "path", "e", "environ"));
        attributes.put(FROM_LIST, List.of("getcwd", "listdir"));
        IrNode importNode = new IrNode(NodeKind.IMPORT, "os", attributes);
        ir.root().addChild(importNode);

        DependencyGraph graph = new DependencyAnalyzer().analyze(ir);
        Set<IrNode> dependencies = graph.dependenciesOf(importNode);
        assertEquals(5, dependencies.size());
        Map<NodeKind, Long> byKind = dependencies.stream()
                .collect(Collectors.groupingBy(IrNode::kind, Collectors.counting()));
        assertEquals(Map.of(NodeKind.MODULE, 1L, NodeKind.ALIAS, 2L, NodeKind.IMPORT_FROM, 2L), byKind);

        IrNode module = dependencies.stream().filter(n -> n.kind() == NodeKind.MODULE).findFirst().orElseThrow();
        assertEquals("os", module.name());
        assertNull(module.parent());
        Set<Object> originals = dependencies.stream().filter(n -> n.kind() == NodeKind.ALIAS)
                .map(n -> n.attribute(ORIGINAL_NAME)).collect(Collectors.toSet());
        assertEquals(Set.of("path", "environ"), originals);
        dependencies.stream().filter(n -> n.kind() == NodeKind.IMPORT_FROM)
                .forEach(n -> assertEquals("os", n.attribute(MODULE)));
        assertFalse(graph.dependencies().containsKey(ir.root()));
    }

    @Test
    public void testMutualBases() {
        Ir ir = new Ir();
        IrNode a = new IrNode(NodeKind.CLASS_DEF, "A");
        IrNode b = new IrNode(NodeKind.CLASS_DEF, "B");
        a.setAttribute(BASES, List.of(b));
        b.setAttribute(BASES, List.of(a));
        ir.root().addChild(a);
        ir.root().addChild(b);

        DependencyGraph graph = new DependencyAnalyzer().analyze(ir);
        assertEquals(1, graph.circularDependencies().size());
        assertEquals(Set.of(a, b), graph.circularDependencies().get(0));
        assertEquals(Set.of(b), graph.dependenciesOf(a));
        assertEquals(Set.of(a), graph.dependenciesOf(b));
    }

    @Test
    public void testSelfBase() {
        IrNode root = new IrNode(NodeKind.PROGRAM);
        IrNode a = new IrNode(NodeKind.CLASS_DEF, "A");
        a.setAttribute(BASES, List.of(a));
        root.addChild(a);

        DependencyGraph graph = new DependencyAnalyzer().analyze(root);
        assertEquals(List.of(Set.of(a)), graph.circularDependencies());
    }

    @Test
    public void testMutuallyRecursiveFunctionsNoCycle() {
        Ir ir = new Ir();
        IrNode f = function("f");
        IrNode g = function("g");
        IrNode callG = new IrNode(NodeKind.FUNCTION_CALL, "g", Map.of(FUNCTION, g));
        IrNode callF = new IrNode(NodeKind.FUNCTION_CALL, "f", Map.of(FUNCTION, f));
        f.setAttribute(BODY, callG);
        g.setAttribute(BODY, callF);
        ir.addFunction(f);
        ir.addFunction(g);

        DependencyGraph graph = new DependencyAnalyzer().analyze(ir);
        assertTrue(graph.circularDependencies().isEmpty());
        assertEquals(Set.of(callG), graph.dependenciesOf(f));
        assertEquals(Set.of(g), graph.dependenciesOf(callG));
        assertEquals(Set.of(f), graph.dependenciesOf(callF));
    }

    @Test
    public void testAssignmentLeftDependsOnRight() {
        IrNode root = new IrNode(NodeKind.PROGRAM);
        IrNode x = ref("x");
        IrNode sum = binaryOp("+", ref("y"), literal(1));
        IrNode annotation = new IrNode(NodeKind.TYPE, "int");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(LEFT, x);
        attributes.put(RIGHT, sum);
        attributes.put(TYPE_ANNOTATION, annotation);
        IrNode assignment = new IrNode(NodeKind.ASSIGNMENT, "x", attributes);
        root.addChild(assignment);

        DependencyGraph graph = new DependencyAnalyzer().analyze(root);
        assertEquals(Set.of(sum), graph.dependenciesOf(x));
        assertEquals(Set.of(annotation), graph.dependenciesOf(assignment));
        // the operands are reached through the attributes of the binary operation
        assertEquals(2, graph.dependenciesOf(sum).size());
    }

    @Test
    public void testStringsAreSkipped() {
        IrNode root = new IrNode(NodeKind.PROGRAM);
        IrNode function = function("f", "int", List.of("a", "b"), null);
        IrNode decorator = new IrNode(NodeKind.VARIABLE, "cached");
        function.setAttribute(DECORATORS, List.of(decorator, "other"));
        root.addChild(function);

        DependencyGraph graph = new DependencyAnalyzer().analyze(root);
        assertEquals(Set.of(decorator), graph.dependenciesOf(function));
        assertEquals(Set.of(), graph.dependenciesOf(decorator));
        assertTrue(graph.dependencies().containsKey(decorator));
    }

    @Test
    public void testControlFlowConstructs() {
        IrNode root = new IrNode(NodeKind.PROGRAM);
        IrNode test = ref("c");
        IrNode body = new IrNode(NodeKind.BLOCK);
        IrNode elseBody = new IrNode(NodeKind.BLOCK);
        IrNode ifNode = new IrNode(NodeKind.IF, null, Map.of(TEST, test, BODY, body, ELSE, elseBody));
        IrNode handler = new IrNode(NodeKind.EXCEPT_HANDLER);
        IrNode finallyBody = new IrNode(NodeKind.BLOCK);
        IrNode tryNode = new IrNode(NodeKind.TRY, null,
                Map.of(BODY, ifNode, HANDLERS, List.of(handler), FINALLY, finallyBody));
        root.addChild(tryNode);

        DependencyGraph graph = new DependencyAnalyzer().analyze(root);
        assertEquals(Set.of(ifNode, handler, finallyBody), graph.dependenciesOf(tryNode));
        assertEquals(Set.of(test, body, elseBody), graph.dependenciesOf(ifNode));
        assertEquals(3 + 3, graph.edgeCount());
    }

    @Test
    public void testVisitedOnceEdgeAlwaysRecorded() {
        IrNode root = new IrNode(NodeKind.PROGRAM);
        IrNode shared = new IrNode(NodeKind.VARIABLE, "shared");
        IrNode type = new IrNode(NodeKind.TYPE, "T");
        shared.setAttribute(TYPE, type);
        IrNode first = new IrNode(NodeKind.UNARY_OP, "-", Map.of(OPERAND, shared));
        IrNode second = new IrNode(NodeKind.UNARY_OP, "-", Map.of(OPERAND, shared));
        root.addChild(first);
        root.addChild(second);

        DependencyGraph graph = new DependencyAnalyzer().analyze(root);
        assertEquals(Set.of(shared), graph.dependenciesOf(first));
        assertEquals(Set.of(shared), graph.dependenciesOf(second));
        assertEquals(Set.of(type), graph.dependenciesOf(shared));
    }
}
