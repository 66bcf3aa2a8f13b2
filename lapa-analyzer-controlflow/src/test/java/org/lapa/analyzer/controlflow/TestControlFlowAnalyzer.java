package org.lapa.analyzer.controlflow;

import org.junit.jupiter.api.Test;
import org.lapa.analyzer.ir.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.lapa.analyzer.ir.IrNodes.*;

public class TestControlFlowAnalyzer extends CommonTest {

    @Test
    public void testEmpty() {
        Map<String, ControlFlowGraph> cfgs = new ControlFlowAnalyzer().analyze(new Ir());
        assertTrue(cfgs.isEmpty());
    }

    @Test
    public void testStraightLine() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("simple"));
        IrNode s1 = statement("s1");
        IrNode s2 = statement("s2");
        IrNode s3 = statement("s3");
        with(f, s1, s2, s3);

        ControlFlowGraph cfg = single(ir, "simple");
        assertEquals(List.of("entry", "exit", "block_1", "block_2", "block_3"),
                cfg.blocks().stream().map(BasicBlock::name).toList());
        assertSame(cfg.entry(), cfg.block(0));
        assertSame(cfg.block("block_1"), cfg.block(2));
        assertEquals(List.of(s1), cfg.block("block_1").statements());
        assertEquals(List.of(s3), cfg.block("block_3").statements());
        assertTrue(cfg.hasEdge("entry", "block_1"));
        assertTrue(cfg.hasEdge("block_1", "block_2"));
        assertTrue(cfg.hasEdge("block_2", "block_3"));
        assertTrue(cfg.hasEdge("block_3", "exit"));
        assertEquals(4, cfg.edgeCount());
        assertEquals(List.of(cfg.block("block_2")), cfg.predecessors(cfg.block("block_3")));
    }

    @Test
    public void testEmptyFunction() {
        Ir ir = new Ir();
        ir.addFunction(function("nothing"));
        ControlFlowGraph cfg = single(ir, "nothing");
        assertEquals(2, cfg.size());
        assertTrue(cfg.hasEdge("entry", "exit"));
    }

    @Test
    public void testIfWithoutElse() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f"));
        IrNode condition = ref("c");
        IrNode ifNode = controlFlow(AttributeKeys.CF_IF, condition);
        IrNode body = statement("body");
        with(f, with(ifNode, body));

        ControlFlowGraph cfg = single(ir, "f");
        assertEquals(List.of(condition), cfg.entry().statements());
        assertTrue(cfg.hasEdge("entry", "if_block_1"));
        assertTrue(cfg.hasEdge("entry", "end_block_2"));
        assertTrue(cfg.hasEdge("if_block_1", "block_3"));
        assertTrue(cfg.hasEdge("block_3", "end_block_2"));
        assertTrue(cfg.hasEdge("end_block_2", "exit"));
        assertTrue(cfg.block("end_block_2").isJoinPoint());
        assertFalse(cfg.block("if_block_1").isJoinPoint());
        assertEquals(List.of(body), cfg.block("block_3").statements());
    }

    @Test
    public void testIfElse() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("if_else"));
        with(f,
                with(controlFlow(AttributeKeys.CF_IF, literal(true)), statement("then")),
                with(controlFlow(AttributeKeys.CF_ELSE), statement("otherwise")));

        ControlFlowGraph cfg = single(ir, "if_else");
        assertTrue(cfg.hasEdge("entry", "if_block_1"));
        assertTrue(cfg.hasEdge("entry", "else_block_2"));
        assertFalse(cfg.hasEdge("entry", "end_block_3"));
        assertTrue(cfg.hasEdge("if_block_1", "block_4"));
        assertTrue(cfg.hasEdge("block_4", "end_block_3"));
        assertTrue(cfg.hasEdge("else_block_2", "block_5"));
        assertTrue(cfg.hasEdge("block_5", "end_block_3"));
        assertTrue(cfg.hasEdge("end_block_3", "exit"));
        assertTrue(cfg.block("end_block_3").isJoinPoint());
        assertEquals(2, cfg.block("end_block_3").predecessorIndices().size());
    }

    @Test
    public void testElseWithoutIf() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f"));
        IrNode orphan = controlFlow(AttributeKeys.CF_ELSE);
        with(f, orphan);
        ControlFlowGraph cfg = single(ir, "f");
        assertEquals(List.of(orphan), cfg.block("block_1").statements());
    }

    @Test
    public void testLoop() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("loop_function"));
        IrNode condition = literal(true);
        with(f, with(loop(condition), statement("body")), statement("after"));

        ControlFlowGraph cfg = single(ir, "loop_function");
        BasicBlock header = cfg.block("loop_block_1");
        assertEquals(List.of(condition), header.statements());
        assertTrue(cfg.hasEdge("entry", "loop_block_1"));
        assertTrue(cfg.hasEdge("loop_block_1", "block_3"));
        assertTrue(cfg.hasEdge("block_3", "loop_block_1"));
        assertTrue(cfg.hasEdge("loop_block_1", "after_loop_block_2"));
        assertTrue(cfg.hasEdge("after_loop_block_2", "block_4"));
        assertTrue(cfg.hasEdge("block_4", "exit"));
        assertTrue(cfg.block("after_loop_block_2").isJoinPoint());
        assertEquals(2, header.successorIndices().size());
    }

    @Test
    public void testEmptyLoopBody() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("spin"));
        with(f, loop(null));
        ControlFlowGraph cfg = single(ir, "spin");
        assertTrue(cfg.block("loop_block_1").statements().isEmpty());
        assertTrue(cfg.hasEdge("loop_block_1", "loop_block_1"));
        assertTrue(cfg.hasEdge("after_loop_block_2", "exit"));
    }

    @Test
    public void testTryExcept() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("try_except"));
        IrNode tryNode = controlFlow(AttributeKeys.CF_TRY);
        with(tryNode,
                with(new IrNode(NodeKind.BLOCK), statement("risky")),
                with(controlFlow(AttributeKeys.CF_EXCEPT), with(new IrNode(NodeKind.BLOCK), statement("handler"))));
        with(f, tryNode);

        ControlFlowGraph cfg = single(ir, "try_except");
        assertTrue(cfg.hasEdge("entry", "try_block_1"));
        assertTrue(cfg.hasEdge("try_block_1", "block_2"));
        assertTrue(cfg.hasEdge("block_2", "end_block_3"));
        assertTrue(cfg.hasEdge("try_block_1", "except_block_4"));
        assertTrue(cfg.hasEdge("except_block_4", "block_5"));
        assertTrue(cfg.hasEdge("block_5", "end_block_3"));
        assertTrue(cfg.hasEdge("end_block_3", "exit"));
        assertFalse(cfg.hasEdge("try_block_1", "end_block_3"));
    }

    @Test
    public void testTryFinallyWithoutExcept() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f"));
        IrNode nested = controlFlow("with");
        with(f, with(controlFlow(AttributeKeys.CF_TRY),
                statement("risky"),
                nested,
                with(controlFlow(AttributeKeys.CF_FINALLY), statement("cleanup"))));

        ControlFlowGraph cfg = single(ir, "f");
        // markers other than except and finally stay in the try content
        assertEquals(List.of(nested), cfg.block("block_3").statements());
        assertTrue(cfg.hasEdge("try_block_1", "block_2"));
        assertTrue(cfg.hasEdge("block_3", "end_block_4"));
        assertTrue(cfg.hasEdge("try_block_1", "end_block_4"));
        assertTrue(cfg.hasEdge("end_block_4", "finally_block_5"));
        assertTrue(cfg.hasEdge("finally_block_5", "block_6"));
        assertTrue(cfg.hasEdge("block_6", "exit"));
        // the cursor after the try statement is the end block
        assertTrue(cfg.hasEdge("end_block_4", "exit"));
    }

    @Test
    public void testNestedFunctionsAndNames() {
        Ir ir = new Ir();
        IrNode outer = ir.addFunction(function("outer"));
        IrNode inner = new IrNode(NodeKind.FUNCTION_DEF, "inner");
        IrNode anonymous = new IrNode(NodeKind.FUNCTION);
        IrNode clazz = new IrNode(NodeKind.CLASS_DEF, "C");
        with(ir.root(), with(clazz, anonymous));
        with(outer, inner, statement("s"));

        Map<String, ControlFlowGraph> cfgs = new ControlFlowAnalyzer().analyze(ir);
        assertEquals(List.of("outer", "inner", ControlFlowAnalyzer.ANONYMOUS), List.copyOf(cfgs.keySet()));
        // the nested definition is a statement of the outer function
        assertEquals(List.of(inner), cfgs.get("outer").block("block_1").statements());
    }

    @Test
    public void testNestedIfInLoop() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f"));
        with(f, with(loop(ref("c")), with(controlFlow(AttributeKeys.CF_IF, ref("d")), statement("s"))));

        ControlFlowGraph cfg = single(ir, "f");
        // the if condition lands in the loop header, the join block of the if loops back
        assertEquals(2, cfg.block("loop_block_1").statements().size());
        assertTrue(cfg.hasEdge("loop_block_1", "if_block_3"));
        assertTrue(cfg.hasEdge("loop_block_1", "end_block_4"));
        assertTrue(cfg.hasEdge("if_block_3", "block_5"));
        assertTrue(cfg.hasEdge("end_block_4", "loop_block_1"));
        assertTrue(cfg.hasEdge("after_loop_block_2", "exit"));
    }
}
