package org.lapa.analyzer.driver;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.lapa.analyzer.ir.*;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.lapa.analyzer.ir.IrNodes.*;

public class TestProgramAnalyzer {

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(ProgramAnalyzer.class)).setLevel(Level.DEBUG);
    }

    private static Ir program() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f", "int", List.of("p"), null));
        with(f,
                assignment("x", binaryOp("+", literal(5), literal(10))),
                noOp(),
                with(controlFlow(AttributeKeys.CF_IF, ref("p")), assignment("x", literal(1))),
                call("print", ref("x")));
        IrNode main = ir.addFunction(function("main"));
        main.addChild(assignment("r", call("f", literal(3))));
        return ir;
    }

    @Test
    public void testDefaults() {
        ProgramAnalyzer.Options options = new ProgramAnalyzer.Options.Builder().build();
        assertFalse(options.optimize());
        assertFalse(options.parallel());
        assertTrue(options.validate());
    }

    @Test
    public void testAnalyze() {
        Ir ir = program();
        ProgramAnalyzer.Result result = new ProgramAnalyzer().analyze(ir);
        assertTrue(result.valid());
        assertEquals(List.of("f", "main"), List.copyOf(result.controlFlowGraphs().keySet()));
        // f: entry, exit, x = 5 + 10, no-op and condition, if, end, x = 1, print
        assertEquals(8, result.controlFlowGraphs().get("f").size());
        assertEquals(1, result.dataFlow().phiCount());
        assertEquals(1, result.dataFlow().interproceduralDefinitions().get("f").get("p").size());
        assertTrue(result.dependencyGraph().circularDependencies().isEmpty());
        assertEquals("int", result.types().get(ir.functions().get(0)));
        assertFalse(result.types().containsKey(ir.root()));
        assertTrue(result.controlFlowDot("f").startsWith("digraph \"f\" {"));
        assertNull(result.controlFlowDot("g"));
    }

    @Test
    public void testOptimizeFirst() {
        Ir ir = program();
        ProgramAnalyzer analyzer = new ProgramAnalyzer(new ProgramAnalyzer.Options.Builder().setOptimize(true).build());
        ProgramAnalyzer.Result result = analyzer.analyze(ir);
        // the no-op is gone before the graphs are built
        assertEquals(7, result.controlFlowGraphs().get("f").size());
        IrNode f = ir.functions().get(0);
        assertTrue(f.findNodesByKind(NodeKind.NO_OP).isEmpty());
        assertTrue(ProgramAnalyzer.irDot(ir).contains("\"FUNCTION:f\" -> \"ASSIGNMENT:x\";"));
    }

    @Test
    public void testInvalidStillAnalyzed() {
        Ir ir = program();
        ir.addFunction(function("f"));
        ProgramAnalyzer.Result result = new ProgramAnalyzer().analyze(ir);
        assertFalse(result.valid());
        assertEquals(2, result.controlFlowGraphs().size());

        ProgramAnalyzer noValidation = new ProgramAnalyzer(new ProgramAnalyzer.Options.Builder()
                .setValidate(false).build());
        assertTrue(noValidation.analyze(program()).valid());
    }

    @Test
    public void testParallel() {
        ProgramAnalyzer sequential = new ProgramAnalyzer();
        ProgramAnalyzer parallel = new ProgramAnalyzer(new ProgramAnalyzer.Options.Builder().setParallel(true).build());
        ProgramAnalyzer.Result r1 = sequential.analyze(program());
        ProgramAnalyzer.Result r2 = parallel.analyze(program());
        assertEquals(r1.dataFlow().constantValues(), r2.dataFlow().constantValues());
        assertEquals(r1.dataFlow().liveVariables(), r2.dataFlow().liveVariables());
    }
}
