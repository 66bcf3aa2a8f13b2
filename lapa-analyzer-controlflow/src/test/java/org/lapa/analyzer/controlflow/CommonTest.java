package org.lapa.analyzer.controlflow;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.BeforeAll;
import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.LoggerFactory;

public class CommonTest {

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(ControlFlowAnalyzer.class)).setLevel(Level.DEBUG);
    }

    protected static IrNode statement(String name) {
        return new IrNode(NodeKind.STATEMENT, name);
    }

    protected static ControlFlowGraph single(Ir ir, String functionName) {
        return new ControlFlowAnalyzer().analyze(ir).get(functionName);
    }
}
