package org.lapa.analyzer.controlflow;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.Test;
import org.lapa.analyzer.ir.AttributeKeys;
import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.lapa.analyzer.ir.IrNodes.*;

public class TestCfgDotWriter extends CommonTest {

    @Language("dot")
    private static final String EXPECTED = """
            digraph "f" {
              "entry";
              "exit";
              "if_block_1";
              "end_block_2" [shape=doublecircle];
              "block_3";
              "entry" -> "if_block_1";
              "entry" -> "end_block_2";
              "if_block_1" -> "block_3";
              "end_block_2" -> "exit";
              "block_3" -> "end_block_2";
            }
            """;

    @Test
    public void test() {
        Ir ir = new Ir();
        IrNode f = ir.addFunction(function("f"));
        with(f, with(controlFlow(AttributeKeys.CF_IF, ref("c")), statement("s")));
        assertEquals(EXPECTED, new CfgDotWriter().write(single(ir, "f")));
    }

    @Test
    public void testQuotesInName() {
        Ir ir = new Ir();
        ir.addFunction(function("say\"hi\""));
        String dot = new CfgDotWriter().write(single(ir, "say\"hi\""));
        assertEquals("digraph \"say\\\"hi\\\"\" {", dot.lines().findFirst().orElseThrow());
    }
}
