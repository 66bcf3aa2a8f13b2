package org.lapa.analyzer.controlflow;

import static org.lapa.analyzer.ir.io.IrDotWriter.escape;

/*
Graphviz output of a control flow graph. Join points are drawn as double circles; edges appear in block
allocation order, and per block in the order they were added.
 */
public class CfgDotWriter {

    public String write(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(cfg.name())).append("\" {\n");
        for (BasicBlock block : cfg.blocks()) {
            sb.append("  \"").append(escape(block.name())).append('"');
            if (block.isJoinPoint()) sb.append(" [shape=doublecircle]");
            sb.append(";\n");
        }
        for (BasicBlock block : cfg.blocks()) {
            for (BasicBlock successor : cfg.successors(block)) {
                sb.append("  \"").append(escape(block.name())).append("\" -> \"")
                        .append(escape(successor.name())).append("\";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }
}
