package org.lapa.analyzer.ir.io;

import org.lapa.analyzer.ir.IrNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/*
Graphviz output of the IR tree: one edge per parent/child pair, pre-order, labelled KIND:name.
Nodes with the same label collapse into one graph node; this is a visualization aid, not a serialization.
 */
public class IrDotWriter {

    public String write(IrNode root) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph IR {\n");
        appendEdges(root, sb);
        sb.append("}\n");
        return sb.toString();
    }

    public void write(IrNode root, Writer writer) {
        try {
            writer.write(write(root));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void appendEdges(IrNode node, StringBuilder sb) {
        for (IrNode child : node.children()) {
            sb.append("  \"").append(escape(node.label())).append("\" -> \"")
                    .append(escape(child.label())).append("\";\n");
            appendEdges(child, sb);
        }
    }

    /**
     * Escapes a label for use between double quotes in DOT.
     */
    public static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
