package org.lapa.analyzer.ir.rewrite;

import org.lapa.analyzer.ir.AttributeKeys;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;

import java.util.*;

/*
Removes variable declarations whose name is never read.

A VARIABLE node with DECLARATION == true is a declaration; every other VARIABLE node is a read. Reads are collected
in one pre-pass over the whole tree, following children as well as node-valued attributes, which is where
assignments and operations keep their operands.

Removing a declaration can remove the last read of another variable, when that read sits in the removed
declaration's subtree or its definition. The rewrite therefore repeats until nothing changes.
 */
public class UnusedVariableRemoval implements TreeRewrite {

    @Override
    public int apply(IrNode root) {
        int total = 0;
        while (true) {
            Set<String> reads = new HashSet<>();
            collectReads(root, reads, Collections.newSetFromMap(new IdentityHashMap<>()));
            int removed = remove(root, reads);
            if (removed == 0) return total;
            total += removed;
        }
    }

    private static boolean isDeclaration(IrNode node) {
        return node.kind() == NodeKind.VARIABLE && Boolean.TRUE.equals(node.attribute(AttributeKeys.DECLARATION));
    }

    private static void collectReads(IrNode node, Set<String> reads, Set<IrNode> visited) {
        if (!visited.add(node)) return;
        if (node.kind() == NodeKind.VARIABLE && !isDeclaration(node) && node.name() != null) {
            reads.add(node.name());
        }
        for (Object value : node.attributes().values()) {
            if (value instanceof IrNode n) {
                collectReads(n, reads, visited);
            } else if (value instanceof Collection<?> collection) {
                for (Object o : collection) {
                    if (o instanceof IrNode n) collectReads(n, reads, visited);
                }
            }
        }
        for (IrNode child : node.children()) {
            collectReads(child, reads, visited);
        }
    }

    private static int remove(IrNode node, Set<String> reads) {
        int removed = node.removeChildrenIf(child -> isDeclaration(child) && !reads.contains(child.name()));
        for (IrNode child : node.children()) {
            removed += remove(child, reads);
        }
        return removed;
    }
}
