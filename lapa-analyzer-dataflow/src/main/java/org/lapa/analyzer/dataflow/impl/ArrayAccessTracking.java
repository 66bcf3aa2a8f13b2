package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Records, per collection, the assignments whose value is an element of that collection: x = a[i] adds (x, node)
under "a". Nested accesses a[i][j] and chained assignments x = y = a[i] resolve to the outermost collection name.
No later pass reads the result.
 */
class ArrayAccessTracking {

    Map<String, Set<Definition>> compute(ControlFlowGraph cfg) {
        Map<String, Set<Definition>> result = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            for (IrNode statement : block.statements()) {
                if (statement.kind() != NodeKind.ASSIGNMENT) continue;
                String target = Variables.target(statement);
                if (target == null || !isArrayAccess(statement)) continue;
                String arrayName = arrayName(statement);
                if (arrayName != null) {
                    result.computeIfAbsent(arrayName, n -> new LinkedHashSet<>())
                            .add(new Definition(target, statement));
                }
            }
        }
        return result;
    }

    private static boolean isArrayAccess(IrNode node) {
        if (node.kind() == NodeKind.ARRAY_ACCESS) return true;
        if (node.kind() == NodeKind.ASSIGNMENT) {
            IrNode value = node.nodeAttribute(VALUE);
            return value != null && isArrayAccess(value);
        }
        return false;
    }

    private static String arrayName(Object object) {
        if (object instanceof String s) return s;
        if (!(object instanceof IrNode node)) return null;
        if (node.kind() == NodeKind.ARRAY_ACCESS) {
            Object array = node.attribute(ARRAY);
            if (array instanceof IrNode a && a.kind() == NodeKind.VARIABLE) return Variables.variableName(a);
            return arrayName(array);
        }
        if (node.kind() == NodeKind.ASSIGNMENT) return arrayName(node.nodeAttribute(VALUE));
        return null;
    }
}
