package org.lapa.analyzer.ir.rewrite;

import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;

/**
 * Removes NO_OP children, at any depth.
 */
public class DeadCodeElimination implements TreeRewrite {

    @Override
    public int apply(IrNode root) {
        int removed = root.removeChildrenIf(child -> child.kind() == NodeKind.NO_OP);
        for (IrNode child : root.children()) {
            removed += apply(child);
        }
        return removed;
    }
}
