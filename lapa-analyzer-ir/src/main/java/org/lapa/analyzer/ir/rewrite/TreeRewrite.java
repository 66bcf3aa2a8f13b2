package org.lapa.analyzer.ir.rewrite;

import org.lapa.analyzer.ir.IrNode;

/**
 * An in-place rewrite of the subtree below a root node. Applying a rewrite a second time changes nothing.
 */
public interface TreeRewrite {

    /**
     * @return the number of nodes replaced or removed
     */
    int apply(IrNode root);
}
