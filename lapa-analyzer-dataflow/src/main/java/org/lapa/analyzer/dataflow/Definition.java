package org.lapa.analyzer.dataflow;

import org.lapa.analyzer.ir.IrNode;

/**
 * A definition of a variable: the assignment or phi node that writes it. Two definitions are equal when they
 * name the same variable and share the same node, by identity.
 * <p>
 * The inter-procedural pass reuses this pair for (argument text, call node).
 */
public record Definition(String variable, IrNode node) {

    @Override
    public String toString() {
        return "(" + variable + ", " + node + ")";
    }
}
