package org.lapa.analyzer.ir.rewrite;

import org.lapa.analyzer.ir.AttributeKeys;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.lapa.analyzer.ir.util.Operators;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
Replaces a binary arithmetic operation whose first two children are numeric literals by a literal holding the
result. Post-order, so that nested operations fold bottom-up in a single pass. Division by zero is left alone.

The folded node is a new LITERAL node, put in place of the operation in its parent's child list; the root of the
rewrite is never replaced.
 */
public class ConstantFolding implements TreeRewrite {

    @Override
    public int apply(IrNode root) {
        int folded = 0;
        for (IrNode child : List.copyOf(root.children())) {
            folded += apply(child);
            IrNode literal = fold(child);
            if (literal != null && root.replaceChild(child, literal)) {
                ++folded;
            }
        }
        return folded;
    }

    static IrNode fold(IrNode node) {
        if (node.kind() != NodeKind.BINARY_OP || node.children().size() < 2) return null;
        String operator = node.stringAttribute(AttributeKeys.OPERATOR);
        if (!Operators.isArithmetic(operator)) return null;
        IrNode left = node.children().get(0);
        IrNode right = node.children().get(1);
        if (!(numericLiteral(left) && numericLiteral(right))) return null;
        Optional<Object> value = Operators.evaluateBinary(operator, left.attribute(AttributeKeys.VALUE),
                right.attribute(AttributeKeys.VALUE));
        if (value.isEmpty()) return null;
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(AttributeKeys.VALUE, value.get());
        return new IrNode(NodeKind.LITERAL, node.name(), node.position(), attributes);
    }

    private static boolean numericLiteral(IrNode node) {
        return node.kind() == NodeKind.LITERAL && node.attribute(AttributeKeys.VALUE) instanceof Number;
    }
}
