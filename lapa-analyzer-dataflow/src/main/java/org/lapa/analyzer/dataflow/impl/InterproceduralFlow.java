package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Maps call arguments onto the parameters of the called function, positionally. When a call has more or fewer
arguments than the callee has parameters, the extra ones are ignored.

Calls are found among the statements of the blocks, and as the value of an assignment statement. The callee is
the FUNCTION attribute, a node (its name is used) or a plain string, and must name a function of the tree.
 */
class InterproceduralFlow {
    private static final Logger LOGGER = LoggerFactory.getLogger(InterproceduralFlow.class);

    Map<String, Map<String, Set<Definition>>> compute(IrNode root, Collection<ControlFlowGraph> cfgs) {
        Map<String, List<String>> parameters = parameters(root);
        Map<String, Map<String, Set<Definition>>> result = new LinkedHashMap<>();
        for (ControlFlowGraph cfg : cfgs) {
            for (BasicBlock block : cfg.blocks()) {
                for (IrNode statement : block.statements()) {
                    IrNode call = callIn(statement);
                    if (call != null) record(call, parameters, result);
                }
            }
        }
        return result;
    }

    private static IrNode callIn(IrNode statement) {
        if (statement.kind().isCall()) return statement;
        if (statement.kind() == NodeKind.ASSIGNMENT) {
            IrNode value = statement.nodeAttribute(VALUE);
            if (value != null && value.kind().isCall()) return value;
        }
        return null;
    }

    private static void record(IrNode call,
                               Map<String, List<String>> parameters,
                               Map<String, Map<String, Set<Definition>>> result) {
        String callee = calleeName(call.attribute(FUNCTION));
        List<String> calleeParameters = callee == null ? null : parameters.get(callee);
        if (calleeParameters == null) return;
        List<Object> arguments = call.listAttribute(ARGUMENTS);
        if (arguments.size() != calleeParameters.size()) {
            LOGGER.debug("Call to {} with {} arguments, {} parameters", callee, arguments.size(),
                    calleeParameters.size());
        }
        Map<String, Set<Definition>> perParameter = result.computeIfAbsent(callee, c -> new LinkedHashMap<>());
        int n = Math.min(arguments.size(), calleeParameters.size());
        for (int i = 0; i < n; i++) {
            perParameter.computeIfAbsent(calleeParameters.get(i), p -> new LinkedHashSet<>())
                    .add(new Definition(argumentText(arguments.get(i)), call));
        }
    }

    private static String calleeName(Object function) {
        if (function instanceof IrNode node) return node.name();
        if (function instanceof String s) return s;
        return null;
    }

    private static String argumentText(Object argument) {
        if (argument instanceof IrNode node) {
            if (node.name() != null) return node.name();
            if (node.kind() == NodeKind.LITERAL) return String.valueOf(node.attribute(VALUE));
        }
        return String.valueOf(argument);
    }

    // functions with the same name: the last one in pre-order wins
    static Map<String, List<String>> parameters(IrNode root) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        collectParameters(root, result);
        return result;
    }

    private static void collectParameters(IrNode node, Map<String, List<String>> result) {
        if (node.kind().isFunction() && node.name() != null) {
            List<String> names = new ArrayList<>();
            for (Object parameter : node.listAttribute(PARAMETERS)) {
                if (parameter instanceof IrNode p && p.kind() == NodeKind.VARIABLE && p.name() != null) {
                    names.add(p.name());
                } else if (parameter instanceof String s) {
                    names.add(s);
                }
            }
            result.put(node.name(), names);
        }
        for (IrNode child : node.children()) {
            collectParameters(child, result);
        }
    }
}
