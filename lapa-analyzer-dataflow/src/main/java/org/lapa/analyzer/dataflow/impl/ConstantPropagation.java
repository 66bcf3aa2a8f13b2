package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.IrNodes;
import org.lapa.analyzer.ir.NodeKind;
import org.lapa.analyzer.ir.util.Operators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Forward, intersection meet: a variable is constant at the start of a block only when every predecessor agrees on
its value. A block without predecessors starts without constants.

An assignment generates a constant when its value evaluates statically, from literals and operators only; any other
assignment, and every phi node, kills its target. Evaluation never looks up other variables, which keeps gen and
kill independent of the in-sets.

The fixed point is computed first (compute, no side effects), then substitute rewrites reads of known constants
into literals, walking each block from its in-set and applying every statement's effect in turn.
 */
class ConstantPropagation {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConstantPropagation.class);

    // effect of one statement: the variable it writes, and its constant value, if any
    private record Effect(String variable, Optional<Object> value) {
        void applyTo(Map<String, Object> constants) {
            if (value.isPresent()) {
                constants.put(variable, value.get());
            } else {
                constants.remove(variable);
            }
        }
    }

    InOut<Map<String, Object>> compute(ControlFlowGraph cfg) {
        Map<String, List<Effect>> effects = new HashMap<>();
        Map<String, Map<String, Object>> in = new LinkedHashMap<>();
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            effects.put(block.name(), block.statements().stream().map(ConstantPropagation::effect)
                    .filter(Objects::nonNull).toList());
            in.put(block.name(), new LinkedHashMap<>());
            out.put(block.name(), new LinkedHashMap<>());
        }

        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            ++iterations;
            for (BasicBlock block : cfg.blocks()) {
                List<BasicBlock> predecessors = cfg.predecessors(block);
                Map<String, Object> inB = predecessors.isEmpty() ? new LinkedHashMap<>()
                        : intersect(predecessors.stream().map(p -> out.get(p.name())).toList());
                Map<String, Object> outB = new LinkedHashMap<>(inB);
                effects.get(block.name()).forEach(e -> e.applyTo(outB));
                if (!outB.equals(out.get(block.name()))) {
                    out.put(block.name(), outB);
                    changed = true;
                }
                in.put(block.name(), inB);
            }
        }
        LOGGER.debug("Constant propagation of {}: {} iterations", cfg.name(), iterations);
        return new InOut<>(in, out);
    }

    static Map<String, Object> intersect(List<Map<String, Object>> maps) {
        Map<String, Object> result = new LinkedHashMap<>(maps.get(0));
        for (Map<String, Object> map : maps.subList(1, maps.size())) {
            result.entrySet().removeIf(e -> !map.containsKey(e.getKey())
                                            || !Objects.equals(map.get(e.getKey()), e.getValue()));
        }
        return result;
    }

    private static Effect effect(IrNode statement) {
        if (statement.kind() == NodeKind.ASSIGNMENT) {
            String target = Variables.target(statement);
            if (target == null) return null;
            return new Effect(target, evaluate(statement.attribute(VALUE)));
        }
        if (statement.kind() == NodeKind.PHI) {
            String target = Variables.target(statement);
            return target == null ? null : new Effect(target, Optional.empty());
        }
        return null;
    }

    static Optional<Object> evaluate(Object expression) {
        if (!(expression instanceof IrNode node)) return Optional.empty();
        return switch (node.kind()) {
            case LITERAL -> Optional.ofNullable(Operators.normalize(node.attribute(VALUE)));
            case UNARY_OP -> evaluate(node.attribute(OPERAND))
                    .flatMap(v -> Operators.evaluateUnary(node.stringAttribute(OPERATOR), v));
            case BINARY_OP -> {
                Optional<Object> left = evaluate(node.attribute(LEFT_OPERAND));
                if (left.isEmpty()) yield Optional.empty();
                Optional<Object> right = evaluate(node.attribute(RIGHT_OPERAND));
                if (right.isEmpty()) yield Optional.empty();
                yield Operators.evaluateBinary(node.stringAttribute(OPERATOR), left.get(), right.get());
            }
            default -> Optional.empty();
        };
    }

    // -- substitution

    /**
     * @return the number of variable reads replaced by a literal
     */
    int substitute(ControlFlowGraph cfg, InOut<Map<String, Object>> constants) {
        int replaced = 0;
        for (BasicBlock block : cfg.blocks()) {
            Map<String, Object> current = new LinkedHashMap<>(constants.in(block.name()));
            for (IrNode statement : List.copyOf(block.statements())) {
                Effect effect = effect(statement);
                Counter counter = new Counter();
                IrNode replacement = replace(statement, current, counter);
                if (replacement != statement) {
                    block.replaceStatement(statement, replacement);
                    IrNode parent = statement.parent();
                    if (parent != null) parent.replaceChild(statement, replacement);
                }
                replaced += counter.count;
                if (effect != null) effect.applyTo(current);
            }
        }
        return replaced;
    }

    private static class Counter {
        int count;
    }

    /*
    Only these slots are rewritten: the operands of unary and binary operations, the value of an assignment,
    the arguments of a call, the array and index of an array access, and the children of any node.
     */
    private static IrNode replace(IrNode node, Map<String, Object> constants, Counter counter) {
        switch (node.kind()) {
            case VARIABLE -> {
                if (Boolean.TRUE.equals(node.attribute(DECLARATION))) break;
                String name = Variables.variableName(node);
                if (name != null && constants.containsKey(name)) {
                    ++counter.count;
                    return IrNodes.literal(constants.get(name));
                }
            }
            case BINARY_OP, UNARY_OP -> {
                replaceAttribute(node, LEFT_OPERAND, constants, counter);
                replaceAttribute(node, RIGHT_OPERAND, constants, counter);
                replaceAttribute(node, OPERAND, constants, counter);
            }
            case ASSIGNMENT -> replaceAttribute(node, VALUE, constants, counter);
            case CALL, FUNCTION_CALL -> {
                if (node.attribute(ARGUMENTS) instanceof List<?> arguments) {
                    List<Object> newArguments = new ArrayList<>(arguments.size());
                    for (Object argument : arguments) {
                        newArguments.add(argument instanceof IrNode a ? replace(a, constants, counter) : argument);
                    }
                    node.setAttribute(ARGUMENTS, newArguments);
                }
            }
            case ARRAY_ACCESS -> {
                replaceAttribute(node, ARRAY, constants, counter);
                replaceAttribute(node, INDEX, constants, counter);
            }
            default -> {
            }
        }
        for (IrNode child : List.copyOf(node.children())) {
            IrNode newChild = replace(child, constants, counter);
            if (newChild != child) node.replaceChild(child, newChild);
        }
        return node;
    }

    private static void replaceAttribute(IrNode node, String key, Map<String, Object> constants, Counter counter) {
        IrNode value = node.nodeAttribute(key);
        if (value != null) {
            node.setAttribute(key, replace(value, constants, counter));
        }
    }
}
