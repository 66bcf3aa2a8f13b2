package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.AttributeKeys;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Forward, union meet.

gen[B]: the (variable, node) pairs of the assignments and phi nodes in B, and of the assignments directly below
the BODY attribute of a LOOP statement in B.
kill[B]: all other definitions, anywhere in the function, of the variables that B defines.
in[B] = union of out[P] over the predecessors P; out[B] = gen[B] + (in[B] - kill[B]).
 */
class ReachingDefinitions {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReachingDefinitions.class);

    InOut<Set<Definition>> compute(ControlFlowGraph cfg) {
        Map<String, Set<Definition>> gen = new HashMap<>();
        Map<String, Set<Definition>> allDefinitions = new HashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            Set<Definition> g = generated(block);
            gen.put(block.name(), g);
            for (Definition d : g) {
                allDefinitions.computeIfAbsent(d.variable(), v -> new LinkedHashSet<>()).add(d);
            }
        }
        Map<String, Set<Definition>> kill = new HashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            Set<Definition> g = gen.get(block.name());
            Set<Definition> k = new LinkedHashSet<>();
            for (Definition d : g) {
                k.addAll(allDefinitions.get(d.variable()));
            }
            k.removeAll(g);
            kill.put(block.name(), k);
        }

        Map<String, Set<Definition>> in = new LinkedHashMap<>();
        Map<String, Set<Definition>> out = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            in.put(block.name(), new LinkedHashSet<>());
            out.put(block.name(), new LinkedHashSet<>());
        }
        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            ++iterations;
            for (BasicBlock block : cfg.blocks()) {
                Set<Definition> inB = new LinkedHashSet<>();
                for (BasicBlock predecessor : cfg.predecessors(block)) {
                    inB.addAll(out.get(predecessor.name()));
                }
                Set<Definition> outB = new LinkedHashSet<>(gen.get(block.name()));
                for (Definition d : inB) {
                    if (!kill.get(block.name()).contains(d)) outB.add(d);
                }
                if (!outB.equals(out.get(block.name()))) {
                    out.put(block.name(), outB);
                    changed = true;
                }
                in.put(block.name(), inB);
            }
        }
        LOGGER.debug("Reaching definitions of {}: {} iterations", cfg.name(), iterations);
        return new InOut<>(in, out);
    }

    static Set<Definition> generated(BasicBlock block) {
        Set<Definition> result = new LinkedHashSet<>();
        for (IrNode statement : block.statements()) {
            String target = Variables.target(statement);
            if (target != null) {
                result.add(new Definition(target, statement));
            } else if (statement.kind() == NodeKind.LOOP) {
                IrNode body = statement.nodeAttribute(AttributeKeys.BODY);
                if (body != null) {
                    for (IrNode child : body.children()) {
                        String childTarget = child.kind() == NodeKind.ASSIGNMENT ? Variables.target(child) : null;
                        if (childTarget != null) result.add(new Definition(childTarget, child));
                    }
                }
            }
        }
        return result;
    }
}
