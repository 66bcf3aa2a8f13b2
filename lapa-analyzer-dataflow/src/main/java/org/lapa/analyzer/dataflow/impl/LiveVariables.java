package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.AttributeKeys;
import org.lapa.analyzer.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Backward, union meet. Blocks are visited in reverse allocation order.

use[B]: variables read in B before B writes them; def[B]: variables written in B.
out[B] = union of in[S] over the successors S; in[B] = use[B] + (out[B] - def[B]).
 */
class LiveVariables {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiveVariables.class);

    private record UseDef(Set<String> use, Set<String> def) {
    }

    InOut<Set<String>> compute(ControlFlowGraph cfg) {
        Map<String, UseDef> useDef = new HashMap<>();
        Map<String, Set<String>> in = new LinkedHashMap<>();
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            useDef.put(block.name(), useDef(block));
            in.put(block.name(), new LinkedHashSet<>());
            out.put(block.name(), new LinkedHashSet<>());
        }
        List<BasicBlock> reversed = new ArrayList<>(cfg.blocks());
        Collections.reverse(reversed);

        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            ++iterations;
            for (BasicBlock block : reversed) {
                Set<String> outB = new LinkedHashSet<>();
                for (BasicBlock successor : cfg.successors(block)) {
                    outB.addAll(in.get(successor.name()));
                }
                UseDef ud = useDef.get(block.name());
                Set<String> inB = new LinkedHashSet<>(ud.use());
                for (String variable : outB) {
                    if (!ud.def().contains(variable)) inB.add(variable);
                }
                if (!inB.equals(in.get(block.name())) || !outB.equals(out.get(block.name()))) {
                    changed = true;
                }
                in.put(block.name(), inB);
                out.put(block.name(), outB);
            }
        }
        LOGGER.debug("Live variables of {}: {} iterations", cfg.name(), iterations);
        return new InOut<>(in, out);
    }

    private static UseDef useDef(BasicBlock block) {
        Set<String> use = new LinkedHashSet<>();
        Set<String> def = new LinkedHashSet<>();
        for (IrNode statement : block.statements()) {
            switch (statement.kind()) {
                case ASSIGNMENT -> {
                    addUses(Variables.extract(statement.attribute(AttributeKeys.VALUE)), use, def);
                    String target = Variables.target(statement);
                    if (target != null) def.add(target);
                }
                case PHI -> {
                    if (statement.attribute(AttributeKeys.SOURCES) instanceof Map<?, ?> sources) {
                        for (Object definitions : sources.values()) {
                            if (definitions instanceof Collection<?> collection) {
                                for (Object o : collection) {
                                    if (o instanceof Definition d && !def.contains(d.variable())) use.add(d.variable());
                                }
                            }
                        }
                    }
                    String target = Variables.target(statement);
                    if (target != null) def.add(target);
                }
                case LOOP -> use.addAll(Variables.extract(statement.attribute(AttributeKeys.CONDITION)));
                default -> addUses(Variables.extract(statement), use, def);
            }
        }
        return new UseDef(use, def);
    }

    private static void addUses(Set<String> variables, Set<String> use, Set<String> def) {
        for (String variable : variables) {
            if (!def.contains(variable)) use.add(variable);
        }
    }
}
