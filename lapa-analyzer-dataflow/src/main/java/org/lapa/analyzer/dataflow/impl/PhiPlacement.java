package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.BasicBlock;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.SOURCES;
import static org.lapa.analyzer.ir.AttributeKeys.TARGET;

/*
Inserts a phi node for a variable at the start of a block when the block is a join point, or has more than one
predecessor, and the out-sets of its predecessors together hold at least two different definition nodes of the
variable.

The phi node has TARGET the variable, and SOURCES a map from predecessor block name to the definitions of the
variable in that predecessor's out-set; predecessors without any are left out. Phi nodes are ordered by variable
name, and are not part of the IR tree.
 */
class PhiPlacement {
    private static final Logger LOGGER = LoggerFactory.getLogger(PhiPlacement.class);

    Map<String, List<IrNode>> insert(ControlFlowGraph cfg, InOut<Set<Definition>> reachingDefinitions) {
        Map<String, List<IrNode>> result = new LinkedHashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            List<BasicBlock> predecessors = cfg.predecessors(block);
            if (!block.isJoinPoint() && predecessors.size() <= 1) continue;

            Map<String, Set<IrNode>> definitionNodes = new TreeMap<>();
            for (BasicBlock predecessor : predecessors) {
                for (Definition d : reachingDefinitions.out(predecessor.name())) {
                    definitionNodes.computeIfAbsent(d.variable(), v -> new HashSet<>()).add(d.node());
                }
            }
            List<IrNode> phis = new ArrayList<>();
            for (Map.Entry<String, Set<IrNode>> entry : definitionNodes.entrySet()) {
                if (entry.getValue().size() < 2) continue;
                String variable = entry.getKey();
                Map<String, Set<Definition>> sources = new LinkedHashMap<>();
                for (BasicBlock predecessor : predecessors) {
                    Set<Definition> defs = new LinkedHashSet<>();
                    for (Definition d : reachingDefinitions.out(predecessor.name())) {
                        if (d.variable().equals(variable)) defs.add(d);
                    }
                    if (!defs.isEmpty()) sources.put(predecessor.name(), defs);
                }
                if (!sources.isEmpty()) {
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put(TARGET, variable);
                    attributes.put(SOURCES, sources);
                    phis.add(new IrNode(NodeKind.PHI, variable, attributes));
                }
            }
            if (!phis.isEmpty()) {
                block.prependStatements(phis);
                result.put(block.name(), phis);
                LOGGER.debug("Inserted {} phi node(s) in {} of {}", phis.size(), block.name(), cfg.name());
            }
        }
        return result;
    }
}
