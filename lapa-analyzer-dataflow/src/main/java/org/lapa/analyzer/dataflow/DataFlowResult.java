package org.lapa.analyzer.dataflow;

import org.lapa.analyzer.ir.IrNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/*
All maps are keyed by function name first, then by block name where applicable, in the order of the control
flow graphs and their blocks.
 */
public interface DataFlowResult {

    Map<String, InOut<Set<Definition>>> reachingDefinitions();

    Map<String, InOut<Set<String>>> liveVariables();

    /**
     * @return per function, per block, the constants known at the end of the block
     */
    Map<String, Map<String, Map<String, Object>>> constantValues();

    /**
     * @return per function, per collection name, the assignments that read an element of that collection
     */
    Map<String, Map<String, Set<Definition>>> arrayDefinitions();

    /**
     * @return per function, per block, the phi nodes inserted at the start of the block; blocks without
     * phi nodes are absent
     */
    Map<String, Map<String, List<IrNode>>> phiNodes();

    /**
     * @return per called function, per parameter, the (argument, call node) pairs that can reach it
     */
    Map<String, Map<String, Set<Definition>>> interproceduralDefinitions();

    default int phiCount() {
        return phiNodes().values().stream()
                .flatMap(m -> m.values().stream())
                .mapToInt(List::size)
                .sum();
    }
}
