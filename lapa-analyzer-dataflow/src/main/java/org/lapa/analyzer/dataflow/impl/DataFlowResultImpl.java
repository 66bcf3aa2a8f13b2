package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.dataflow.DataFlowResult;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.IrNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record DataFlowResultImpl(Map<String, InOut<Set<Definition>>> reachingDefinitions,
                                 Map<String, InOut<Set<String>>> liveVariables,
                                 Map<String, Map<String, Map<String, Object>>> constantValues,
                                 Map<String, Map<String, Set<Definition>>> arrayDefinitions,
                                 Map<String, Map<String, List<IrNode>>> phiNodes,
                                 Map<String, Map<String, Set<Definition>>> interproceduralDefinitions)
        implements DataFlowResult {
}
