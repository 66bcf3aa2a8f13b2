package org.lapa.analyzer.dataflow.impl;

import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.DataFlowAnalyzer;
import org.lapa.analyzer.dataflow.DataFlowResult;
import org.lapa.analyzer.dataflow.Definition;
import org.lapa.analyzer.dataflow.InOut;
import org.lapa.analyzer.ir.AnalyzerException;
import org.lapa.analyzer.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/*
Two phases per function.

The fixed points (reaching definitions, live variables, constants) only read the graphs; with parallel == true they
run concurrently, one function per task, each writing its own entry of a concurrent map.
The rewriting steps (constant substitution, array tracking, phi placement) mutate nodes that may be shared, and run
sequentially, in the order of the graphs. The inter-procedural pass comes after all of them.
 */
public class DataFlowAnalyzerImpl implements DataFlowAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DataFlowAnalyzerImpl.class);

    private final boolean parallel;

    public DataFlowAnalyzerImpl() {
        this(false);
    }

    public DataFlowAnalyzerImpl(boolean parallel) {
        this.parallel = parallel;
    }

    private record FixedPoints(InOut<Set<Definition>> reachingDefinitions,
                               InOut<Set<String>> liveVariables,
                               InOut<Map<String, Object>> constants) {
    }

    @Override
    public DataFlowResult analyze(IrNode root, Map<String, ControlFlowGraph> cfgs) {
        Map<String, FixedPoints> fixedPoints = new ConcurrentHashMap<>();
        Stream<Map.Entry<String, ControlFlowGraph>> stream = parallel
                ? cfgs.entrySet().parallelStream() : cfgs.entrySet().stream();
        stream.forEach(e -> fixedPoints.put(e.getKey(), computeFixedPoints(e.getKey(), e.getValue())));

        Map<String, InOut<Set<Definition>>> reachingDefinitions = new LinkedHashMap<>();
        Map<String, InOut<Set<String>>> liveVariables = new LinkedHashMap<>();
        Map<String, Map<String, Map<String, Object>>> constantValues = new LinkedHashMap<>();
        Map<String, Map<String, Set<Definition>>> arrayDefinitions = new LinkedHashMap<>();
        Map<String, Map<String, List<IrNode>>> phiNodes = new LinkedHashMap<>();

        ConstantPropagation constantPropagation = new ConstantPropagation();
        ArrayAccessTracking arrayAccessTracking = new ArrayAccessTracking();
        PhiPlacement phiPlacement = new PhiPlacement();
        for (Map.Entry<String, ControlFlowGraph> entry : cfgs.entrySet()) {
            String name = entry.getKey();
            ControlFlowGraph cfg = entry.getValue();
            FixedPoints fp = fixedPoints.get(name);
            reachingDefinitions.put(name, fp.reachingDefinitions());
            liveVariables.put(name, fp.liveVariables());
            constantValues.put(name, fp.constants().out());

            int replaced = constantPropagation.substitute(cfg, fp.constants());
            LOGGER.debug("Replaced {} constant reads in {}", replaced, name);
            arrayDefinitions.put(name, arrayAccessTracking.compute(cfg));
            phiNodes.put(name, phiPlacement.insert(cfg, fp.reachingDefinitions()));
        }

        Map<String, Map<String, Set<Definition>>> interprocedural = new InterproceduralFlow()
                .compute(root, cfgs.values());
        return new DataFlowResultImpl(reachingDefinitions, liveVariables, constantValues, arrayDefinitions,
                phiNodes, interprocedural);
    }

    private static FixedPoints computeFixedPoints(String name, ControlFlowGraph cfg) {
        try {
            return new FixedPoints(new ReachingDefinitions().compute(cfg),
                    new LiveVariables().compute(cfg),
                    new ConstantPropagation().compute(cfg));
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception in data flow analysis of {}", name);
            throw new AnalyzerException(name, re);
        }
    }
}
