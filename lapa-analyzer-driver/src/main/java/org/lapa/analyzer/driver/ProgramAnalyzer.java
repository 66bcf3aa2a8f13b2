package org.lapa.analyzer.driver;

import org.lapa.analyzer.controlflow.CfgDotWriter;
import org.lapa.analyzer.controlflow.ControlFlowAnalyzer;
import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.dataflow.DataFlowResult;
import org.lapa.analyzer.dataflow.impl.DataFlowAnalyzerImpl;
import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.io.IrDotWriter;
import org.lapa.analyzer.structure.dependency.DependencyAnalyzer;
import org.lapa.analyzer.structure.dependency.DependencyGraph;
import org.lapa.analyzer.structure.typeinference.TypeInferenceAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/*
Runs all analyses on one IR, in a fixed order:
validate (optional) -> optimize (optional) -> control flow -> data flow -> dependencies -> type inference.

Optimization and the data flow analysis modify the tree in place; the later passes see the modified tree.
 */
public class ProgramAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgramAnalyzer.class);

    private final Options options;

    public ProgramAnalyzer() {
        this(new Options.Builder().build());
    }

    public ProgramAnalyzer(Options options) {
        this.options = options;
    }

    public record Options(boolean optimize, boolean parallel, boolean validate) {
        public static class Builder {
            boolean optimize;
            boolean parallel;
            boolean validate = true;

            public Builder setOptimize(boolean optimize) {
                this.optimize = optimize;
                return this;
            }

            public Builder setParallel(boolean parallel) {
                this.parallel = parallel;
                return this;
            }

            public Builder setValidate(boolean validate) {
                this.validate = validate;
                return this;
            }

            public Options build() {
                return new Options(optimize, parallel, validate);
            }
        }
    }

    /**
     * @param valid true when validation was switched off, or when it found no problems
     */
    public record Result(boolean valid,
                         Map<String, ControlFlowGraph> controlFlowGraphs,
                         DataFlowResult dataFlow,
                         DependencyGraph dependencyGraph,
                         Map<IrNode, String> types) {

        public String controlFlowDot(String function) {
            ControlFlowGraph cfg = controlFlowGraphs.get(function);
            return cfg == null ? null : new CfgDotWriter().write(cfg);
        }
    }

    public Options options() {
        return options;
    }

    public Result analyze(Ir ir) {
        boolean valid = true;
        if (options.validate()) {
            valid = ir.validate();
            if (!valid) LOGGER.info("Validation reported problems, continuing");
        }
        if (options.optimize()) {
            ir.optimize();
        }
        LOGGER.info("Start control flow analysis");
        Map<String, ControlFlowGraph> cfgs = new ControlFlowAnalyzer().analyze(ir);
        int blocks = cfgs.values().stream().mapToInt(ControlFlowGraph::size).sum();
        LOGGER.info("Built {} control flow graphs, {} blocks", cfgs.size(), blocks);

        LOGGER.info("Start data flow analysis");
        DataFlowResult dataFlow = new DataFlowAnalyzerImpl(options.parallel()).analyze(ir, cfgs);
        LOGGER.info("Data flow analysis done, {} phi nodes inserted", dataFlow.phiCount());

        LOGGER.info("Start dependency analysis");
        DependencyGraph dependencyGraph = new DependencyAnalyzer().analyze(ir);
        LOGGER.info("Dependency analysis done, {} cycles", dependencyGraph.circularDependencies().size());

        LOGGER.info("Start type inference");
        Map<IrNode, String> types = new TypeInferenceAnalyzer().analyze(ir);
        LOGGER.info("Done, types inferred for {} nodes", types.size());

        return new Result(valid, cfgs, dataFlow, dependencyGraph, types);
    }

    public static String irDot(Ir ir) {
        return new IrDotWriter().write(ir.root());
    }
}
