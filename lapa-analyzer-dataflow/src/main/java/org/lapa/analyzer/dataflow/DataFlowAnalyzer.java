package org.lapa.analyzer.dataflow;

import org.lapa.analyzer.controlflow.ControlFlowGraph;
import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;

import java.util.Map;

/*
Classical iterative data flow analysis over the control flow graphs of all functions.

Per function, in this order: reaching definitions, live variables, constant propagation (which substitutes known
constants in the tree), array access tracking, phi placement (which prepends phi nodes to the statements of the
join blocks). Then one inter-procedural pass over all functions.

Phi placement runs last, so live variables and constant propagation computed in the same run do not see the phi
nodes. Running the analysis a second time on the same graphs does.
 */
public interface DataFlowAnalyzer {

    default DataFlowResult analyze(Ir ir, Map<String, ControlFlowGraph> cfgs) {
        return analyze(ir.root(), cfgs);
    }

    DataFlowResult analyze(IrNode root, Map<String, ControlFlowGraph> cfgs);
}
