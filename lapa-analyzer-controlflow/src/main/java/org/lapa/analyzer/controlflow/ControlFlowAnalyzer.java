package org.lapa.analyzer.controlflow;

import org.lapa.analyzer.ir.Ir;
import org.lapa.analyzer.ir.IrNode;
import org.lapa.analyzer.ir.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static org.lapa.analyzer.ir.AttributeKeys.*;

/*
Builds one control flow graph per function-shaped node (FUNCTION, FUNCTION_DEF), at any depth in the tree.

The children of a function are laid out left to right, with a cursor that starts at the entry block:
- a plain statement gets a block of its own, block_N;
- a CONTROL_FLOW marker of type "if", optionally followed by a sibling of type "else", becomes a diamond
  if_block_N, [else_block_N,] end_block_N; without else, the block before the condition links directly to the end
  block;
- a LOOP becomes a header loop_block_N, holding the condition, and a join block after_loop_block_N; the last block
  of the body links back to the header;
- a CONTROL_FLOW marker of type "try" becomes try_block_N, end_block_N, one except_block_N per except clause, and
  optionally finally_block_N; any block inside the try can raise, so the except blocks are successors of try_block_N;
- any other CONTROL_FLOW marker is a plain statement.
The last cursor links to the exit block.

The builder never throws: missing conditions are skipped, unknown kinds are treated as plain statements.
 */
public class ControlFlowAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowAnalyzer.class);

    public static final String ANONYMOUS = "anonymous";

    /**
     * @return the graphs, keyed by function name, in pre-order of the functions. When two functions share a name,
     * the last one wins.
     */
    public Map<String, ControlFlowGraph> analyze(Ir ir) {
        return analyze(ir.root());
    }

    public Map<String, ControlFlowGraph> analyze(IrNode root) {
        Map<String, ControlFlowGraph> cfgs = new LinkedHashMap<>();
        for (IrNode function : functionNodes(root)) {
            ControlFlowGraph cfg = build(function);
            ControlFlowGraph previous = cfgs.put(cfg.name(), cfg);
            if (previous != null) {
                LOGGER.debug("Function name {} occurs more than once, keeping the last graph", cfg.name());
            }
        }
        return cfgs;
    }

    public static List<IrNode> functionNodes(IrNode root) {
        List<IrNode> result = new ArrayList<>();
        collectFunctionNodes(root, result);
        return result;
    }

    private static void collectFunctionNodes(IrNode node, List<IrNode> result) {
        if (node.kind().isFunction()) result.add(node);
        for (IrNode child : node.children()) {
            collectFunctionNodes(child, result);
        }
    }

    public static String functionName(IrNode function) {
        return function.name() == null ? ANONYMOUS : function.name();
    }

    public ControlFlowGraph build(IrNode function) {
        ControlFlowGraph cfg = new ControlFlowGraph(functionName(function));
        BasicBlock last = layout(function.children(), cfg.entry(), cfg);
        cfg.addEdge(last, cfg.exit());
        LOGGER.debug("Built {}, {} edges", cfg, cfg.edgeCount());
        return cfg;
    }

    private BasicBlock layout(List<IrNode> nodes, BasicBlock start, ControlFlowGraph cfg) {
        BasicBlock current = start;
        int i = 0;
        while (i < nodes.size()) {
            IrNode node = nodes.get(i);
            if (node.kind() == NodeKind.CONTROL_FLOW && CF_IF.equals(node.attribute(TYPE))) {
                IrNode next = i + 1 < nodes.size() ? nodes.get(i + 1) : null;
                if (next != null && next.kind() == NodeKind.CONTROL_FLOW && CF_ELSE.equals(next.attribute(TYPE))) {
                    current = ifElse(node, next, current, cfg);
                    ++i;
                } else {
                    current = ifWithoutElse(node, current, cfg);
                }
            } else if (node.kind() == NodeKind.CONTROL_FLOW && CF_TRY.equals(node.attribute(TYPE))) {
                current = tryExceptFinally(node, current, cfg);
            } else if (node.kind() == NodeKind.LOOP) {
                current = loop(node, current, cfg);
            } else {
                current = statement(node, current, cfg);
            }
            ++i;
        }
        return current;
    }

    private static BasicBlock statement(IrNode node, BasicBlock current, ControlFlowGraph cfg) {
        BasicBlock block = cfg.newBlock("block", false);
        block.addStatement(node);
        cfg.addEdge(current, block);
        return block;
    }

    private static void addCondition(IrNode node, BasicBlock block) {
        IrNode condition = node.nodeAttribute(CONDITION);
        if (condition != null) block.addStatement(condition);
    }

    private BasicBlock ifWithoutElse(IrNode ifNode, BasicBlock current, ControlFlowGraph cfg) {
        addCondition(ifNode, current);
        BasicBlock ifBlock = cfg.newBlock("if_block", false);
        BasicBlock endBlock = cfg.newBlock("end_block", true);
        cfg.addEdge(current, ifBlock);
        cfg.addEdge(current, endBlock);
        BasicBlock ifEnd = layout(ifNode.children(), ifBlock, cfg);
        cfg.addEdge(ifEnd, endBlock);
        return endBlock;
    }

    private BasicBlock ifElse(IrNode ifNode, IrNode elseNode, BasicBlock current, ControlFlowGraph cfg) {
        addCondition(ifNode, current);
        BasicBlock ifBlock = cfg.newBlock("if_block", false);
        BasicBlock elseBlock = cfg.newBlock("else_block", false);
        BasicBlock endBlock = cfg.newBlock("end_block", true);
        cfg.addEdge(current, ifBlock);
        cfg.addEdge(current, elseBlock);
        BasicBlock ifEnd = layout(ifNode.children(), ifBlock, cfg);
        cfg.addEdge(ifEnd, endBlock);
        BasicBlock elseEnd = layout(elseNode.children(), elseBlock, cfg);
        cfg.addEdge(elseEnd, endBlock);
        return endBlock;
    }

    /*
    The header's edge to the first block of the body is added by the layout of the body. When the body is empty,
    the back edge becomes a self-loop on the header.
     */
    private BasicBlock loop(IrNode loopNode, BasicBlock current, ControlFlowGraph cfg) {
        BasicBlock header = cfg.newBlock("loop_block", false);
        cfg.addEdge(current, header);
        addCondition(loopNode, header);
        BasicBlock afterLoop = cfg.newBlock("after_loop_block", true);
        BasicBlock bodyEnd = layout(loopNode.children(), header, cfg);
        cfg.addEdge(header, afterLoop);
        cfg.addEdge(bodyEnd, header);
        return afterLoop;
    }

    private BasicBlock tryExceptFinally(IrNode tryNode, BasicBlock current, ControlFlowGraph cfg) {
        BasicBlock tryBlock = cfg.newBlock("try_block", false);
        cfg.addEdge(current, tryBlock);

        List<IrNode> content = new ArrayList<>();
        List<IrNode> excepts = new ArrayList<>();
        IrNode finallyNode = null;
        for (IrNode child : tryNode.children()) {
            Object type = child.kind() == NodeKind.CONTROL_FLOW ? child.attribute(TYPE) : null;
            if (CF_EXCEPT.equals(type)) {
                excepts.add(child);
            } else if (CF_FINALLY.equals(type)) {
                finallyNode = child;
            } else {
                content.add(child);
            }
        }

        BasicBlock contentEnd = layout(content, tryBlock, cfg);
        BasicBlock endBlock = cfg.newBlock("end_block", true);

        List<BasicBlock> exceptBlocks = new ArrayList<>(excepts.size());
        for (IrNode except : excepts) {
            BasicBlock exceptBlock = cfg.newBlock("except_block", false);
            BasicBlock exceptEnd = layout(except.children(), exceptBlock, cfg);
            cfg.addEdge(exceptEnd, endBlock);
            exceptBlocks.add(exceptBlock);
        }

        if (finallyNode != null) {
            BasicBlock finallyBlock = cfg.newBlock("finally_block", false);
            BasicBlock finallyEnd = layout(finallyNode.children(), finallyBlock, cfg);
            cfg.addEdge(finallyEnd, cfg.exit());
            cfg.addEdge(endBlock, finallyBlock);
        } else {
            cfg.addEdge(endBlock, cfg.exit());
        }

        cfg.addEdge(contentEnd, endBlock);
        for (BasicBlock exceptBlock : exceptBlocks) {
            cfg.addEdge(tryBlock, exceptBlock);
        }
        if (exceptBlocks.isEmpty()) {
            cfg.addEdge(tryBlock, endBlock);
        }
        return endBlock;
    }
}
