package org.lapa.analyzer.controlflow;

import java.util.*;

/*
Control flow graph of one function.

Blocks live in an arena, a list indexed by BasicBlock.index(); edges refer to indices, so the graph may contain
cycles (loop back edges) without the blocks referring to each other. The list order is the allocation order:
entry, exit, then the blocks in the order the builder creates them. The data flow passes iterate in that order.

Block names are unique within a graph. Apart from the two sentinels, they end in the value of a counter that
starts at 1 and is shared by all kinds of block.
 */
public class ControlFlowGraph {
    public static final String ENTRY = "entry";
    public static final String EXIT = "exit";

    private final String name;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<String, BasicBlock> blocksByName = new LinkedHashMap<>();
    private final BasicBlock entry;
    private final BasicBlock exit;
    private int blockCounter = 1;

    public ControlFlowGraph(String name) {
        this.name = name;
        this.entry = add(ENTRY, false);
        this.exit = add(EXIT, false);
    }

    public String name() {
        return name;
    }

    public BasicBlock entry() {
        return entry;
    }

    public BasicBlock exit() {
        return exit;
    }

    /**
     * @return all blocks, in allocation order
     */
    public List<BasicBlock> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BasicBlock block(String blockName) {
        return blocksByName.get(blockName);
    }

    public BasicBlock block(int index) {
        return blocks.get(index);
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Allocates a new block named prefix_N, N being the next value of the counter.
     */
    public BasicBlock newBlock(String prefix, boolean joinPoint) {
        return add(prefix + "_" + blockCounter++, joinPoint);
    }

    private BasicBlock add(String blockName, boolean joinPoint) {
        BasicBlock block = new BasicBlock(blocks.size(), blockName, joinPoint);
        blocks.add(block);
        blocksByName.put(blockName, block);
        return block;
    }

    public void addEdge(BasicBlock from, BasicBlock to) {
        from.addSuccessor(to.index());
        to.addPredecessor(from.index());
    }

    public List<BasicBlock> successors(BasicBlock block) {
        return block.successorIndices().stream().map(blocks::get).toList();
    }

    public List<BasicBlock> predecessors(BasicBlock block) {
        return block.predecessorIndices().stream().map(blocks::get).toList();
    }

    public boolean hasEdge(String from, String to) {
        BasicBlock f = blocksByName.get(from);
        BasicBlock t = blocksByName.get(to);
        return f != null && t != null && f.successorIndices().contains(t.index());
    }

    public int edgeCount() {
        return blocks.stream().mapToInt(b -> b.successorIndices().size()).sum();
    }

    @Override
    public String toString() {
        return "CFG " + name + ", " + blocks.size() + " blocks";
    }
}
