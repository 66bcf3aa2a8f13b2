package org.lapa.analyzer.controlflow;

import org.lapa.analyzer.ir.IrNode;

import java.util.*;

/*
A basic block, as a record in the arena of its control flow graph. Edges are stored as sets of block indices
on both sides; use ControlFlowGraph.successors(...) and predecessors(...) to navigate.

The statements are not owned: they remain children of the function subtree they come from. Synthesized statements
(phi nodes) are not part of any tree.
 */
public class BasicBlock {
    private final int index;
    private final String name;
    private final boolean joinPoint;
    private final List<IrNode> statements = new ArrayList<>();
    private final Set<Integer> successors = new LinkedHashSet<>();
    private final Set<Integer> predecessors = new LinkedHashSet<>();

    BasicBlock(int index, String name, boolean joinPoint) {
        this.index = index;
        this.name = name;
        this.joinPoint = joinPoint;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public boolean isJoinPoint() {
        return joinPoint;
    }

    public List<IrNode> statements() {
        return Collections.unmodifiableList(statements);
    }

    public void addStatement(IrNode statement) {
        statements.add(statement);
    }

    /**
     * Inserts the statements, in order, before the existing ones.
     */
    public void prependStatements(List<IrNode> newStatements) {
        statements.addAll(0, newStatements);
    }

    /**
     * Replaces a statement, by identity.
     *
     * @return false when the statement is not in this block
     */
    public boolean replaceStatement(IrNode oldStatement, IrNode newStatement) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == oldStatement) {
                statements.set(i, newStatement);
                return true;
            }
        }
        return false;
    }

    public Set<Integer> successorIndices() {
        return Collections.unmodifiableSet(successors);
    }

    public Set<Integer> predecessorIndices() {
        return Collections.unmodifiableSet(predecessors);
    }

    // called by ControlFlowGraph.addEdge only, so that both directions stay in sync
    void addSuccessor(int block) {
        successors.add(block);
    }

    void addPredecessor(int block) {
        predecessors.add(block);
    }

    @Override
    public String toString() {
        return name;
    }
}
