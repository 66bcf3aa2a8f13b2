package org.lapa.analyzer.structure.dependency;

import org.lapa.analyzer.ir.IrNode;

import java.util.*;

/*
Result of the dependency analysis: for every node that was visited, the nodes it depends on, in the order in which
they were found; and the circular dependencies detected between class definitions.

Direction of an edge: from -> to means "from needs to to exist first".
 */
public class DependencyGraph {

    private final Map<IrNode, Set<IrNode>> dependencies;
    private final List<Set<IrNode>> circularDependencies;

    DependencyGraph(Map<IrNode, Set<IrNode>> dependencies, List<Set<IrNode>> circularDependencies) {
        this.dependencies = dependencies;
        this.circularDependencies = circularDependencies;
    }

    public Map<IrNode, Set<IrNode>> dependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * @return the nodes this node depends on; empty when the node was never visited
     */
    public Set<IrNode> dependenciesOf(IrNode node) {
        Set<IrNode> set = dependencies.get(node);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    public List<Set<IrNode>> circularDependencies() {
        return Collections.unmodifiableList(circularDependencies);
    }

    public int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public String toString() {
        return "DependencyGraph{" + dependencies.size() + " nodes, " + edgeCount() + " edges, "
               + circularDependencies.size() + " cycles}";
    }
}
