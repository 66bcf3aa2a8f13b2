package org.lapa.analyzer.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/*
A node of the intermediate representation.

Nodes are compared and hashed by identity: equals and hashCode are deliberately not overridden, and every map
that holds analysis results keys on the node object itself. The id is stable for the lifetime of the node and
only serves printing and deterministic ordering.

The children are owned: for every child c of p, c.parent() == p. Nodes referenced from the attribute map are not
owned, and may be shared between several attributes or not be part of the tree at all.
 */
public final class IrNode {
    private static final AtomicInteger ID_GENERATOR = new AtomicInteger();

    private final int id;
    private final NodeKind kind;
    private final String name;
    private final Position position;
    private final Map<String, Object> attributes;
    private final List<IrNode> children = new ArrayList<>();
    private IrNode parent;

    public IrNode(NodeKind kind) {
        this(kind, null, null, null);
    }

    public IrNode(NodeKind kind, String name) {
        this(kind, name, null, null);
    }

    public IrNode(NodeKind kind, String name, Map<String, Object> attributes) {
        this(kind, name, null, attributes);
    }

    public IrNode(@NotNull NodeKind kind, String name, Position position, Map<String, Object> attributes) {
        this.id = ID_GENERATOR.incrementAndGet();
        this.kind = Objects.requireNonNull(kind);
        this.name = name;
        this.position = position;
        this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public Position position() {
        return position;
    }

    public IrNode parent() {
        return parent;
    }

    public List<IrNode> children() {
        return Collections.unmodifiableList(children);
    }

    // -- attributes

    /**
     * @return the live attribute map; passes that rewrite expressions in place write into it.
     */
    public Map<String, Object> attributes() {
        return attributes;
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public IrNode setAttribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    /**
     * @return the attribute value if it is a node, null otherwise
     */
    @Nullable
    public IrNode nodeAttribute(String key) {
        return attributes.get(key) instanceof IrNode node ? node : null;
    }

    /**
     * @return the attribute value if it is a string, null otherwise
     */
    @Nullable
    public String stringAttribute(String key) {
        return attributes.get(key) instanceof String s ? s : null;
    }

    /**
     * Nodes held by a list-valued attribute. A single node is returned as a singleton list; elements that
     * are not nodes are skipped.
     */
    public List<IrNode> nodeListAttribute(String key) {
        Object value = attributes.get(key);
        if (value instanceof IrNode node) return List.of(node);
        if (value instanceof Collection<?> collection) {
            List<IrNode> list = new ArrayList<>(collection.size());
            for (Object o : collection) {
                if (o instanceof IrNode node) list.add(node);
            }
            return list;
        }
        return List.of();
    }

    /**
     * The values of a list-valued attribute, nodes and non-nodes alike, in order.
     */
    public List<Object> listAttribute(String key) {
        Object value = attributes.get(key);
        if (value instanceof List<?> list) return new ArrayList<>(list);
        if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
        if (value == null) return List.of();
        return List.of(value);
    }

    /**
     * @return the name of a node, falling back on its NAME attribute, as some front ends store it there.
     */
    public String nameOrNameAttribute() {
        if (name != null) return name;
        return stringAttribute(AttributeKeys.NAME);
    }

    // -- tree structure

    /**
     * Appends a child.
     *
     * @throws IllegalArgumentException when the child already has a parent; remove it there first.
     */
    public IrNode addChild(@NotNull IrNode child) {
        if (child == this) throw new IllegalArgumentException("Cannot add a node to itself");
        if (child.parent != null) {
            throw new IllegalArgumentException("Node " + child + " already has parent " + child.parent);
        }
        children.add(child);
        child.parent = this;
        return this;
    }

    public boolean removeChild(IrNode child) {
        Iterator<IrNode> iterator = children.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() == child) {
                iterator.remove();
                child.parent = null;
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces a child by a new node, at the same index.
     *
     * @return false when oldChild is not a child of this node; nothing changes in that case.
     */
    public boolean replaceChild(IrNode oldChild, @NotNull IrNode newChild) {
        if (oldChild == newChild) return children.contains(oldChild);
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == oldChild) {
                if (newChild.parent != null) {
                    throw new IllegalArgumentException("Node " + newChild + " already has parent " + newChild.parent);
                }
                children.set(i, newChild);
                newChild.parent = this;
                oldChild.parent = null;
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every child that matches; used by the tree rewrites.
     *
     * @return the number of children removed
     */
    public int removeChildrenIf(Predicate<IrNode> predicate) {
        int removed = 0;
        Iterator<IrNode> iterator = children.iterator();
        while (iterator.hasNext()) {
            IrNode child = iterator.next();
            if (predicate.test(child)) {
                iterator.remove();
                child.parent = null;
                ++removed;
            }
        }
        return removed;
    }

    // -- whole-subtree queries

    /**
     * @return the names of all symbols defined in this subtree, in pre-order, duplicates included.
     */
    public List<String> symbols() {
        List<String> symbols = new ArrayList<>();
        collectSymbols(symbols);
        return symbols;
    }

    private void collectSymbols(List<String> symbols) {
        if (kind.isSymbol() && name != null) {
            symbols.add(name);
        }
        for (IrNode child : children) {
            child.collectSymbols(symbols);
        }
    }

    /**
     * @return every type name found in a TYPE or RETURN_TYPE attribute of this subtree, mapped to the node
     * that mentions it. A later mention overrides an earlier one.
     */
    public Map<String, IrNode> types() {
        Map<String, IrNode> types = new LinkedHashMap<>();
        collectTypes(types);
        return types;
    }

    private void collectTypes(Map<String, IrNode> types) {
        String type = typeName(attributes.get(AttributeKeys.TYPE));
        if (type != null) types.put(type, this);
        String returnType = typeName(attributes.get(AttributeKeys.RETURN_TYPE));
        if (returnType != null) types.put(returnType, this);
        for (IrNode child : children) {
            child.collectTypes(types);
        }
    }

    private static String typeName(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof IrNode node) return node.name();
        return null;
    }

    /**
     * @return the external dependencies, i.e., the SOURCE attributes, of this subtree
     */
    public Set<String> dependencies() {
        Set<String> dependencies = new LinkedHashSet<>();
        collectDependencies(dependencies);
        return dependencies;
    }

    private void collectDependencies(Set<String> dependencies) {
        if (attributes.get(AttributeKeys.SOURCE) instanceof String source) {
            dependencies.add(source);
        }
        for (IrNode child : children) {
            child.collectDependencies(dependencies);
        }
    }

    public List<IrNode> findNodesByKind(NodeKind nodeKind) {
        List<IrNode> nodes = new ArrayList<>();
        collectNodesByKind(nodeKind, nodes);
        return nodes;
    }

    private void collectNodesByKind(NodeKind nodeKind, List<IrNode> nodes) {
        if (kind == nodeKind) nodes.add(this);
        for (IrNode child : children) {
            child.collectNodesByKind(nodeKind, nodes);
        }
    }

    /*
    Depth-first, pre-order: the first node on the same file and line whose column is not beyond the query column.
    This is not necessarily the innermost node enclosing the position; an outer node starting earlier on the
    same line wins.
     */
    @Nullable
    public IrNode nodeByPosition(@NotNull Position query) {
        if (position != null
            && Objects.equals(position.file(), query.file())
            && position.line() == query.line()
            && position.column() <= query.column()) {
            return this;
        }
        for (IrNode child : children) {
            IrNode result = child.nodeByPosition(query);
            if (result != null) return result;
        }
        return null;
    }

    /**
     * @return "KIND:name", the label used in graph output
     */
    public String label() {
        return kind.name() + ":" + name;
    }

    @Override
    public String toString() {
        return label() + "#" + id;
    }
}
