package org.lapa.analyzer.ir;

import org.lapa.analyzer.ir.rewrite.ConstantFolding;
import org.lapa.analyzer.ir.rewrite.DeadCodeElimination;
import org.lapa.analyzer.ir.rewrite.UnusedVariableRemoval;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Container of an IR tree: the PROGRAM root, plus the indices that front ends fill in while they build the tree.

The typed lists and the symbol table only contain the nodes registered through the addXxx methods; nodes added
directly to the root with addChild are part of the tree, and therefore of the whole-tree queries, but not of the
indices.
 */
public class Ir {
    private static final Logger LOGGER = LoggerFactory.getLogger(Ir.class);

    private final IrNode root = new IrNode(NodeKind.PROGRAM);
    private final Map<String, IrNode> symbolTable = new LinkedHashMap<>();
    private final Map<String, IrNode> typeInformation = new LinkedHashMap<>();
    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Set<String> imports = new LinkedHashSet<>();

    private final List<IrNode> functions = new ArrayList<>();
    private final List<IrNode> structs = new ArrayList<>();
    private final List<IrNode> enums = new ArrayList<>();
    private final List<IrNode> traits = new ArrayList<>();
    private final List<IrNode> macros = new ArrayList<>();
    private final List<IrNode> implementations = new ArrayList<>();
    private final List<IrNode> variables = new ArrayList<>();

    public IrNode root() {
        return root;
    }

    public Map<String, IrNode> symbolTable() {
        return Collections.unmodifiableMap(symbolTable);
    }

    public Map<String, IrNode> typeInformation() {
        return typeInformation;
    }

    public Set<String> imports() {
        return Collections.unmodifiableSet(imports);
    }

    public List<IrNode> functions() {
        return Collections.unmodifiableList(functions);
    }

    public List<IrNode> structs() {
        return Collections.unmodifiableList(structs);
    }

    public List<IrNode> enums() {
        return Collections.unmodifiableList(enums);
    }

    public List<IrNode> traits() {
        return Collections.unmodifiableList(traits);
    }

    public List<IrNode> macros() {
        return Collections.unmodifiableList(macros);
    }

    public List<IrNode> implementations() {
        return Collections.unmodifiableList(implementations);
    }

    public List<IrNode> variables() {
        return Collections.unmodifiableList(variables);
    }

    // -- registration

    public IrNode addFunction(IrNode function) {
        return register(function, functions, NodeKind.FUNCTION, NodeKind.FUNCTION_DEF);
    }

    public IrNode addStruct(IrNode struct) {
        return register(struct, structs, NodeKind.STRUCT);
    }

    public IrNode addEnum(IrNode enumeration) {
        return register(enumeration, enums, NodeKind.ENUM);
    }

    public IrNode addTrait(IrNode trait) {
        return register(trait, traits, NodeKind.TRAIT);
    }

    public IrNode addMacro(IrNode macro) {
        return register(macro, macros, NodeKind.MACRO);
    }

    public IrNode addImplementation(IrNode implementation) {
        return register(implementation, implementations, NodeKind.IMPLEMENTATION);
    }

    public IrNode addVariable(IrNode variable) {
        return register(variable, variables, NodeKind.VARIABLE);
    }

    private IrNode register(IrNode node, List<IrNode> list, NodeKind... accepted) {
        if (Arrays.stream(accepted).noneMatch(k -> k == node.kind())) {
            throw new IllegalArgumentException("Expected " + Arrays.toString(accepted) + ", got " + node);
        }
        root.addChild(node);
        list.add(node);
        if (node.name() != null) {
            symbolTable.put(node.name(), node);
        }
        return node;
    }

    public void addImport(String module) {
        imports.add(module);
        dependencies.add(module);
    }

    public void addDependency(String dependency) {
        dependencies.add(dependency);
    }

    public void clear() {
        for (IrNode child : List.copyOf(root.children())) {
            root.removeChild(child);
        }
        symbolTable.clear();
        typeInformation.clear();
        dependencies.clear();
        imports.clear();
        functions.clear();
        structs.clear();
        enums.clear();
        traits.clear();
        macros.clear();
        implementations.clear();
        variables.clear();
    }

    // -- whole-tree queries

    /**
     * @return every symbol in the tree, mapped to its defining node; when a name occurs more than once,
     * the last occurrence in pre-order wins.
     */
    public Map<String, IrNode> symbols() {
        Map<String, IrNode> result = new LinkedHashMap<>();
        collectSymbolNodes(root, result);
        return result;
    }

    private static void collectSymbolNodes(IrNode node, Map<String, IrNode> result) {
        if (node.kind().isSymbol() && node.name() != null) {
            result.put(node.name(), node);
        }
        for (IrNode child : node.children()) {
            collectSymbolNodes(child, result);
        }
    }

    public Map<String, IrNode> types() {
        Map<String, IrNode> result = new LinkedHashMap<>(typeInformation);
        result.putAll(root.types());
        return result;
    }

    public Set<String> dependencies() {
        Set<String> result = new LinkedHashSet<>(dependencies);
        result.addAll(root.dependencies());
        return result;
    }

    @Nullable
    public IrNode nodeByPosition(Position position) {
        return root.nodeByPosition(position);
    }

    // -- validation

    /**
     * Structural checks. Never throws.
     *
     * @return one message per problem: duplicate symbol names, symbol nodes without a name,
     * and parent links that do not point back to the node holding the child.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (String symbol : root.symbols()) {
            if (!seen.add(symbol) && reported.add(symbol)) {
                errors.add("Duplicate symbol: " + symbol);
            }
        }
        checkStructure(root, errors);
        return errors;
    }

    private static void checkStructure(IrNode node, List<String> errors) {
        if (node.kind().isSymbol() && node.name() == null) {
            errors.add("Symbol node without a name: " + node);
        }
        for (IrNode child : node.children()) {
            if (child.parent() != node) {
                errors.add("Broken parent link: " + child + " is a child of " + node + " but has parent "
                           + child.parent());
            }
            checkStructure(child, errors);
        }
    }

    public boolean validate() {
        List<String> errors = validationErrors();
        errors.forEach(LOGGER::warn);
        return errors.isEmpty();
    }

    /**
     * Runs constant folding, dead code elimination and unused variable removal, in that order, in place, and
     * repeats them until none of them changes the tree. Running it a second time leaves the tree unchanged.
     */
    public void optimize() {
        ConstantFolding constantFolding = new ConstantFolding();
        DeadCodeElimination deadCodeElimination = new DeadCodeElimination();
        UnusedVariableRemoval unusedVariableRemoval = new UnusedVariableRemoval();
        int rounds = 0;
        int changes;
        do {
            ++rounds;
            int folded = constantFolding.apply(root);
            int removedNoOps = deadCodeElimination.apply(root);
            int removedVariables = unusedVariableRemoval.apply(root);
            LOGGER.debug("Optimize round {}: folded {} constants, removed {} no-ops and {} unused variables",
                    rounds, folded, removedNoOps, removedVariables);
            changes = folded + removedNoOps + removedVariables;
        } while (changes > 0);
    }
}
