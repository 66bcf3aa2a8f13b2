package org.lapa.analyzer.structure.typeinference;

import org.lapa.analyzer.ir.Tuple;
import org.lapa.analyzer.ir.util.Operators;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The type tags of the inference, and the operations on them. Tags are plain strings: the concrete tags
 * {@code bool}, {@code int}, {@code float}, {@code str}, the parametrized tags {@code List[T]}, {@code Set[T]},
 * {@code Dict[K, V]}, {@code Tuple[A, B, ...]}, class names, and the two extremes {@link #UNKNOWN} and {@link #ANY}.
 */
public final class TypeTags {

    public static final String UNKNOWN = "unknown";
    public static final String ANY = "Any";
    public static final String VOID = "void";
    public static final String BOOL = "bool";
    public static final String INT = "int";
    public static final String FLOAT = "float";
    public static final String STR = "str";

    private TypeTags() {
    }

    public static String list(String elementType) {
        return "List[" + elementType + "]";
    }

    public static String set(String elementType) {
        return "Set[" + elementType + "]";
    }

    public static String dict(String keyType, String valueType) {
        return "Dict[" + keyType + ", " + valueType + "]";
    }

    public static String tuple(List<String> elementTypes) {
        return "Tuple[" + String.join(", ", elementTypes) + "]";
    }

    /**
     * Merges the types of the elements of a collection.
     * <ul>
     *     <li>all equal: that type;</li>
     *     <li>one concrete type next to {@link #UNKNOWN}: the concrete type;</li>
     *     <li>two or more concrete types next to {@link #UNKNOWN}: {@link #UNKNOWN};</li>
     *     <li>otherwise, including the empty list: {@link #ANY}.</li>
     * </ul>
     */
    public static String unify(List<String> types) {
        Set<String> distinct = new LinkedHashSet<>(types);
        if (distinct.size() == 1) return types.get(0);
        if (distinct.remove(UNKNOWN)) {
            return distinct.size() == 1 ? distinct.iterator().next() : UNKNOWN;
        }
        return ANY;
    }

    /**
     * Tag of a literal value, from its Java type.
     */
    public static String ofValue(Object value) {
        if (value instanceof Boolean) return BOOL;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
            || value instanceof BigInteger) {
            return INT;
        }
        if (value instanceof Double || value instanceof Float) return FLOAT;
        if (value instanceof String || value instanceof Character) return STR;
        if (value instanceof Tuple tuple) {
            return tuple(tuple.elements().stream().map(TypeTags::ofValue).toList());
        }
        if (value instanceof List<?> list) return list(unifyValues(list));
        if (value instanceof Set<?> set) return set(unifyValues(set));
        if (value instanceof Map<?, ?> map) {
            return dict(unifyValues(map.keySet()), unifyValues(map.values()));
        }
        return UNKNOWN;
    }

    private static String unifyValues(Collection<?> values) {
        return unify(values.stream().map(TypeTags::ofValue).collect(Collectors.toList()));
    }

    /*
    Equal operand types: arithmetic keeps the type, comparison gives bool.
    Different operand types: unknown on either side wins; otherwise float, then int, promote arithmetic, and
    comparison gives bool.
     */
    public static String resolveBinary(String operator, String left, String right) {
        boolean arithmetic = Operators.isArithmetic(operator);
        boolean comparison = Operators.isComparison(operator);
        if (Objects.equals(left, right)) {
            if (arithmetic) return left;
            if (comparison) return BOOL;
            return UNKNOWN;
        }
        if (UNKNOWN.equals(left) || UNKNOWN.equals(right)) return UNKNOWN;
        if (FLOAT.equals(left) || FLOAT.equals(right) || INT.equals(left) || INT.equals(right)) {
            if (arithmetic) return FLOAT.equals(left) || FLOAT.equals(right) ? FLOAT : INT;
            if (comparison) return BOOL;
        }
        return UNKNOWN;
    }
}
