package org.lapa.analyzer.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Literal value with tuple shape. Lists, sets and maps use the standard collection interfaces; tuples need
 * their own type so that type inference can tell them apart.
 */
public record Tuple(List<Object> elements) {

    public Tuple {
        elements = List.copyOf(elements);
    }

    public static Tuple of(Object... elements) {
        return new Tuple(List.of(elements));
    }

    @Override
    public String toString() {
        return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
