package org.lapa.analyzer.dataflow;

import java.util.Map;

/**
 * The in and out sets of every block of one function, keyed by block name.
 */
public record InOut<T>(Map<String, T> in, Map<String, T> out) {

    public T in(String block) {
        return in.get(block);
    }

    public T out(String block) {
        return out.get(block);
    }
}
