package org.lapa.analyzer.ir;

/**
 * Source position of a node, as reported by the front end.
 */
public record Position(int line, int column, String file) {

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
