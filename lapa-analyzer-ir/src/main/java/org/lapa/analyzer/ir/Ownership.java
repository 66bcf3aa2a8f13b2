package org.lapa.analyzer.ir;

/*
Ownership information attached to variables by front ends of languages that have it (Rust, C++).
No analysis in this code base interprets it; it travels with the node.
 */
public record Ownership(boolean mutable, boolean reference, String lifetime) {

    public static final Ownership DEFAULT = new Ownership(false, false, null);
}
