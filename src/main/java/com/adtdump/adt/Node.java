package com.adtdump.adt;

/**
 * A node of an evaluated configuration graph.
 *
 * <p>The set of node kinds is closed. Every concrete kind has a matching method on
 * {@link NodeVisitor}, so adding a kind without teaching every visitor about it is a
 * compile error.
 */
public sealed interface Node permits Decl, Elem {
    void accept(NodeVisitor visitor);
}
