package com.adtdump.adt;

/**
 * Evaluation scope of a conjunct: the vertex providing the scope and the enclosing
 * environment, which references with a non-zero up-count resolve through.
 *
 * @param up enclosing environment, or null for the outermost scope
 * @param vertex vertex whose fields are in scope
 */
public record Environment(Environment up, Vertex vertex) {
}
