package com.adtdump.adt;

/**
 * One expression contributing to a vertex's value, paired with the environment it is
 * evaluated in.
 *
 * @param env originating environment, or null at the top level
 * @param expr the contributed expression
 */
public record Conjunct(Environment env, Expr expr) {
}
