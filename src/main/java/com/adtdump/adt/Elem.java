package com.adtdump.adt;

/**
 * An element of a list literal: an expression or a trailing {@link Ellipsis}.
 */
public sealed interface Elem extends Node permits Expr, Ellipsis {
}
