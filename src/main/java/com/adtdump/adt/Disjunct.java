package com.adtdump.adt;

/**
 * One branch of a {@link Expr.DisjunctionExpr}.
 *
 * @param value the branch expression
 * @param isDefault whether the branch was marked with {@code *}
 */
public record Disjunct(Expr value, boolean isDefault) {
    public static Disjunct of(Expr value) {
        return new Disjunct(value, false);
    }

    public static Disjunct defaultOf(Expr value) {
        return new Disjunct(value, true);
    }
}
