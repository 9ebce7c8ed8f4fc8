package com.adtdump.adt;

/**
 * {@code ...} in a struct or list, optionally constraining the remaining elements.
 *
 * @param value element constraint, or null for a bare ellipsis
 */
public record Ellipsis(Expr value) implements Decl, Elem {
    public static Ellipsis bare() {
        return new Ellipsis(null);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitEllipsis(this);
    }
}
