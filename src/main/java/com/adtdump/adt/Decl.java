package com.adtdump.adt;

/**
 * A declaration inside a struct literal.
 *
 * <p>Besides the field forms nested here, an embedded expression, an {@link Ellipsis} and
 * a comprehension {@link Clause} are declarations too.
 */
public sealed interface Decl extends Node
        permits Decl.Field, Decl.OptionalField, Decl.BulkOptionalField, Decl.DynamicField,
                Ellipsis, Expr, Clause {

    /** {@code label: value} */
    record Field(Label label, Expr value) implements Decl {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitField(this);
        }
    }

    /** {@code label?: value} */
    record OptionalField(Label label, Expr value) implements Decl {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitOptionalField(this);
        }
    }

    /**
     * {@code [filter]: value}, applying value to every field whose label matches filter.
     */
    record BulkOptionalField(Expr filter, Expr value) implements Decl {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBulkOptionalField(this);
        }
    }

    /**
     * A field whose label is computed, {@code (key): value} in source form.
     */
    record DynamicField(Expr key, Expr value, boolean optional) implements Decl {
        public DynamicField(Expr key, Expr value) {
            this(key, value, false);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDynamicField(this);
        }
    }
}
