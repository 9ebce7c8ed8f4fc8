package com.adtdump.adt;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * An expression. Expressions may be embedded in structs and used as list elements.
 *
 * <p>Composite expressions are nested here; references and values have their own
 * families.
 */
public sealed interface Expr extends Decl, Elem
        permits Expr.StructLit, Expr.ListLit, Expr.UnaryExpr, Expr.BinaryExpr, Expr.CallExpr,
                Expr.Interpolation, Expr.DisjunctionExpr, Expr.BoundExpr, Expr.SelectorExpr,
                Expr.IndexExpr, Expr.SliceExpr, Reference, Value {

    record StructLit(ImmutableList<Decl> decls) implements Expr {
        public static StructLit of(Decl... decls) {
            return new StructLit(Lists.immutable.of(decls));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitStructLit(this);
        }
    }

    record ListLit(ImmutableList<Elem> elems) implements Expr {
        public static ListLit of(Elem... elems) {
            return new ListLit(Lists.immutable.of(elems));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitListLit(this);
        }
    }

    /** {@code -x}, {@code !x}, {@code +x} */
    record UnaryExpr(Op op, Expr x) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUnaryExpr(this);
        }
    }

    record BinaryExpr(Op op, Expr x, Expr y) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBinaryExpr(this);
        }
    }

    record CallExpr(Expr fun, ImmutableList<Expr> args) implements Expr {
        public static CallExpr of(Expr fun, Expr... args) {
            return new CallExpr(fun, Lists.immutable.of(args));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCallExpr(this);
        }
    }

    /**
     * A string with embedded expressions.
     *
     * <p>Parts alternate: even positions hold literal {@link Value.Str} segments, odd
     * positions hold the interpolated expressions. A well-formed interpolation starts and
     * ends with a literal segment, possibly empty.
     */
    record Interpolation(ImmutableList<Expr> parts) implements Expr {
        public static Interpolation of(Expr... parts) {
            return new Interpolation(Lists.immutable.of(parts));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitInterpolation(this);
        }
    }

    /**
     * An unevaluated disjunction {@code a | *b | c} as written in source.
     */
    record DisjunctionExpr(ImmutableList<Disjunct> values) implements Expr {
        public static DisjunctionExpr of(Disjunct... values) {
            return new DisjunctionExpr(Lists.immutable.of(values));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDisjunctionExpr(this);
        }
    }

    /** A bound whose operand is not yet evaluated, like {@code >=x}. */
    record BoundExpr(Op op, Expr expr) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBoundExpr(this);
        }
    }

    /** {@code x.sel} */
    record SelectorExpr(Expr x, Label sel) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSelectorExpr(this);
        }
    }

    /** {@code x[index]} */
    record IndexExpr(Expr x, Expr index) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIndexExpr(this);
        }
    }

    /**
     * {@code x[lo:hi:stride]}. Each bound may be null.
     */
    record SliceExpr(Expr x, Expr lo, Expr hi, Expr stride) implements Expr {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSliceExpr(this);
        }
    }
}
