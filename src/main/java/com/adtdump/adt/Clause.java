package com.adtdump.adt;

/**
 * A comprehension clause. Clauses chain through {@code dst}; the chain ends in a
 * {@link ValueClause} holding the struct that each iteration yields.
 */
public sealed interface Clause extends Decl
        permits Clause.ForClause, Clause.IfClause, Clause.LetClause, Clause.ValueClause {

    /** {@code for key, value in src dst} */
    record ForClause(Label key, Label value, Expr src, Clause dst) implements Clause {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitForClause(this);
        }
    }

    /** {@code if condition dst} */
    record IfClause(Expr condition, Clause dst) implements Clause {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIfClause(this);
        }
    }

    /** {@code let label = expr dst} */
    record LetClause(Label label, Expr expr, Clause dst) implements Clause {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitLetClause(this);
        }
    }

    record ValueClause(Expr.StructLit struct) implements Clause {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitValueClause(this);
        }
    }
}
