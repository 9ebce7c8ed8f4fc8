package com.adtdump.adt;

/**
 * A reference to another position in the graph.
 *
 * <p>References carry display information only; they are resolved by the evaluator, never
 * by code that reads the graph. {@code upCount} is the number of scopes between the
 * reference and the scope it refers to.
 */
public sealed interface Reference extends Expr
        permits Reference.FieldReference, Reference.LabelReference, Reference.DynamicReference,
                Reference.ImportReference, Reference.LetReference {

    record FieldReference(Label label, int upCount) implements Reference {
        public FieldReference(Label label) {
            this(label, 0);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFieldReference(this);
        }
    }

    /**
     * Refers to the label of an enclosing field, as bound by an alias on a bulk field.
     *
     * @param source name of the identifier that declared the alias, or null when the
     *               reference was synthesized
     */
    record LabelReference(String source, int upCount) implements Reference {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitLabelReference(this);
        }
    }

    /**
     * Refers to a field whose label is itself computed.
     *
     * @param label expression yielding the label
     */
    record DynamicReference(Expr label, int upCount) implements Reference {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDynamicReference(this);
        }
    }

    record ImportReference(Label importPath) implements Reference {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitImportReference(this);
        }
    }

    record LetReference(Label label, int upCount) implements Reference {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitLetReference(this);
        }
    }
}
