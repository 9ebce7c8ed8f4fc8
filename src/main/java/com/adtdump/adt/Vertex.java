package com.adtdump.adt;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A position in the evaluated graph.
 *
 * <p>A vertex holds its child arcs and either a resolved value or, while still
 * unresolved, the conjuncts that will make up its value. A resolved struct or list is
 * represented by a {@link Value.StructMarker} or {@link Value.ListMarker} value with the
 * fields or elements as arcs.
 *
 * <p>Vertices are snapshots: once built they do not change. Equality is identity.
 */
public final class Vertex implements Value {
    private final Label label;
    private final Value value;
    private final ImmutableList<Vertex> arcs;
    private final ImmutableList<Conjunct> conjuncts;

    private Vertex(Label label, Value value, ImmutableList<Vertex> arcs, ImmutableList<Conjunct> conjuncts) {
        this.label = label;
        this.value = value;
        this.arcs = arcs;
        this.conjuncts = conjuncts;
    }

    public static Builder builder(Label label) {
        return new Builder(label);
    }

    /** Root vertex, which has no label. */
    public static Builder root() {
        return new Builder(Label.INVALID);
    }

    /** A leaf vertex resolved to {@code value}. */
    public static Vertex leaf(Label label, Value value) {
        return builder(label).value(value).build();
    }

    public Label label() {
        return label;
    }

    /**
     * @return the resolved value, or null if the vertex has not been evaluated
     */
    public Value value() {
        return value;
    }

    public ImmutableList<Vertex> arcs() {
        return arcs;
    }

    public ImmutableList<Conjunct> conjuncts() {
        return conjuncts;
    }

    public boolean isResolved() {
        return value != null;
    }

    public boolean isStruct() {
        return value instanceof Value.StructMarker;
    }

    public boolean isList() {
        return value instanceof Value.ListMarker;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitVertex(this);
    }

    @Override
    public String toString() {
        return "Vertex[label=" + label + ", arcs=" + arcs.size() + ", conjuncts=" + conjuncts.size()
            + (value != null ? ", value=" + value.getClass().getSimpleName() : "") + "]";
    }

    public static final class Builder {
        private final Label label;
        private Value value;
        private final MutableList<Vertex> arcs = Lists.mutable.empty();
        private final MutableList<Conjunct> conjuncts = Lists.mutable.empty();

        private Builder(Label label) {
            this.label = label;
        }

        public Builder value(Value value) {
            this.value = value;
            return this;
        }

        /** Marks the vertex as a resolved struct. */
        public Builder struct() {
            return value(new Value.StructMarker());
        }

        /** Marks the vertex as a resolved list. */
        public Builder list() {
            return value(new Value.ListMarker());
        }

        public Builder arc(Vertex arc) {
            arcs.add(arc);
            return this;
        }

        public Builder arc(Label label, Value value) {
            return arc(leaf(label, value));
        }

        /** Appends a list element; its label is the next index. */
        public Builder element(Value value) {
            return arc(leaf(Label.index(arcs.size()), value));
        }

        public Builder conjunct(Conjunct conjunct) {
            conjuncts.add(conjunct);
            return this;
        }

        public Builder conjunct(Expr expr) {
            return conjunct(new Conjunct(null, expr));
        }

        public Vertex build() {
            return new Vertex(label, value, arcs.toImmutable(), conjuncts.toImmutable());
        }
    }
}
