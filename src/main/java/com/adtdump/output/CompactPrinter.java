package com.adtdump.output;

import com.adtdump.adt.Clause;
import com.adtdump.adt.Conjunct;
import com.adtdump.adt.Decl;
import com.adtdump.adt.Disjunct;
import com.adtdump.adt.Ellipsis;
import com.adtdump.adt.Expr;
import com.adtdump.adt.Label;
import com.adtdump.adt.Node;
import com.adtdump.adt.NodeVisitor;
import com.adtdump.adt.Reference;
import com.adtdump.adt.Value;
import com.adtdump.adt.Vertex;

import java.util.Objects;

/**
 * Renders a node graph on a single line.
 *
 * <p>The output is meant for reading and diffing, not for parsing: it shows resolved
 * structs and lists by their arcs, unresolved vertices by their conjuncts, and every
 * expression with enough punctuation that different graphs never print the same.
 *
 * <pre>{@code
 * CompactPrinter printer = new CompactPrinter(new StringPrinter(PrinterConfig.defaults()),
 *                                             new DefaultLabelResolver());
 * printer.render(vertex);   // {a:1,b:(int|string)}
 * }</pre>
 */
public class CompactPrinter implements NodeVisitor {
    private final Printer out;
    private final LabelResolver labels;

    public CompactPrinter(Printer out, LabelResolver labels) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * Writes {@code node} and everything below it.
     *
     * @throws UnknownNodeException if a node is missing where the graph requires one
     */
    public void render(Node node) {
        if (node == null) {
            throw new UnknownNodeException("<null>");
        }
        node.accept(this);
    }

    private void write(String text) {
        out.write(text);
    }

    private void label(Label label) {
        write(labels.displayName(label));
    }

    private void join(Iterable<? extends Node> nodes, String separator) {
        boolean first = true;
        for (Node node : nodes) {
            if (!first) {
                write(separator);
            }
            first = false;
            render(node);
        }
    }

    // Containers

    @Override
    public void visitVertex(Vertex x) {
        if (!x.isResolved() || (out.config().raw() && !x.conjuncts().isEmpty())) {
            boolean first = true;
            for (Conjunct c : x.conjuncts()) {
                if (!first) {
                    write(" & ");
                }
                first = false;
                render(c.expr());
            }
            return;
        }

        if (x.isStruct()) {
            write("{");
            boolean first = true;
            for (Vertex arc : x.arcs()) {
                if (!first) {
                    write(",");
                }
                first = false;
                label(arc.label());
                write(":");
                render(arc);
            }
            write("}");
        } else if (x.isList()) {
            write("[");
            join(x.arcs(), ",");
            write("]");
        } else {
            render(x.value());
        }
    }

    @Override
    public void visitStructMarker(Value.StructMarker marker) {
        write("struct");
    }

    @Override
    public void visitListMarker(Value.ListMarker marker) {
        write("list");
    }

    @Override
    public void visitStructLit(Expr.StructLit struct) {
        write("{");
        join(struct.decls(), ",");
        write("}");
    }

    @Override
    public void visitListLit(Expr.ListLit list) {
        write("[");
        join(list.elems(), ",");
        write("]");
    }

    // Declarations

    @Override
    public void visitField(Decl.Field field) {
        label(field.label());
        write(":");
        render(field.value());
    }

    @Override
    public void visitOptionalField(Decl.OptionalField field) {
        label(field.label());
        write("?:");
        render(field.value());
    }

    @Override
    public void visitBulkOptionalField(Decl.BulkOptionalField field) {
        write("[");
        render(field.filter());
        write("]:");
        render(field.value());
    }

    @Override
    public void visitDynamicField(Decl.DynamicField field) {
        render(field.key());
        if (field.optional()) {
            write("?");
        }
        write(":");
        render(field.value());
    }

    @Override
    public void visitEllipsis(Ellipsis ellipsis) {
        write("...");
        if (ellipsis.value() != null) {
            render(ellipsis.value());
        }
    }

    // Literals and scalar values

    @Override
    public void visitBottom(Value.Bottom bottom) {
        write("_|_");
        if (bottom.error() != null) {
            write("(");
            write(bottom.error());
            write(")");
        }
    }

    @Override
    public void visitNull(Value.Null value) {
        write("null");
    }

    @Override
    public void visitBool(Value.Bool value) {
        write(Boolean.toString(value.value()));
    }

    @Override
    public void visitNum(Value.Num value) {
        write(value.text());
    }

    @Override
    public void visitStr(Value.Str value) {
        write(Quoting.quote(value.value()));
    }

    @Override
    public void visitBytes(Value.Bytes value) {
        write(Quoting.quoteBytes(value.value()));
    }

    @Override
    public void visitTop(Value.Top value) {
        write("_");
    }

    @Override
    public void visitBasicType(Value.BasicType type) {
        write(type.text());
    }

    @Override
    public void visitBoundExpr(Expr.BoundExpr bound) {
        write(bound.op().token());
        render(bound.expr());
    }

    @Override
    public void visitBoundValue(Value.BoundValue bound) {
        write(bound.op().token());
        render(bound.value());
    }

    // References

    @Override
    public void visitFieldReference(Reference.FieldReference ref) {
        label(ref.label());
    }

    @Override
    public void visitLabelReference(Reference.LabelReference ref) {
        write(ref.source() == null ? "LABEL" : ref.source());
    }

    @Override
    public void visitDynamicReference(Reference.DynamicReference ref) {
        render(ref.label());
    }

    @Override
    public void visitImportReference(Reference.ImportReference ref) {
        label(ref.importPath());
    }

    @Override
    public void visitLetReference(Reference.LetReference ref) {
        label(ref.label());
    }

    // Expressions

    @Override
    public void visitSelectorExpr(Expr.SelectorExpr expr) {
        render(expr.x());
        write(".");
        label(expr.sel());
    }

    @Override
    public void visitIndexExpr(Expr.IndexExpr expr) {
        render(expr.x());
        write("[");
        render(expr.index());
        write("]");
    }

    @Override
    public void visitSliceExpr(Expr.SliceExpr expr) {
        render(expr.x());
        write("[");
        if (expr.lo() != null) {
            render(expr.lo());
        }
        write(":");
        if (expr.hi() != null) {
            render(expr.hi());
        }
        if (expr.stride() != null) {
            write(":");
            render(expr.stride());
        }
        write("]");
    }

    @Override
    public void visitInterpolation(Expr.Interpolation expr) {
        write("\"");
        int n = expr.parts().size();
        for (int i = 0; i < n; i += 2) {
            if (expr.parts().get(i) instanceof Value.Str s) {
                write(s.value());
            } else {
                write("<bad string>");
            }
            if (i + 1 < n) {
                write("\\(");
                render(expr.parts().get(i + 1));
                write(")");
            }
        }
        write("\"");
    }

    @Override
    public void visitUnaryExpr(Expr.UnaryExpr expr) {
        write(expr.op().token());
        render(expr.x());
    }

    @Override
    public void visitBinaryExpr(Expr.BinaryExpr expr) {
        write("(");
        render(expr.x());
        write(" " + expr.op().token() + " ");
        render(expr.y());
        write(")");
    }

    @Override
    public void visitCallExpr(Expr.CallExpr expr) {
        render(expr.fun());
        write("(");
        join(expr.args(), ", ");
        write(")");
    }

    @Override
    public void visitBuiltinValidator(Value.BuiltinValidator validator) {
        render(validator.fun());
        write("(");
        join(validator.args(), ", ");
        write(")");
    }

    @Override
    public void visitBuiltin(Value.Builtin builtin) {
        if (builtin.packageName() != null) {
            write(builtin.packageName());
            write(".");
        }
        write(builtin.name());
    }

    @Override
    public void visitDisjunctionExpr(Expr.DisjunctionExpr expr) {
        write("(");
        boolean first = true;
        for (Disjunct d : expr.values()) {
            if (!first) {
                write("|");
            }
            first = false;
            if (d.isDefault()) {
                write("*");
            }
            render(d.value());
        }
        write(")");
    }

    @Override
    public void visitConjunction(Value.Conjunction conjunction) {
        join(conjunction.values(), " & ");
    }

    @Override
    public void visitDisjunction(Value.Disjunction disjunction) {
        int i = 0;
        for (Value v : disjunction.values()) {
            if (i > 0) {
                write(" | ");
            }
            if (i < disjunction.numDefaults()) {
                write("*");
            }
            render(v);
            i++;
        }
    }

    // Comprehension clauses

    @Override
    public void visitForClause(Clause.ForClause clause) {
        write("for ");
        label(clause.key());
        write(", ");
        label(clause.value());
        write(" in ");
        render(clause.src());
        write(" ");
        render(clause.dst());
    }

    @Override
    public void visitIfClause(Clause.IfClause clause) {
        write("if ");
        render(clause.condition());
        write(" ");
        render(clause.dst());
    }

    @Override
    public void visitLetClause(Clause.LetClause clause) {
        write("let ");
        label(clause.label());
        write(" = ");
        render(clause.expr());
        write(" ");
        render(clause.dst());
    }

    @Override
    public void visitValueClause(Clause.ValueClause clause) {
        render(clause.struct());
    }
}
