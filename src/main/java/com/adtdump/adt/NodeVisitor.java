package com.adtdump.adt;

/**
 * Visits every concrete node kind. Implementations handle each kind explicitly.
 */
public interface NodeVisitor {

    // Containers

    void visitVertex(Vertex vertex);

    void visitStructMarker(Value.StructMarker marker);

    void visitListMarker(Value.ListMarker marker);

    void visitStructLit(Expr.StructLit struct);

    void visitListLit(Expr.ListLit list);

    // Declarations

    void visitField(Decl.Field field);

    void visitOptionalField(Decl.OptionalField field);

    void visitBulkOptionalField(Decl.BulkOptionalField field);

    void visitDynamicField(Decl.DynamicField field);

    void visitEllipsis(Ellipsis ellipsis);

    // Literals and scalar values

    void visitBottom(Value.Bottom bottom);

    void visitNull(Value.Null value);

    void visitBool(Value.Bool value);

    void visitNum(Value.Num value);

    void visitStr(Value.Str value);

    void visitBytes(Value.Bytes value);

    void visitTop(Value.Top value);

    void visitBasicType(Value.BasicType type);

    void visitBoundExpr(Expr.BoundExpr bound);

    void visitBoundValue(Value.BoundValue bound);

    // References

    void visitFieldReference(Reference.FieldReference ref);

    void visitLabelReference(Reference.LabelReference ref);

    void visitDynamicReference(Reference.DynamicReference ref);

    void visitImportReference(Reference.ImportReference ref);

    void visitLetReference(Reference.LetReference ref);

    // Expressions

    void visitSelectorExpr(Expr.SelectorExpr expr);

    void visitIndexExpr(Expr.IndexExpr expr);

    void visitSliceExpr(Expr.SliceExpr expr);

    void visitInterpolation(Expr.Interpolation expr);

    void visitUnaryExpr(Expr.UnaryExpr expr);

    void visitBinaryExpr(Expr.BinaryExpr expr);

    void visitCallExpr(Expr.CallExpr expr);

    void visitBuiltinValidator(Value.BuiltinValidator validator);

    void visitBuiltin(Value.Builtin builtin);

    void visitDisjunctionExpr(Expr.DisjunctionExpr expr);

    void visitConjunction(Value.Conjunction conjunction);

    void visitDisjunction(Value.Disjunction disjunction);

    // Comprehension clauses

    void visitForClause(Clause.ForClause clause);

    void visitIfClause(Clause.IfClause clause);

    void visitLetClause(Clause.LetClause clause);

    void visitValueClause(Clause.ValueClause clause);
}
