package com.adtdump.output;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.adtdump.adt.Clause;
import com.adtdump.adt.Decl;
import com.adtdump.adt.Disjunct;
import com.adtdump.adt.Ellipsis;
import com.adtdump.adt.Expr;
import com.adtdump.adt.Kind;
import com.adtdump.adt.Label;
import com.adtdump.adt.Node;
import com.adtdump.adt.Op;
import com.adtdump.adt.Reference;
import com.adtdump.adt.Value;
import com.adtdump.adt.Vertex;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

public class CompactPrinterTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private String render(Node node) {
        return new OutputFormatter().format(node);
    }

    private String renderRaw(Node node) {
        return new OutputFormatter(PrinterConfig.rawMode()).format(node);
    }

    private static Reference.FieldReference ref(String name) {
        return new Reference.FieldReference(Label.of(name));
    }

    private static Value.Num num(long n) {
        return Value.Num.of(n);
    }

    private static Value.Str str(String s) {
        return Value.Str.of(s);
    }

    private static Vertex structAB() {
        return Vertex.root().struct()
            .arc(Label.of("a"), num(1))
            .arc(Label.of("b"), num(2))
            .conjunct(ref("c1"))
            .conjunct(ref("c2"))
            .build();
    }

    // ============================================================
    // Vertices
    // ============================================================

    @Test
    public void testStructVertexRendersArcsInOrder() {
        assertEquals("{a:1,b:2}", render(structAB()));
    }

    @Test
    public void testRawStructVertexRendersConjuncts() {
        assertEquals("c1 & c2", renderRaw(structAB()));
    }

    @Test
    public void testListVertex() {
        Vertex list = Vertex.root().list().element(num(1)).element(str("x")).build();
        assertEquals("[1,\"x\"]", render(list));
    }

    @Test
    public void testEmptyStructAndListVertices() {
        assertEquals("{}", render(Vertex.root().struct().build()));
        assertEquals("[]", render(Vertex.root().list().build()));
    }

    @Test
    public void testNestedStructVertexQuotesLabels() {
        Vertex inner = Vertex.builder(Label.of("b c")).struct()
            .arc(Label.of("d"), Value.Bool.of(true))
            .build();
        Vertex outer = Vertex.root().struct().arc(inner).build();
        assertEquals("{\"b c\":{d:true}}", render(outer));
    }

    @Test
    public void testDefinitionAndHiddenArcs() {
        Vertex v = Vertex.root().struct()
            .arc(Label.of("#D"), Value.BasicType.of(Kind.INT))
            .arc(Label.of("_h"), new Value.Null())
            .build();
        assertEquals("{#D:int,_h:null}", render(v));
    }

    @Test
    public void testScalarVertexFlattensToValue() {
        assertEquals("\"s\"", render(Vertex.leaf(Label.of("a"), str("s"))));
    }

    @Test
    public void testUnresolvedVertexRendersConjunctsWithoutRawMode() {
        Vertex v = Vertex.root().conjunct(ref("x")).conjunct(num(1)).build();
        assertEquals("x & 1", render(v));
        assertEquals("x & 1", renderRaw(v));
    }

    @Test
    public void testUnresolvedVertexWithoutConjunctsIsEmpty() {
        assertEquals("", render(Vertex.root().build()));
    }

    @Test
    public void testRawVertexWithoutConjunctsShowsValue() {
        assertEquals("5", renderRaw(Vertex.leaf(Label.of("a"), num(5))));
    }

    @Test
    public void testRawModeAppliesToNestedArcs() {
        Vertex arc = Vertex.builder(Label.of("a")).value(num(1)).conjunct(ref("y")).build();
        Vertex root = Vertex.root().struct().arc(arc).build();
        assertEquals("{a:1}", render(root));
        // the root has no conjuncts, so only the arc switches to its conjuncts
        assertEquals("{a:y}", renderRaw(root));
    }

    @Test
    public void testMarkers() {
        assertEquals("struct", render(new Value.StructMarker()));
        assertEquals("list", render(new Value.ListMarker()));
    }

    // ============================================================
    // Literals and declarations
    // ============================================================

    @Test
    public void testStructLitWithEveryFieldForm() {
        Expr.StructLit s = Expr.StructLit.of(
            new Decl.Field(Label.of("a"), num(1)),
            new Decl.OptionalField(Label.of("b"), Value.BasicType.of(Kind.INT)),
            new Decl.BulkOptionalField(Value.BasicType.of(Kind.STRING), new Value.Top()),
            new Decl.DynamicField(ref("k"), num(2), true),
            new Decl.DynamicField(ref("j"), num(3)),
            Ellipsis.bare());
        assertEquals("{a:1,b?:int,[string]:_,k?:2,j:3,...}", render(s));
    }

    @Test
    public void testListLitWithTypedEllipsis() {
        Expr.ListLit l = Expr.ListLit.of(num(1), new Ellipsis(Value.BasicType.of(Kind.INT)));
        assertEquals("[1,...int]", render(l));
        assertEquals("[]", render(Expr.ListLit.of()));
    }

    @Test
    public void testBottom() {
        assertEquals("_|_", render(new Value.Bottom(null)));
        assertEquals("_|_(conflicting values 1 and 2)", render(Value.Bottom.of("conflicting values 1 and 2")));
    }

    @Test
    public void testScalars() {
        assertEquals("null", render(new Value.Null()));
        assertEquals("_", render(new Value.Top()));
        assertEquals("true", render(Value.Bool.of(true)));
        assertEquals("false", render(Value.Bool.of(false)));
        assertEquals("42", render(num(42)));
        assertEquals("-7", render(num(-7)));
        assertEquals("1.50", render(Value.Num.of("1.50")));
        assertEquals("1E+3", render(Value.Num.of("1e3")));
    }

    @Test
    public void testStringQuoting() {
        assertEquals("\"a\\\"b\"", render(str("a\"b")));
        assertEquals("\"line\\nbreak\"", render(str("line\nbreak")));
        assertEquals("\"\"", render(str("")));
    }

    @Test
    public void testBytesUseSingleQuotes() {
        assertEquals("'ab'", render(Value.Bytes.of((byte) 'a', (byte) 'b')));
        assertEquals("'a\\\"b'", render(Value.Bytes.of((byte) 'a', (byte) '"', (byte) 'b')));
        assertEquals("'\\xff'", render(Value.Bytes.of((byte) 0xff)));
    }

    @Test
    public void testBasicTypes() {
        assertEquals("int", render(Value.BasicType.of(Kind.INT)));
        assertEquals("(int|string)", render(Value.BasicType.of(Kind.STRING, Kind.INT)));
        assertEquals("number", render(Value.BasicType.of(Kind.INT, Kind.FLOAT)));
        assertEquals("(string|number)", render(Value.BasicType.of(Kind.INT, Kind.FLOAT, Kind.STRING)));
    }

    @Test
    public void testBounds() {
        assertEquals(">=x", render(new Expr.BoundExpr(Op.GREATER_EQUAL, ref("x"))));
        assertEquals("<10", render(new Value.BoundValue(Op.LESS_THAN, num(10))));
        assertEquals("!=null", render(new Value.BoundValue(Op.NOT_EQUAL, new Value.Null())));
        assertEquals("=~\"^a\"", render(new Value.BoundValue(Op.MATCH, str("^a"))));
    }

    // ============================================================
    // References
    // ============================================================

    @Test
    public void testFieldLetAndImportReferences() {
        assertEquals("foo", render(ref("foo")));
        assertEquals("#Def", render(ref("#Def")));
        assertEquals("x", render(new Reference.LetReference(Label.of("x"), 1)));
        assertEquals("strings", render(new Reference.ImportReference(Label.of("strings"))));
        assertEquals("\"encoding/json\"", render(new Reference.ImportReference(Label.of("encoding/json"))));
    }

    @Test
    public void testLabelReference() {
        assertEquals("name", render(new Reference.LabelReference("name", 0)));
        assertEquals("LABEL", render(new Reference.LabelReference(null, 0)));
    }

    @Test
    public void testDynamicReferenceRendersLabelExpression() {
        assertEquals("\"k\"", render(new Reference.DynamicReference(str("k"), 0)));
    }

    // ============================================================
    // Expressions
    // ============================================================

    @Test
    public void testSelectorAndIndex() {
        assertEquals("a.b", render(new Expr.SelectorExpr(ref("a"), Label.of("b"))));
        assertEquals("a.\"b-c\"", render(new Expr.SelectorExpr(ref("a"), Label.of("b-c"))));
        assertEquals("a[0]", render(new Expr.IndexExpr(ref("a"), num(0))));
    }

    @Test
    public void testSliceBoundsAreOptional() {
        assertEquals("a[1:3]", render(new Expr.SliceExpr(ref("a"), num(1), num(3), null)));
        assertEquals("a[:]", render(new Expr.SliceExpr(ref("a"), null, null, null)));
        assertEquals("a[:3:2]", render(new Expr.SliceExpr(ref("a"), null, num(3), num(2))));
        assertEquals("a[1::2]", render(new Expr.SliceExpr(ref("a"), num(1), null, num(2))));
    }

    @Test
    public void testInterpolation() {
        assertEquals("\"a\\(x)b\"", render(Expr.Interpolation.of(str("a"), ref("x"), str("b"))));
        assertEquals("\"a\\(x)\"", render(Expr.Interpolation.of(str("a"), ref("x"))));
        // literal segments are written verbatim
        assertEquals("\"say \"hi\"\"", render(Expr.Interpolation.of(str("say \"hi\""))));
    }

    @Test
    public void testInterpolationWithBadLiteralPart() {
        assertEquals("\"<bad string>\\(x)\"", render(Expr.Interpolation.of(num(1), ref("x"), str(""))));
    }

    @Test
    public void testUnaryAndBinary() {
        assertEquals("-x", render(new Expr.UnaryExpr(Op.SUBTRACT, ref("x"))));
        assertEquals("!b", render(new Expr.UnaryExpr(Op.NOT, ref("b"))));
        assertEquals("(x + 1)", render(new Expr.BinaryExpr(Op.ADD, ref("x"), num(1))));
        assertEquals("((a + b) * c)", render(new Expr.BinaryExpr(Op.MULTIPLY,
            new Expr.BinaryExpr(Op.ADD, ref("a"), ref("b")), ref("c"))));
        assertEquals("(a div b)", render(new Expr.BinaryExpr(Op.INT_DIVIDE, ref("a"), ref("b"))));
    }

    @Test
    public void testCalls() {
        Expr fun = new Expr.SelectorExpr(new Reference.ImportReference(Label.of("strings")), Label.of("ToUpper"));
        assertEquals("strings.ToUpper(\"a\", 2)", render(Expr.CallExpr.of(fun, str("a"), num(2))));
        assertEquals("f()", render(Expr.CallExpr.of(ref("f"))));
    }

    @Test
    public void testBuiltinsAndValidators() {
        Value.Builtin minRunes = new Value.Builtin("strings", "MinRunes");
        assertEquals("strings.MinRunes(3)", render(Value.BuiltinValidator.of(minRunes, num(3))));
        assertEquals("len", render(Value.Builtin.global("len")));
        assertEquals("len([1])", render(Expr.CallExpr.of(Value.Builtin.global("len"), Expr.ListLit.of(num(1)))));
    }

    @Test
    public void testDisjunctionExprMarksDefaults() {
        Expr.DisjunctionExpr d = Expr.DisjunctionExpr.of(
            Disjunct.of(num(1)), Disjunct.defaultOf(num(2)), Disjunct.of(str("a")));
        assertEquals("(1|*2|\"a\")", render(d));
    }

    @Test
    public void testConjunction() {
        Value.Conjunction c = Value.Conjunction.of(Value.BasicType.of(Kind.INT),
            new Value.BoundValue(Op.GREATER_EQUAL, num(0)));
        assertEquals("int & >=0", render(c));
    }

    @Test
    public void testDisjunctionMarksLeadingDefaults() {
        assertEquals("*1 | *2 | 3", render(Value.Disjunction.of(2, num(1), num(2), num(3))));
        assertEquals("1 | 2", render(Value.Disjunction.of(0, num(1), num(2))));
        assertEquals("*1 | *2", render(Value.Disjunction.of(2, num(1), num(2))));
    }

    // ============================================================
    // Comprehensions
    // ============================================================

    @Test
    public void testForClause() {
        Clause.ValueClause body = new Clause.ValueClause(Expr.StructLit.of(new Decl.Field(Label.of("a"), ref("v"))));
        Clause.ForClause f = new Clause.ForClause(Label.of("k"), Label.of("v"), ref("src"), body);
        assertEquals("for k, v in src {a:v}", render(f));
    }

    @Test
    public void testForClauseWithoutKey() {
        Clause.ValueClause body = new Clause.ValueClause(Expr.StructLit.of());
        assertEquals("for _, v in src {}",
            render(new Clause.ForClause(Label.INVALID, Label.of("v"), ref("src"), body)));
    }

    @Test
    public void testIfAndLetClauses() {
        Clause.ValueClause body = new Clause.ValueClause(
            Expr.StructLit.of(new Decl.Field(Label.of("b"), Value.Bool.of(true))));
        assertEquals("if (x > 1) {b:true}",
            render(new Clause.IfClause(new Expr.BinaryExpr(Op.GREATER_THAN, ref("x"), num(1)), body)));

        Clause.ValueClause letBody = new Clause.ValueClause(Expr.StructLit.of(
            new Decl.Field(Label.of("z"), new Reference.LetReference(Label.of("y"), 0))));
        assertEquals("let y = (x * 2) {z:y}", render(new Clause.LetClause(Label.of("y"),
            new Expr.BinaryExpr(Op.MULTIPLY, ref("x"), num(2)), letBody)));
    }

    @Test
    public void testClauseChainInsideStruct() {
        Clause chain = new Clause.ForClause(Label.of("k"), Label.of("v"), ref("src"),
            new Clause.IfClause(ref("v"),
                new Clause.ValueClause(Expr.StructLit.of(new Decl.Field(Label.of("a"), ref("v"))))));
        assertEquals("{for k, v in src if v {a:v}}", render(Expr.StructLit.of(chain)));
    }

    // ============================================================
    // Fatal path
    // ============================================================

    @Test
    public void testMissingNodeIsFatal() {
        UnknownNodeException e = assertThrows(UnknownNodeException.class, () -> render(null));
        assertEquals("<null>", e.getKind());
    }

    @Test
    public void testMissingChildIsFatal() {
        Expr.StructLit s = Expr.StructLit.of(new Decl.Field(Label.of("a"), null));
        UnknownNodeException e = assertThrows(UnknownNodeException.class, () -> render(s));
        assertTrue(e.getMessage().contains("<null>"));
    }

    @Test
    public void testMissingConjunctExpressionIsFatal() {
        Vertex v = Vertex.root().conjunct((Expr) null).build();
        assertThrows(UnknownNodeException.class, () -> render(v));
    }

    @Test
    public void testFatalPathIsLeftToTheCaller() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ListAppender<ILoggingEvent> events = new ListAppender<>();
        events.start();
        root.addAppender(events);
        try {
            assertThrows(UnknownNodeException.class, () -> render(null));
        } finally {
            root.detachAppender(events);
        }
        assertTrue(events.list.isEmpty(), "engine logged " + events.list);
    }

    @Test
    public void testRendersThroughCustomSinkAndResolver() {
        StringPrinter sink = new StringPrinter(PrinterConfig.defaults());
        LabelResolver upper = label -> label.name().toUpperCase();
        new CompactPrinter(sink, upper).render(structAB());
        assertEquals("{A:1,B:2}", sink.toString());
    }
}
