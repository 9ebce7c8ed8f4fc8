package com.adtdump.json;

import com.adtdump.adt.Clause;
import com.adtdump.adt.Decl;
import com.adtdump.adt.Disjunct;
import com.adtdump.adt.Elem;
import com.adtdump.adt.Ellipsis;
import com.adtdump.adt.Expr;
import com.adtdump.adt.Kind;
import com.adtdump.adt.Label;
import com.adtdump.adt.Node;
import com.adtdump.adt.Op;
import com.adtdump.adt.Reference;
import com.adtdump.adt.Value;
import com.adtdump.adt.Vertex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Reads a node graph from JSON.
 *
 * <p>Every node is an object whose {@code kind} member names the node type, using the
 * type's simple name. The other members follow the type's components:
 *
 * <pre>{@code
 * {"kind": "Vertex", "value": {"kind": "StructMarker"}, "arcs": [
 *   {"kind": "Vertex", "label": "a", "value": {"kind": "Num", "value": 1}}
 * ]}
 * }</pre>
 *
 * <p>Labels are strings ({@code "a"}, {@code "#Def"}, {@code "_hidden"}) or integers for
 * list indices. Numbers may be JSON numbers or decimal strings; a string keeps its exact
 * text, so use one where the scale of a float matters. Bytes are given as
 * {@code base64} or as UTF-8 {@code text}.
 */
public class GraphJsonParser {
    private static final Logger log = LoggerFactory.getLogger(GraphJsonParser.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

    /**
     * @throws IOException if the input is not JSON or does not describe a valid graph
     */
    public Node parse(InputStream input) throws IOException {
        JsonNode json;
        try {
            json = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || json.isMissingNode()) {
            throw new IOException("Empty input");
        }
        Node node = parseNode(json);
        log.debug("Parsed graph rooted at {}", node.getClass().getSimpleName());
        return node;
    }

    public Node parse(String json) throws IOException {
        return parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private Node parseNode(JsonNode json) throws IOException {
        if (json == null || !json.isObject()) {
            throw new IOException("Expected a node object but got: " + json);
        }
        JsonNode kindNode = json.get("kind");
        if (kindNode == null || !kindNode.isTextual()) {
            throw new IOException("Node has no 'kind': " + json);
        }
        String kind = kindNode.asText();

        try {
            return switch (kind) {
                case "Vertex" -> parseVertex(json);
                case "StructMarker" -> new Value.StructMarker();
                case "ListMarker" -> new Value.ListMarker();
                case "StructLit" -> new Expr.StructLit(list(json, "decls", Decl.class));
                case "ListLit" -> new Expr.ListLit(list(json, "elems", Elem.class));

                case "Field" -> new Decl.Field(requiredLabel(json, "label"), expr(json, "value"));
                case "OptionalField" -> new Decl.OptionalField(requiredLabel(json, "label"), expr(json, "value"));
                case "BulkOptionalField" -> new Decl.BulkOptionalField(expr(json, "filter"), expr(json, "value"));
                case "DynamicField" -> new Decl.DynamicField(expr(json, "key"), expr(json, "value"),
                    bool(json, "optional"));
                case "Ellipsis" -> new Ellipsis(optional(json, "value", Expr.class));

                case "Bottom" -> new Value.Bottom(text(json, "error", false));
                case "Null" -> new Value.Null();
                case "Top" -> new Value.Top();
                case "Bool" -> parseBool(json);
                case "Num" -> parseNum(json);
                case "Str" -> new Value.Str(text(json, "value", true));
                case "Bytes" -> parseBytes(json);
                case "BasicType" -> parseBasicType(json);
                case "BoundExpr" -> new Expr.BoundExpr(op(json), expr(json, "expr"));
                case "BoundValue" -> new Value.BoundValue(op(json), child(json, "value", Value.class));

                case "FieldReference" -> new Reference.FieldReference(requiredLabel(json, "label"), upCount(json));
                case "LabelReference" -> new Reference.LabelReference(text(json, "source", false), upCount(json));
                case "DynamicReference" -> new Reference.DynamicReference(expr(json, "label"), upCount(json));
                case "ImportReference" -> new Reference.ImportReference(requiredLabel(json, "importPath"));
                case "LetReference" -> new Reference.LetReference(requiredLabel(json, "label"), upCount(json));

                case "SelectorExpr" -> new Expr.SelectorExpr(expr(json, "x"), requiredLabel(json, "sel"));
                case "IndexExpr" -> new Expr.IndexExpr(expr(json, "x"), expr(json, "index"));
                case "SliceExpr" -> new Expr.SliceExpr(expr(json, "x"), optional(json, "lo", Expr.class),
                    optional(json, "hi", Expr.class), optional(json, "stride", Expr.class));
                case "Interpolation" -> new Expr.Interpolation(list(json, "parts", Expr.class));
                case "UnaryExpr" -> new Expr.UnaryExpr(op(json), expr(json, "x"));
                case "BinaryExpr" -> new Expr.BinaryExpr(op(json), expr(json, "x"), expr(json, "y"));
                case "CallExpr" -> new Expr.CallExpr(expr(json, "fun"), list(json, "args", Expr.class));
                case "BuiltinValidator" -> new Value.BuiltinValidator(expr(json, "fun"), list(json, "args", Value.class));
                case "Builtin" -> new Value.Builtin(text(json, "package", false), text(json, "name", true));
                case "DisjunctionExpr" -> parseDisjunctionExpr(json);
                case "Conjunction" -> new Value.Conjunction(list(json, "values", Value.class));
                case "Disjunction" -> new Value.Disjunction(list(json, "values", Value.class),
                    integer(json, "numDefaults"));

                case "ForClause" -> new Clause.ForClause(label(json, "key"), requiredLabel(json, "value"),
                    expr(json, "src"), child(json, "dst", Clause.class));
                case "IfClause" -> new Clause.IfClause(expr(json, "condition"), child(json, "dst", Clause.class));
                case "LetClause" -> new Clause.LetClause(requiredLabel(json, "label"), expr(json, "expr"),
                    child(json, "dst", Clause.class));
                case "ValueClause" -> new Clause.ValueClause(child(json, "struct", Expr.StructLit.class));

                default -> throw new IOException("Unknown node kind: " + kind);
            };
        } catch (IllegalArgumentException e) {
            throw new IOException(kind + ": " + e.getMessage(), e);
        }
    }

    private Vertex parseVertex(JsonNode json) throws IOException {
        Vertex.Builder builder = Vertex.builder(label(json, "label"));
        builder.value(optional(json, "value", Value.class));
        for (Vertex arc : list(json, "arcs", Vertex.class)) {
            builder.arc(arc);
        }
        for (Expr expr : list(json, "conjuncts", Expr.class)) {
            builder.conjunct(expr);
        }
        return builder.build();
    }

    private Value.Num parseNum(JsonNode json) throws IOException {
        JsonNode value = required(json, "value");
        if (value.isTextual()) {
            return Value.Num.of(value.asText());
        }
        if (!value.isNumber()) {
            throw new IOException("Num 'value' must be a number, got: " + value);
        }
        BigDecimal decimal = value.decimalValue();
        return new Value.Num(decimal, value.isIntegralNumber() ? Kind.INT : Kind.FLOAT);
    }

    private Value.Bool parseBool(JsonNode json) throws IOException {
        JsonNode value = required(json, "value");
        if (!value.isBoolean()) {
            throw new IOException("Bool 'value' must be a boolean, got: " + value);
        }
        return Value.Bool.of(value.booleanValue());
    }

    private Value.Bytes parseBytes(JsonNode json) throws IOException {
        if (json.hasNonNull("base64")) {
            return new Value.Bytes(Base64.getDecoder().decode(json.get("base64").asText()));
        }
        return new Value.Bytes(text(json, "text", true).getBytes(StandardCharsets.UTF_8));
    }

    private Value.BasicType parseBasicType(JsonNode json) throws IOException {
        MutableList<String> names = Lists.mutable.empty();
        for (JsonNode name : array(json, "kinds")) {
            names.add(name.asText());
        }
        return new Value.BasicType(Kind.parseSet(names));
    }

    private Expr.DisjunctionExpr parseDisjunctionExpr(JsonNode json) throws IOException {
        MutableList<Disjunct> values = Lists.mutable.empty();
        for (JsonNode d : array(json, "values")) {
            values.add(new Disjunct(child(d, "value", Expr.class), bool(d, "default")));
        }
        return new Expr.DisjunctionExpr(values.toImmutable());
    }

    // ==================== Member helpers ====================

    private JsonNode required(JsonNode json, String member) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            throw new IOException(json.path("kind").asText("node") + " is missing '" + member + "'");
        }
        return value;
    }

    private String text(JsonNode json, String member, boolean isRequired) throws IOException {
        if (isRequired) {
            return required(json, member).asText();
        }
        JsonNode value = json.get(member);
        return value == null || value.isNull() ? null : value.asText();
    }

    private Op op(JsonNode json) throws IOException {
        return Op.fromToken(text(json, "op", true));
    }

    private int upCount(JsonNode json) throws IOException {
        return integer(json, "upCount");
    }

    /** An optional int member, 0 when absent. */
    private int integer(JsonNode json, String member) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (!value.isInt()) {
            throw new IOException("'" + member + "' must be an integer, got: " + value);
        }
        return value.intValue();
    }

    /** An optional boolean member, false when absent. */
    private boolean bool(JsonNode json, String member) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new IOException("'" + member + "' must be a boolean, got: " + value);
        }
        return value.booleanValue();
    }

    private Label label(JsonNode json, String member) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return Label.INVALID;
        }
        if (value.isInt()) {
            return Label.index(value.intValue());
        }
        if (value.isTextual()) {
            return Label.of(value.asText());
        }
        throw new IOException("Label '" + member + "' must be a string or an int, got: " + value);
    }

    private Label requiredLabel(JsonNode json, String member) throws IOException {
        required(json, member);
        return label(json, member);
    }

    private Expr expr(JsonNode json, String member) throws IOException {
        return child(json, member, Expr.class);
    }

    private <T extends Node> T child(JsonNode json, String member, Class<T> type) throws IOException {
        return cast(parseNode(required(json, member)), type, member);
    }

    private <T extends Node> T optional(JsonNode json, String member, Class<T> type) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return null;
        }
        return cast(parseNode(value), type, member);
    }

    private Iterable<JsonNode> array(JsonNode json, String member) throws IOException {
        JsonNode value = json.get(member);
        if (value == null || value.isNull()) {
            return Lists.immutable.empty();
        }
        if (!value.isArray()) {
            throw new IOException("'" + member + "' must be an array, got: " + value);
        }
        return value;
    }

    private <T extends Node> ImmutableList<T> list(JsonNode json, String member, Class<T> type) throws IOException {
        MutableList<T> result = Lists.mutable.empty();
        for (JsonNode element : array(json, member)) {
            result.add(cast(parseNode(element), type, member));
        }
        return result.toImmutable();
    }

    private static <T extends Node> T cast(Node node, Class<T> type, String member) throws IOException {
        if (!type.isInstance(node)) {
            throw new IOException("'" + member + "' must be a " + type.getSimpleName()
                + " but got " + node.getClass().getSimpleName());
        }
        return type.cast(node);
    }
}
