package com.adtdump.adt;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A value produced by evaluation, possibly still incomplete (a bound, a type, a
 * disjunction) or an error ({@link Bottom}).
 */
public sealed interface Value extends Expr
        permits Value.Null, Value.Bool, Value.Num, Value.Str, Value.Bytes, Value.Top,
                Value.Bottom, Value.BasicType, Value.BoundValue, Value.StructMarker,
                Value.ListMarker, Value.Conjunction, Value.Disjunction,
                Value.BuiltinValidator, Value.Builtin, Vertex {

    record Null() implements Value {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitNull(this);
        }
    }

    record Bool(boolean value) implements Value {
        public static Bool of(boolean value) {
            return new Bool(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBool(this);
        }
    }

    /**
     * A number. Integers and floats share the decimal representation; {@code kind}
     * records which of the two the value is.
     */
    record Num(BigDecimal value, Kind kind) implements Value {
        public static Num of(long value) {
            return new Num(BigDecimal.valueOf(value), Kind.INT);
        }

        public static Num of(String decimal) {
            BigDecimal value = new BigDecimal(decimal);
            return new Num(value, decimal.contains(".") || decimal.contains("e") || decimal.contains("E")
                ? Kind.FLOAT : Kind.INT);
        }

        /** Canonical decimal text, switching to exponent form for very large or small values. */
        public String text() {
            return value.toString();
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitNum(this);
        }
    }

    record Str(String value) implements Value {
        public static Str of(String value) {
            return new Str(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitStr(this);
        }
    }

    /**
     * A byte sequence. The bytes need not be valid UTF-8.
     */
    record Bytes(byte[] value) implements Value {
        public Bytes {
            value = value.clone();
        }

        public static Bytes of(byte... value) {
            return new Bytes(value);
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes" + Arrays.toString(value);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBytes(this);
        }
    }

    /** The top value {@code _}, which unifies with anything. */
    record Top() implements Value {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTop(this);
        }
    }

    /**
     * The bottom value {@code _|_}, an evaluation error.
     *
     * @param error error message, or null when no error was recorded
     */
    record Bottom(String error) implements Value {
        public static Bottom of(String error) {
            return new Bottom(error);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBottom(this);
        }
    }

    /** A type constraint such as {@code int} or {@code (string|bytes)}. */
    record BasicType(Set<Kind> kinds) implements Value {
        public BasicType {
            kinds = Collections.unmodifiableSet(
                kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        }

        public static BasicType of(Kind first, Kind... rest) {
            return new BasicType(EnumSet.of(first, rest));
        }

        public String text() {
            return Kind.toString(kinds);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBasicType(this);
        }
    }

    /** An evaluated bound such as {@code <10}. */
    record BoundValue(Op op, Value value) implements Value {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBoundValue(this);
        }
    }

    /** Marks a vertex as a struct; its arcs are the fields. */
    record StructMarker() implements Value {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitStructMarker(this);
        }
    }

    /** Marks a vertex as a list; its arcs are the elements. */
    record ListMarker() implements Value {
        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitListMarker(this);
        }
    }

    /** Values that could not be unified into one, kept side by side. */
    record Conjunction(ImmutableList<Value> values) implements Value {
        public static Conjunction of(Value... values) {
            return new Conjunction(Lists.immutable.of(values));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitConjunction(this);
        }
    }

    /**
     * An evaluated disjunction. The first {@code numDefaults} values are the defaults.
     */
    record Disjunction(ImmutableList<Value> values, int numDefaults) implements Value {
        public Disjunction {
            if (numDefaults < 0 || numDefaults > values.size()) {
                throw new IllegalArgumentException(
                    "numDefaults must be between 0 and " + values.size() + ", got " + numDefaults);
            }
        }

        public static Disjunction of(int numDefaults, Value... values) {
            return new Disjunction(Lists.immutable.of(values), numDefaults);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDisjunction(this);
        }
    }

    /** A builtin applied as a validator, as in {@code strings.MinRunes(3)}. */
    record BuiltinValidator(Expr fun, ImmutableList<Value> args) implements Value {
        public static BuiltinValidator of(Expr fun, Value... args) {
            return new BuiltinValidator(fun, Lists.immutable.of(args));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBuiltinValidator(this);
        }
    }

    /**
     * A function provided by the runtime.
     *
     * @param packageName package the builtin lives in, or null for a global builtin
     * @param name builtin name
     */
    record Builtin(String packageName, String name) implements Value {
        public static Builtin global(String name) {
            return new Builtin(null, name);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBuiltin(this);
        }
    }
}
