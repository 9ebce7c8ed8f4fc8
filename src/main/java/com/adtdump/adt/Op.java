package com.adtdump.adt;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operators of unary, binary and bound expressions.
 */
public enum Op {
    AND("&"),
    OR("|"),
    BOOL_AND("&&"),
    BOOL_OR("||"),
    EQUAL("=="),
    NOT("!"),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    MATCH("=~"),
    NOT_MATCH("!~"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    FLOAT_QUOTIENT("/"),
    INT_QUOTIENT("quo"),
    INT_REMAINDER("rem"),
    INT_DIVIDE("div"),
    INT_MODULO("mod");

    private static final Map<String, Op> BY_TOKEN = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Op::token, Function.identity()));

    private final String token;

    Op(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * @throws IllegalArgumentException if no operator has the given token
     */
    public static Op fromToken(String token) {
        Op op = BY_TOKEN.get(token);
        if (op == null) {
            throw new IllegalArgumentException("Unknown operator: " + token);
        }
        return op;
    }

    @Override
    public String toString() {
        return token;
    }
}
