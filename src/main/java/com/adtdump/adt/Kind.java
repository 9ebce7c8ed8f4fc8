package com.adtdump.adt;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Basic kinds of values. A {@link Value.BasicType} constrains a value to a set of kinds.
 */
public enum Kind {
    NULL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BYTES("bytes"),
    FUNC("func"),
    LIST("list"),
    STRUCT("struct");

    private final String text;

    Kind(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * @throws IllegalArgumentException for unknown names, including {@code number}
     */
    public static Kind fromText(String text) {
        return Kind.valueOf(text.toUpperCase(Locale.ROOT));
    }

    /**
     * Parses kind names into a set, expanding {@code number} to int and float.
     */
    public static Set<Kind> parseSet(Iterable<String> names) {
        EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        for (String name : names) {
            if (name.equals("number")) {
                kinds.add(INT);
                kinds.add(FLOAT);
            } else {
                kinds.add(fromText(name));
            }
        }
        return kinds;
    }

    /**
     * Text form of a set of kinds: {@code _|_} for none, {@code _} for all, the bare name
     * for one, and {@code (a|b)} for several. Int and float together print as
     * {@code number}, after the other kinds.
     */
    public static String toString(Set<Kind> kinds) {
        if (kinds.isEmpty()) {
            return "_|_";
        }
        if (kinds.size() == values().length) {
            return "_";
        }
        EnumSet<Kind> rest = EnumSet.copyOf(kinds);
        boolean number = rest.contains(INT) && rest.contains(FLOAT);
        if (number) {
            rest.remove(INT);
            rest.remove(FLOAT);
        }

        StringBuilder sb = new StringBuilder();
        for (Kind kind : rest) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(kind.text);
        }
        if (number) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append("number");
        }

        boolean multiple = rest.size() + (number ? 1 : 0) > 1;
        return multiple ? "(" + sb + ")" : sb.toString();
    }
}
