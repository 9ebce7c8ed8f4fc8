package com.adtdump.output;

import java.nio.charset.StandardCharsets;

/**
 * Double-quoted literal text for strings and byte sequences.
 *
 * <p>Printable characters are kept as they are. Quotes, backslashes and the usual control
 * characters get their short escapes ({@code \n}, {@code \t}, ...). Other control
 * characters become {@code \xNN}, other non-printable code points a {@code u} escape with
 * four hex digits or a {@code U} escape with eight, and bytes that are not valid UTF-8
 * {@code \xNN}.
 */
public final class Quoting {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Quoting() {
    }

    public static String quote(String s) {
        // Fast path: nothing to escape
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\' || c < 0x20 || c >= 0x7f) {
                needsEscaping = true;
                break;
            }
        }
        if (!needsEscaping) {
            return "\"" + s + "\"";
        }

        StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append('"');
        s.codePoints().forEach(cp -> appendCodePoint(sb, cp));
        sb.append('"');
        return sb.toString();
    }

    public static String quote(byte[] utf8) {
        StringBuilder sb = new StringBuilder(utf8.length + 16);
        sb.append('"');
        int i = 0;
        while (i < utf8.length) {
            int width = decodedWidth(utf8, i);
            if (width == 0) {
                appendHexByte(sb, utf8[i] & 0xff);
                i++;
            } else {
                appendCodePoint(sb, new String(utf8, i, width, StandardCharsets.UTF_8).codePointAt(0));
                i += width;
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Quotes like {@link #quote(byte[])} and swaps the enclosing double quotes for single
     * quotes. Escapes inside are left as they are.
     */
    public static String quoteBytes(byte[] bytes) {
        String quoted = quote(bytes);
        return "'" + quoted.substring(1, quoted.length() - 1) + "'";
    }

    private static void appendCodePoint(StringBuilder sb, int cp) {
        if (cp == '"' || cp == '\\') {
            sb.append('\\').append((char) cp);
            return;
        }
        if (isPrint(cp)) {
            sb.appendCodePoint(cp);
            return;
        }
        switch (cp) {
            case 0x07 -> sb.append("\\a");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case 0x0b -> sb.append("\\v");
            default -> {
                if (cp < ' ' || cp == 0x7f) {
                    appendHexByte(sb, cp);
                } else if (cp < 0x10000) {
                    sb.append("\\u");
                    appendHex(sb, cp, 4);
                } else {
                    sb.append("\\U");
                    appendHex(sb, cp, 8);
                }
            }
        }
    }

    private static void appendHexByte(StringBuilder sb, int b) {
        sb.append("\\x");
        appendHex(sb, b, 2);
    }

    private static void appendHex(StringBuilder sb, int value, int digits) {
        for (int shift = (digits - 1) * 4; shift >= 0; shift -= 4) {
            sb.append(HEX[(value >> shift) & 0xf]);
        }
    }

    /**
     * Letters, marks, numbers, punctuation, symbols and the ASCII space.
     */
    static boolean isPrint(int cp) {
        if (cp == ' ') {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.UPPERCASE_LETTER, Character.LOWERCASE_LETTER, Character.TITLECASE_LETTER,
                 Character.MODIFIER_LETTER, Character.OTHER_LETTER,
                 Character.NON_SPACING_MARK, Character.ENCLOSING_MARK, Character.COMBINING_SPACING_MARK,
                 Character.DECIMAL_DIGIT_NUMBER, Character.LETTER_NUMBER, Character.OTHER_NUMBER,
                 Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION, Character.START_PUNCTUATION,
                 Character.END_PUNCTUATION, Character.INITIAL_QUOTE_PUNCTUATION,
                 Character.FINAL_QUOTE_PUNCTUATION, Character.OTHER_PUNCTUATION,
                 Character.MATH_SYMBOL, Character.CURRENCY_SYMBOL, Character.MODIFIER_SYMBOL,
                 Character.OTHER_SYMBOL -> true;
            default -> false;
        };
    }

    /**
     * Length of the well-formed UTF-8 sequence starting at {@code i}, or 0 if the bytes
     * there are not one.
     */
    private static int decodedWidth(byte[] b, int i) {
        int b0 = b[i] & 0xff;
        if (b0 < 0x80) {
            return 1;
        }
        int width;
        int min;
        int cp;
        if (b0 >= 0xc2 && b0 <= 0xdf) {
            width = 2;
            min = 0x80;
            cp = b0 & 0x1f;
        } else if (b0 >= 0xe0 && b0 <= 0xef) {
            width = 3;
            min = 0x800;
            cp = b0 & 0x0f;
        } else if (b0 >= 0xf0 && b0 <= 0xf4) {
            width = 4;
            min = 0x10000;
            cp = b0 & 0x07;
        } else {
            return 0;
        }
        if (i + width > b.length) {
            return 0;
        }
        for (int k = 1; k < width; k++) {
            int bk = b[i + k] & 0xff;
            if ((bk & 0xc0) != 0x80) {
                return 0;
            }
            cp = (cp << 6) | (bk & 0x3f);
        }
        if (cp < min || cp > Character.MAX_CODE_POINT || (cp >= 0xd800 && cp <= 0xdfff)) {
            return 0;
        }
        return width;
    }
}
