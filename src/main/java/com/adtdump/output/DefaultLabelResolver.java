package com.adtdump.output;

import com.adtdump.adt.Label;

/**
 * Shows identifiers as they are and quotes every other string label. Definitions and
 * hidden labels keep their {@code #}/{@code _} marker; index labels print as numbers.
 * A missing or invalid label prints as {@code _}.
 */
public class DefaultLabelResolver implements LabelResolver {

    @Override
    public String displayName(Label label) {
        if (label == null) {
            return "_";
        }
        if (label.isDefinition() || label.isHidden()) {
            return label.name();
        }
        return switch (label.type()) {
            case INT -> Integer.toString(label.index());
            case STRING -> isIdentifier(label.name()) ? label.name() : Quoting.quote(label.name());
            default -> "_";
        };
    }

    /**
     * A string label shows unquoted only if it cannot be mistaken for a definition, a
     * hidden field or the top value.
     */
    static boolean isIdentifier(String name) {
        if (name.isEmpty() || name.charAt(0) == '_' || name.charAt(0) == '#') {
            return false;
        }
        for (int i = 0; i < name.length(); ) {
            int cp = name.codePointAt(i);
            boolean ok = cp == '_' || cp == '$' || Character.isLetter(cp) || (i > 0 && Character.isDigit(cp));
            if (!ok) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }
}
