package com.adtdump.adt;

import java.util.Objects;

/**
 * Identity of a field or list element.
 *
 * <p>String-like labels keep their marker in {@code name}: a definition is stored as
 * {@code #Def}, a hidden field as {@code _x}. Index labels have a null name.
 *
 * @param type kind of label
 * @param name field name including any marker, or null for index and invalid labels
 * @param index element index for {@link LabelType#INT} labels, otherwise 0
 */
public record Label(LabelType type, String name, int index) {

    /** Placeholder for positions that have no label, such as the root or an absent key. */
    public static final Label INVALID = new Label(LabelType.INVALID, null, 0);

    public Label {
        Objects.requireNonNull(type, "type must not be null");
        if (type == LabelType.INT) {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        } else if (type != LabelType.INVALID) {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Classifies {@code name} by its marker: {@code #x} is a definition, {@code _#x} a
     * hidden definition, {@code _x} a hidden field and anything else, including a lone
     * {@code _}, a regular string label.
     */
    public static Label of(String name) {
        Objects.requireNonNull(name, "name must not be null");
        LabelType type;
        if (name.startsWith("_#") && name.length() > 2) {
            type = LabelType.HIDDEN_DEFINITION;
        } else if (name.startsWith("#") && name.length() > 1) {
            type = LabelType.DEFINITION;
        } else if (name.startsWith("_") && name.length() > 1) {
            type = LabelType.HIDDEN;
        } else {
            type = LabelType.STRING;
        }
        return new Label(type, name, 0);
    }

    /** A regular string label, never classified by marker. */
    public static Label string(String name) {
        return new Label(LabelType.STRING, name, 0);
    }

    public static Label index(int index) {
        return new Label(LabelType.INT, null, index);
    }

    public boolean isDefinition() {
        return type == LabelType.DEFINITION || type == LabelType.HIDDEN_DEFINITION;
    }

    public boolean isHidden() {
        return type == LabelType.HIDDEN || type == LabelType.HIDDEN_DEFINITION;
    }

    @Override
    public String toString() {
        return switch (type) {
            case INT -> Integer.toString(index);
            case INVALID -> "<invalid>";
            default -> name;
        };
    }
}
