package com.adtdump.adt;

public enum LabelType {
    /** Regular field name. May need quoting when displayed. */
    STRING,
    /** List element index. */
    INT,
    /** {@code #Name} */
    DEFINITION,
    /** {@code _name} */
    HIDDEN,
    /** {@code _#Name} */
    HIDDEN_DEFINITION,
    INVALID
}
