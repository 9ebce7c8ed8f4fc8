package com.adtdump.output;

import com.adtdump.adt.Label;

/**
 * Turns a label into the text shown for it.
 */
@FunctionalInterface
public interface LabelResolver {
    String displayName(Label label);
}
