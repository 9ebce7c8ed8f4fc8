package com.adtdump.output;

/**
 * Rendering options.
 *
 * @param raw print the conjuncts a vertex was built from instead of its resolved value
 */
public record PrinterConfig(boolean raw) {

    public static PrinterConfig defaults() {
        return new PrinterConfig(false);
    }

    public static PrinterConfig rawMode() {
        return new PrinterConfig(true);
    }
}
