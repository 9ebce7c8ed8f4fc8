package com.adtdump.output;

import java.util.Objects;

/**
 * {@link Printer} that collects text in a {@link StringBuilder}. Not thread-safe; use one
 * instance per render.
 */
public class StringPrinter implements Printer {
    private final StringBuilder sb;
    private final PrinterConfig config;

    public StringPrinter(PrinterConfig config) {
        this.sb = new StringBuilder();
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public void write(String text) {
        sb.append(text);
    }

    @Override
    public PrinterConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
