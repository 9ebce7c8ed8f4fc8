package com.adtdump.output;

/**
 * Append-only text sink that renderers write to.
 */
public interface Printer {
    void write(String text);

    PrinterConfig config();
}
