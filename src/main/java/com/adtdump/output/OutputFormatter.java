package com.adtdump.output;

import com.adtdump.adt.Node;

import java.util.Objects;

/**
 * Formats node graphs as compact text.
 *
 * <p>Each call renders into its own sink, so one formatter can be shared between threads
 * and may be called again from inside a {@link LabelResolver}.
 */
public class OutputFormatter {
    private final PrinterConfig config;
    private final LabelResolver labels;

    public OutputFormatter() {
        this(PrinterConfig.defaults());
    }

    public OutputFormatter(PrinterConfig config) {
        this(config, new DefaultLabelResolver());
    }

    public OutputFormatter(PrinterConfig config, LabelResolver labels) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * @throws UnknownNodeException if the graph is missing a node it requires
     */
    public String format(Node node) {
        StringPrinter printer = new StringPrinter(config);
        new CompactPrinter(printer, labels).render(node);
        return printer.toString();
    }

    public PrinterConfig config() {
        return config;
    }
}
