package com.adtdump.output;

/**
 * Thrown when a renderer is handed a node it has no rule for. This is a programming error:
 * the graph and the renderer disagree about the node taxonomy.
 */
public class UnknownNodeException extends IllegalStateException {
    private final String kind;

    public UnknownNodeException(String kind) {
        super("unknown node kind " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
