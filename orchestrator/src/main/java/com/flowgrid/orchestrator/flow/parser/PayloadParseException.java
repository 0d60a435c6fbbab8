package com.flowgrid.orchestrator.flow.parser;

/**
 * Thrown when an inline payload literal (the text after {@code WITH}, or the
 * argument of {@code OUTPUT_TEXT}) is malformed.
 */
public class PayloadParseException extends RuntimeException {

    private final int offset;

    public PayloadParseException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public int getOffset() { return offset; }
}
