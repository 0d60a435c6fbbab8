package com.flowgrid.orchestrator.flow.parser;

import java.util.List;

/** Raised by callers that require a clean compile and got errors instead. */
public class FlowParseException extends RuntimeException {

    private final List<String> errors;

    public FlowParseException(List<String> errors) {
        super("FLOW source failed to compile: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() { return errors; }
}
