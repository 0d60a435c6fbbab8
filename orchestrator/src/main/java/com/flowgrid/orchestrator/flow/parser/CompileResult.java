package com.flowgrid.orchestrator.flow.parser;

import java.util.List;

/**
 * Outcome of {@link StepParser#parse}. {@code ast} is present whenever at
 * least a header was found, even if {@code ok} is false.
 */
public record CompileResult(boolean ok, WorkflowAst ast, List<String> warnings, List<String> errors) {

    public CompileResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }
}
