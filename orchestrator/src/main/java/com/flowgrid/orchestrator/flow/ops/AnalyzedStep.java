package com.flowgrid.orchestrator.flow.ops;

import com.flowgrid.orchestrator.flow.parser.FlowStep;

import java.util.List;

/**
 * A step with its typed operation. {@code dependencies} are the names that
 * must resolve to a step or input at plan time.
 */
public record AnalyzedStep(FlowStep step, Operation operation, List<String> dependencies, List<String> warnings) {

    public AnalyzedStep {
        dependencies = List.copyOf(dependencies);
        warnings = List.copyOf(warnings);
    }
}
