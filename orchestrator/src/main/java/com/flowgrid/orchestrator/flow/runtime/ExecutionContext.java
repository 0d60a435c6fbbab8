package com.flowgrid.orchestrator.flow.runtime;

import java.util.UUID;

/** Per-run identity; {@code depth} counts CALL FLOW nesting. */
public record ExecutionContext(String projectScope, String runId, int depth) {

    public static ExecutionContext root(String projectScope) {
        return new ExecutionContext(projectScope, "run-" + UUID.randomUUID(), 0);
    }

    public ExecutionContext nested() {
        return new ExecutionContext(projectScope, runId, depth + 1);
    }
}
