package com.flowgrid.orchestrator.flow.plan;

import java.util.List;

public record PlanNodeMeta(String stepName, int startLine, List<String> warnings) {

    public PlanNodeMeta {
        warnings = List.copyOf(warnings);
    }
}
