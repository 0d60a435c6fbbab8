package com.flowgrid.orchestrator.flow.plan;

import com.flowgrid.orchestrator.flow.ops.Operation;

import java.util.List;

/**
 * One step in the plan. {@code inputs} lists the names the step reads (steps
 * or workflow inputs); {@code outputs} is the single name its result is
 * stored under.
 */
public record PlanNode(String id, PlanNodeKind kind, Operation operation,
                       List<String> inputs, List<String> outputs, PlanNodeMeta meta) {

    public static final String ID_PREFIX = "step:";

    public PlanNode {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public static String idFor(String stepName) {
        return ID_PREFIX + stepName;
    }

    public String stepName() {
        return meta.stepName();
    }
}
