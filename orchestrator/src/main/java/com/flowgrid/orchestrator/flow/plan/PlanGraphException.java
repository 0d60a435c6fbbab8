package com.flowgrid.orchestrator.flow.plan;

/** Structural problem found while building a plan: unknown name, duplicate step or cycle. */
public class PlanGraphException extends RuntimeException {

    public PlanGraphException(String message) {
        super(message);
    }

    public static PlanGraphException unresolved(String stepName, String dependency) {
        return new PlanGraphException("STEP " + stepName + " references unknown dependency \"" + dependency + "\"");
    }

    public static PlanGraphException duplicate(String stepName) {
        return new PlanGraphException("Duplicate STEP name \"" + stepName + "\"");
    }

    public static PlanGraphException cycle(Iterable<String> path) {
        return new PlanGraphException("Cycle detected: " + String.join(" -> ", path));
    }
}
