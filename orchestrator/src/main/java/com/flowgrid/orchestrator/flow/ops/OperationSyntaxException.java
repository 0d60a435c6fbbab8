package com.flowgrid.orchestrator.flow.ops;

/** A step body that does not match the grammar of its operation. */
public class OperationSyntaxException extends RuntimeException {

    private final String stepName;

    public OperationSyntaxException(String stepName, String message) {
        super("STEP " + stepName + ": " + message);
        this.stepName = stepName;
    }

    public OperationSyntaxException(String stepName, String message, Throwable cause) {
        super("STEP " + stepName + ": " + message, cause);
        this.stepName = stepName;
    }

    public String getStepName() { return stepName; }
}
