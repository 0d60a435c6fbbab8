package com.flowgrid.orchestrator.job;

public class JobHandlerNotFoundException extends RuntimeException {
    public JobHandlerNotFoundException(String key) {
        super("No job handler registered for: '" + key + "'");
    }
}
