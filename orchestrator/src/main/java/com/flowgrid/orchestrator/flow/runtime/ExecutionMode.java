package com.flowgrid.orchestrator.flow.runtime;

public enum ExecutionMode {
    /** Block until every node has finished. */
    SYNC,
    /** Submit the run as a grid job and return its id. */
    ASYNC
}
