package com.flowgrid.orchestrator.flow.plan;

/** Where a node runs: in-process, or as a job on the grid. */
public enum PlanNodeKind {
    DATA_OP,
    BYTECODE_OP,
    JOB_OP
}
