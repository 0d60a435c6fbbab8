package com.flowgrid.orchestrator.model;

/**
 * Lifecycle of a grid job. Transitions only ever move forward:
 * PENDING → RUNNING → SUCCEEDED | FAILED.
 */
public enum GridJobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(GridJobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
