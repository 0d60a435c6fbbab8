package com.flowgrid.orchestrator.job;

/**
 * Controlled handler failure. The message, prefixed with the kind, is what
 * ends up in the job's error column.
 */
public class JobException extends RuntimeException {

    public enum Kind { INVALID_PARAMS, CHILD_FAILED, BACKEND_UNAVAILABLE, UNSUPPORTED }

    private final Kind kind;

    public JobException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public JobException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
