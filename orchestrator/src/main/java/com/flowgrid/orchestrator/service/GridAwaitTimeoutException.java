package com.flowgrid.orchestrator.service;

import com.flowgrid.orchestrator.model.GridJobStatus;

import java.time.Duration;
import java.util.UUID;

/**
 * The waiter gave up; the job itself has not failed and may still finish.
 */
public class GridAwaitTimeoutException extends RuntimeException {

    private final UUID jobId;
    private final GridJobStatus lastStatus;

    public GridAwaitTimeoutException(UUID jobId, Duration timeout, GridJobStatus lastStatus) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for grid job " + jobId
                + " (last status " + lastStatus + ")");
        this.jobId = jobId;
        this.lastStatus = lastStatus;
    }

    public UUID getJobId()              { return jobId; }
    public GridJobStatus getLastStatus() { return lastStatus; }
}
