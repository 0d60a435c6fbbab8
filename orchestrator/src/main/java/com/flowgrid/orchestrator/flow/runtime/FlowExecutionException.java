package com.flowgrid.orchestrator.flow.runtime;

import java.util.UUID;

/** A node failed; carries the node id and, for grid-dispatched nodes, the job id. */
public class FlowExecutionException extends RuntimeException {

    private final String nodeId;
    private final UUID jobId;

    public FlowExecutionException(String nodeId, String message) {
        this(nodeId, null, message, null);
    }

    public FlowExecutionException(String nodeId, UUID jobId, String message, Throwable cause) {
        super("Node " + nodeId + (jobId != null ? " (job " + jobId + ")" : "") + " failed: " + message, cause);
        this.nodeId = nodeId;
        this.jobId = jobId;
    }

    public String getNodeId() { return nodeId; }
    public UUID getJobId()    { return jobId; }
}
