package com.flowgrid.orchestrator.flow.runtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * {@code outputs} holds OUTPUT labels, or every node's value keyed by node id
 * when the workflow has no OUTPUT step. For ASYNC runs outputs are empty and
 * {@code jobId} names the grid job doing the work.
 */
public record FlowExecutionResult(ExecutionMode mode, Map<String, JsonNode> outputs, Metrics metrics, UUID jobId) {

    public record Metrics(long elapsedMs, int nodesExecuted) {}

    public FlowExecutionResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static FlowExecutionResult sync(Map<String, JsonNode> outputs, long elapsedMs, int nodesExecuted) {
        return new FlowExecutionResult(ExecutionMode.SYNC, outputs, new Metrics(elapsedMs, nodesExecuted), null);
    }

    public static FlowExecutionResult async(UUID jobId) {
        return new FlowExecutionResult(ExecutionMode.ASYNC, Map.of(), new Metrics(0, 0), jobId);
    }
}
