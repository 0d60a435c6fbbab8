package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobException;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.job.fib.FibMatrix;
import com.flowgrid.orchestrator.job.fib.Fibonacci;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobStatus;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.GridService;
import com.flowgrid.orchestrator.service.NodeAffinity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@code custom/fib_split}: F(n) decomposed across the grid.
 *
 * <ol>
 *   <li>n is cut into segments of at most {@code chunkSize} (default 500).</li>
 *   <li>Each segment becomes a {@code custom/fib_matrix} child computing
 *       {@code BASE^len}; with a {@code workers} list the children are pinned
 *       round-robin through {@code preferWorkerId}.</li>
 *   <li>Once every child is terminal, each one is checked in segment order:
 *       same project scope and SUCCEEDED. The first violation fails the
 *       parent with the child's id and status.</li>
 *   <li>The matrices are multiplied in segment order; F(n) is the lower-left
 *       entry of the product.</li>
 * </ol>
 */
@Component
public class FibSplitJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(FibSplitJobHandler.class);

    static final String TASK = "fib_split";
    static final long DEFAULT_CHUNK_SIZE = 500;

    private final GridService gridService;
    private final Duration pollInterval;
    private final Duration timeout;

    public FibSplitJobHandler(GridService gridService,
                              @Value("${flowgrid.grid.await-poll-interval-ms:200}") long pollIntervalMs,
                              @Value("${flowgrid.grid.await-timeout-ms:300000}") long timeoutMs) {
        this.gridService = gridService;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        long n = JobParams.requireNonNegative(params, "n", TASK);
        long chunkSize = params.has("chunkSize")
                ? JobParams.requireNonNegative(params, "chunkSize", TASK)
                : DEFAULT_CHUNK_SIZE;
        if (chunkSize == 0) {
            throw new JobException(JobException.Kind.INVALID_PARAMS, "chunkSize must be positive for " + TASK + " job");
        }
        List<String> workers = new ArrayList<>();
        params.path("workers").forEach(w -> workers.add(w.asText()));

        List<Long> segments = Fibonacci.chunks(n, chunkSize);
        List<UUID> childIds = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            ObjectNode childParams = JsonNodeFactory.instance.objectNode();
            childParams.put("task", FibMatrixJobHandler.TASK);
            childParams.put("power", segments.get(i));
            childParams.put("chunkIndex", i);
            if (!workers.isEmpty()) {
                childParams.put(NodeAffinity.PREFER_WORKER_ID, workers.get(i % workers.size()));
            }
            childIds.add(gridService.submitChild(job, GridJobType.CUSTOM, childParams));
        }
        log.info("fib_split job {}: n={} split into {} segments", job.getId(), n, segments.size());

        List<GridJob> children = gridService.awaitAll(childIds, pollInterval, timeout);

        FibMatrix product = FibMatrix.IDENTITY;
        ArrayNode segmentIds = JsonNodeFactory.instance.arrayNode();
        for (GridJob child : children) {
            if (!job.getProjectScope().equals(child.getProjectScope())) {
                throw new JobException(JobException.Kind.CHILD_FAILED, "child job " + child.getId()
                        + " belongs to project scope '" + child.getProjectScope() + "' (status "
                        + child.getStatus() + ")");
            }
            if (child.getStatus() != GridJobStatus.SUCCEEDED) {
                throw new JobException(JobException.Kind.CHILD_FAILED, "child job " + child.getId()
                        + " ended " + child.getStatus() + ": " + child.getError());
            }
            product = product.multiply(FibMatrix.fromJson(gridService.result(child).path("matrix")));
            segmentIds.add(child.getId().toString());
        }

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("n", n);
        result.put("chunkSize", chunkSize);
        result.put("fib", product.fibonacci().toString());
        result.set("segments", segmentIds);
        return result;
    }
}
