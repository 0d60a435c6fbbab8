package com.flowgrid.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.repository.GridJobStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point to the job grid: submission, lookup and awaiting results.
 *
 * Submission only writes a PENDING row; some {@link GridScheduler} (this
 * process or another one sharing the table) claims and runs it later.
 * Waiting is done by polling the store, so it works across processes.
 */
@Service
public class GridService {

    private static final Logger log = LoggerFactory.getLogger(GridService.class);

    private final GridJobStore store;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger pollerThreads = new AtomicInteger();
    private final ScheduledExecutorService poller = Executors.newScheduledThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "grid-await-" + pollerThreads.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public GridService(GridJobStore store, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Persist a new PENDING job and return its id. Never waits for execution.
     *
     * @param inputRefs optional provenance (flow run id, node id); may be null
     */
    public UUID submit(String projectScope, GridJobType type, JsonNode params, JsonNode inputRefs) {
        GridJob job = new GridJob(projectScope, type, writeJson(params), inputRefs == null ? null : writeJson(inputRefs));
        store.insert(job);
        meterRegistry.counter("flowgrid.grid.jobs.submitted", "type", type.key()).increment();
        log.info("Submitted grid job {} type={} scope={}", job.getId(), type.key(), projectScope);
        return job.getId();
    }

    /** Child of a decomposing job; inherits the parent's project scope. */
    public UUID submitChild(GridJob parent, GridJobType type, JsonNode params) {
        GridJob child = GridJob.child(parent, type, writeJson(params));
        store.insert(child);
        meterRegistry.counter("flowgrid.grid.jobs.submitted", "type", type.key()).increment();
        log.debug("Submitted child job {} of {} type={}", child.getId(), parent.getId(), type.key());
        return child.getId();
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<GridJob> findById(UUID id) {
        return store.findById(id);
    }

    public GridJob getJob(UUID id) {
        return store.findById(id).orElseThrow(() -> new GridJobNotFoundException(id));
    }

    public List<GridJob> children(UUID parentJobId) {
        return store.findChildren(parentJobId);
    }

    // ------------------------------------------------------------------
    // Awaiting
    // ------------------------------------------------------------------

    /**
     * Poll until the job is SUCCEEDED or FAILED. A FAILED job is returned,
     * not thrown; only the wait itself can fail.
     *
     * @throws GridAwaitTimeoutException if the job is still live after {@code timeout}
     * @throws GridJobNotFoundException  if the id is unknown
     */
    public GridJob awaitJob(UUID id, Duration pollInterval, Duration timeout) {
        return WorkerSlots.releasedWhile(() -> join(awaitJobAsync(id, pollInterval, timeout), id));
    }

    public CompletableFuture<GridJob> awaitJobAsync(UUID id, Duration pollInterval, Duration timeout) {
        CompletableFuture<GridJob> future = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        poller.execute(new Runnable() {
            @Override
            public void run() {
                if (future.isDone()) {
                    return;
                }
                try {
                    GridJob job = getJob(id);
                    if (job.getStatus().isTerminal()) {
                        future.complete(job);
                    } else if (System.nanoTime() >= deadline) {
                        future.completeExceptionally(new GridAwaitTimeoutException(id, timeout, job.getStatus()));
                    } else {
                        poller.schedule(this, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    }
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    /**
     * Wait for every job; results come back in the order of {@code ids}.
     * A grid worker calling this gives up its running slot for the wait.
     */
    public List<GridJob> awaitAll(List<UUID> ids, Duration pollInterval, Duration timeout) {
        List<CompletableFuture<GridJob>> futures = new ArrayList<>();
        for (UUID id : ids) {
            futures.add(awaitJobAsync(id, pollInterval, timeout));
        }
        return WorkerSlots.releasedWhile(() -> {
            List<GridJob> jobs = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                jobs.add(join(futures.get(i), ids.get(i)));
            }
            return jobs;
        });
    }

    private static GridJob join(CompletableFuture<GridJob> future, UUID id) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IllegalStateException("Interrupted while waiting for grid job " + id, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Waiting for grid job " + id + " failed", e.getCause());
        }
    }

    // ------------------------------------------------------------------
    // JSON columns
    // ------------------------------------------------------------------

    public JsonNode params(GridJob job) {
        return readJson(job.getParamsJson());
    }

    public JsonNode result(GridJob job) {
        return readJson(job.getResultJson());
    }

    public JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored JSON is not readable: " + e.getOriginalMessage(), e);
        }
    }

    public String writeJson(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value == null ? objectMapper.createObjectNode() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialised to JSON: " + e.getOriginalMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        poller.shutdownNow();
    }
}
