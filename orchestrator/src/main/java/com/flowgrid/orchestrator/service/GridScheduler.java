package com.flowgrid.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgrid.orchestrator.job.JobHandlerRegistry;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.repository.GridJobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that turns PENDING rows into results.
 *
 * Each tick reads a batch of the oldest PENDING jobs, drops the ones whose
 * affinity hints exclude this worker, and claims the rest by compare-and-set
 * until every worker slot is taken. A lost race simply moves on to the
 * next row. The outcome is written back with a second compare-and-set.
 *
 * {@code worker-threads} bounds the jobs actively running. A job blocked on
 * other grid jobs (a fib_split parent, an async flow run) gives its slot
 * back while it waits, so its children are claimed here even when every
 * slot was taken by parents.
 */
@Component
@EnableScheduling
public class GridScheduler {

    private static final Logger log = LoggerFactory.getLogger(GridScheduler.class);

    private final GridJobStore store;
    private final JobHandlerRegistry handlers;
    private final GridService gridService;
    private final WorkerIdentity worker;
    private final int batchSize;
    private final WorkerSlots slots;

    private final AtomicInteger threadIndex = new AtomicInteger();
    private final ExecutorService workers;

    public GridScheduler(GridJobStore store,
                         JobHandlerRegistry handlers,
                         GridService gridService,
                         WorkerIdentity worker,
                         @Value("${flowgrid.grid.batch-size:5}") int batchSize,
                         @Value("${flowgrid.grid.worker-threads:4}") int workerThreads) {
        this.store = store;
        this.handlers = handlers;
        this.gridService = gridService;
        this.worker = worker;
        this.batchSize = batchSize;
        this.slots = new WorkerSlots(workerThreads);
        this.workers = Executors.newCachedThreadPool(runnable ->
                new Thread(runnable, "grid-worker-" + threadIndex.incrementAndGet()));
    }

    @Scheduled(fixedDelayString = "${flowgrid.grid.scheduler-interval-ms:1000}")
    public void tick() {
        claimBatch();
    }

    /**
     * One scheduling pass.
     *
     * @return number of jobs claimed and dispatched
     */
    public int claimBatch() {
        int free = slots.free();
        if (free <= 0) {
            return 0;
        }
        List<GridJob> pending = store.findPending(batchSize);
        int claimed = 0;
        for (GridJob job : pending) {
            if (claimed >= free) {
                break;
            }
            try {
                if (!NodeAffinity.accepts(gridService.params(job), worker)) {
                    log.debug("Job {} skipped: affinity excludes worker {} ({})",
                            job.getId(), worker.workerId(), worker.role());
                    continue;
                }
                if (!store.claim(job.getId(), worker.workerId())) {
                    log.debug("Job {} claimed by another worker", job.getId());
                    continue;
                }
            } catch (RuntimeException e) {
                log.warn("Could not schedule job {}: {}", job.getId(), e.getMessage());
                continue;
            }
            claimed++;
            slots.reserve();
            UUID jobId = job.getId();
            workers.execute(() -> slots.runHolding(() -> run(jobId)));
        }
        return claimed;
    }

    /** Execute a job this worker has already claimed and record the outcome. */
    void run(UUID jobId) {
        try {
            GridJob job = gridService.getJob(jobId);
            MDC.put("jobId", jobId.toString());
            MDC.put("jobType", job.getType().key());
            MDC.put("workerId", worker.workerId());
            MDC.put("projectScope", job.getProjectScope());
            log.info("Running grid job {} type={}", jobId, job.getType().key());

            JsonNode params = gridService.params(job);
            JsonNode result = handlers.execute(job, params);
            if (store.complete(jobId, gridService.writeJson(result))) {
                log.info("Grid job {} SUCCEEDED", jobId);
            } else {
                log.warn("Grid job {} finished but was no longer RUNNING; result dropped", jobId);
            }
        } catch (Exception e) {
            recordFailure(jobId, e);
        } catch (Error e) {
            recordFailure(jobId, e);
            throw e;
        } finally {
            MDC.clear();
        }
    }

    private void recordFailure(UUID jobId, Throwable e) {
        log.error("Grid job {} FAILED: {}", jobId, e.getMessage(), e);
        if (!store.fail(jobId, describe(e))) {
            log.warn("Grid job {} failed but was no longer RUNNING", jobId);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
