package com.flowgrid.orchestrator.repository;

import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Process-local store for single-node runs and tests.
 *
 * Stored rows are never mutated in place: each transition replaces the row
 * with an updated snapshot inside {@code compute}, which the map runs
 * atomically per key. Reads hand out snapshots.
 */
@Component
@ConditionalOnProperty(name = "flowgrid.grid.store", havingValue = "memory")
public class InMemoryGridJobStore implements GridJobStore {

    private final Map<UUID, GridJob> rows = new ConcurrentHashMap<>();

    @Override
    public void insert(GridJob job) {
        if (rows.putIfAbsent(job.getId(), job.snapshot()) != null) {
            throw new IllegalStateException("Job " + job.getId() + " already exists");
        }
    }

    @Override
    public Optional<GridJob> findById(UUID id) {
        return Optional.ofNullable(rows.get(id)).map(GridJob::snapshot);
    }

    @Override
    public List<GridJob> findPending(int limit) {
        return rows.values().stream()
                .filter(job -> job.getStatus() == GridJobStatus.PENDING)
                .sorted(Comparator.comparing(GridJob::getCreatedAt))
                .limit(limit)
                .map(GridJob::snapshot)
                .toList();
    }

    @Override
    public List<GridJob> findChildren(UUID parentJobId) {
        return rows.values().stream()
                .filter(job -> parentJobId.equals(job.getParentJobId()))
                .sorted(Comparator.comparing(GridJob::getCreatedAt))
                .map(GridJob::snapshot)
                .toList();
    }

    @Override
    public boolean claim(UUID id, String workerId) {
        return transition(id, GridJobStatus.PENDING, job -> job.markRunning(workerId));
    }

    @Override
    public boolean complete(UUID id, String resultJson) {
        return transition(id, GridJobStatus.RUNNING, job -> job.markSucceeded(resultJson));
    }

    @Override
    public boolean fail(UUID id, String error) {
        return transition(id, GridJobStatus.RUNNING, job -> job.markFailed(error));
    }

    private boolean transition(UUID id, GridJobStatus expected, Consumer<GridJob> change) {
        AtomicBoolean applied = new AtomicBoolean(false);
        rows.computeIfPresent(id, (key, current) -> {
            if (current.getStatus() != expected) {
                return current;
            }
            GridJob updated = current.snapshot();
            change.accept(updated);
            applied.set(true);
            return updated;
        });
        return applied.get();
    }
}
