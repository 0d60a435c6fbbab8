package com.flowgrid.orchestrator.repository;

import com.flowgrid.orchestrator.model.GridJob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job table as seen by the grid. {@code claim}, {@code complete} and
 * {@code fail} are atomic compare-and-set transitions: they return false,
 * and change nothing, when the row is not in the expected status.
 */
public interface GridJobStore {

    void insert(GridJob job);

    Optional<GridJob> findById(UUID id);

    /** Up to {@code limit} PENDING jobs, oldest first. */
    List<GridJob> findPending(int limit);

    List<GridJob> findChildren(UUID parentJobId);

    /** PENDING → RUNNING, recording the claiming worker. */
    boolean claim(UUID id, String workerId);

    /** RUNNING → SUCCEEDED with the result JSON. */
    boolean complete(UUID id, String resultJson);

    /** RUNNING → FAILED with the error message. */
    boolean fail(UUID id, String error);
}
