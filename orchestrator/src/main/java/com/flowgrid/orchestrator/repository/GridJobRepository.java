package com.flowgrid.orchestrator.repository;

import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the grid_jobs table.
 *
 * The three {@code @Modifying} updates are compare-and-set: the WHERE clause
 * pins the expected current status, so of N concurrent callers exactly one
 * sees an update count of 1. They must run inside a transaction.
 */
public interface GridJobRepository extends JpaRepository<GridJob, UUID> {

    /** Oldest jobs in a given status, page size bounds the batch. */
    List<GridJob> findByStatusOrderByCreatedAtAsc(GridJobStatus status, Pageable page);

    List<GridJob> findByParentJobIdOrderByCreatedAtAsc(UUID parentJobId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GridJob j
            SET j.status = com.flowgrid.orchestrator.model.GridJobStatus.RUNNING,
                j.assignedWorkerId = :workerId,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.flowgrid.orchestrator.model.GridJobStatus.PENDING
            """)
    int claim(@Param("id") UUID id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GridJob j
            SET j.status = com.flowgrid.orchestrator.model.GridJobStatus.SUCCEEDED,
                j.resultJson = :resultJson,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.flowgrid.orchestrator.model.GridJobStatus.RUNNING
            """)
    int complete(@Param("id") UUID id, @Param("resultJson") String resultJson, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE GridJob j
            SET j.status = com.flowgrid.orchestrator.model.GridJobStatus.FAILED,
                j.error = :error,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.flowgrid.orchestrator.model.GridJobStatus.RUNNING
            """)
    int fail(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);
}
