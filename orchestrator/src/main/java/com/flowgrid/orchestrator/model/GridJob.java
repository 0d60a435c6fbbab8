package com.flowgrid.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work in the durable job table.
 *
 * Params, input refs and result are stored as JSON text; the service layer
 * owns (de)serialisation. Status changes go through the mark* methods, which
 * refuse anything but a forward transition.
 *
 * DB table: grid_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "grid_jobs")
public class GridJob {

    @Id
    private UUID id;

    // Set for children created by a decomposing handler (fib_split).
    @Column(name = "parent_job_id")
    private UUID parentJobId;

    @Column(name = "project_scope", nullable = false)
    private String projectScope;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private GridJobType type;

    @Column(name = "params_json", columnDefinition = "TEXT", nullable = false)
    private String paramsJson;

    @Column(name = "input_refs_json", columnDefinition = "TEXT")
    private String inputRefsJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GridJobStatus status = GridJobStatus.PENDING;

    @Column(name = "assigned_worker_id")
    private String assignedWorkerId;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected GridJob() {} // required by JPA

    public GridJob(String projectScope, GridJobType type, String paramsJson, String inputRefsJson) {
        this.id = UUID.randomUUID();
        this.projectScope = projectScope;
        this.type = type;
        this.paramsJson = paramsJson;
        this.inputRefsJson = inputRefsJson;
    }

    public static GridJob child(GridJob parent, GridJobType type, String paramsJson) {
        GridJob job = new GridJob(parent.projectScope, type, paramsJson, null);
        job.parentJobId = parent.id;
        return job;
    }

    /** Detached copy, used by the in-memory store so callers never share rows. */
    public GridJob snapshot() {
        GridJob copy = new GridJob();
        copy.id = id;
        copy.parentJobId = parentJobId;
        copy.projectScope = projectScope;
        copy.type = type;
        copy.paramsJson = paramsJson;
        copy.inputRefsJson = inputRefsJson;
        copy.status = status;
        copy.assignedWorkerId = assignedWorkerId;
        copy.resultJson = resultJson;
        copy.error = error;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning(String workerId) {
        transition(GridJobStatus.RUNNING);
        this.assignedWorkerId = workerId;
    }

    public void markSucceeded(String resultJson) {
        transition(GridJobStatus.SUCCEEDED);
        this.resultJson = resultJson;
    }

    public void markFailed(String error) {
        transition(GridJobStatus.FAILED);
        this.error = error;
    }

    private void transition(GridJobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID getId()                 { return id; }
    public UUID getParentJobId()        { return parentJobId; }
    public String getProjectScope()     { return projectScope; }
    public GridJobType getType()        { return type; }
    public String getParamsJson()       { return paramsJson; }
    public String getInputRefsJson()    { return inputRefsJson; }
    public GridJobStatus getStatus()    { return status; }
    public String getAssignedWorkerId() { return assignedWorkerId; }
    public String getResultJson()       { return resultJson; }
    public String getError()            { return error; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getUpdatedAt()       { return updatedAt; }
}
