package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgrid.orchestrator.model.GridJob;

/**
 * Executes one kind of grid job. Implementations are Spring beans collected
 * by {@link JobHandlerRegistry} under {@link #key()}: a job type key such as
 * {@code inference}, or {@code custom/<task>} for CUSTOM jobs.
 *
 * The returned value becomes the job's result; any exception fails the job
 * with its message.
 */
public interface JobHandler {

    String CUSTOM_PREFIX = "custom/";

    String key();

    JsonNode handle(GridJob job, JsonNode params);

    static String customTask(String task) {
        return CUSTOM_PREFIX + task;
    }
}
