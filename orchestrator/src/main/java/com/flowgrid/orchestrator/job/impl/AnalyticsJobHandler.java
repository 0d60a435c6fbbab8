package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgrid.orchestrator.job.AnalyticsBackend;
import com.flowgrid.orchestrator.job.JobException;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** Runs {@code params.sql} against the configured {@link AnalyticsBackend}. */
@Component
public class AnalyticsJobHandler implements JobHandler {

    private final ObjectProvider<AnalyticsBackend> backend;

    public AnalyticsJobHandler(ObjectProvider<AnalyticsBackend> backend) {
        this.backend = backend;
    }

    @Override public String key() { return GridJobType.ANALYTICS.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String sql = JobParams.requireText(params, "sql", "analytics");
        AnalyticsBackend engine = backend.getIfAvailable();
        if (engine == null) {
            throw new JobException(JobException.Kind.BACKEND_UNAVAILABLE, "no analytics backend configured on this worker");
        }
        return engine.query(job.getProjectScope(), sql);
    }
}
