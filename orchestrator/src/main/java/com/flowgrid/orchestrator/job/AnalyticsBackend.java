package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;

/** Query engine behind {@code analytics} jobs. Optional; without a bean such jobs fail. */
public interface AnalyticsBackend {

    JsonNode query(String projectScope, String sql);
}
