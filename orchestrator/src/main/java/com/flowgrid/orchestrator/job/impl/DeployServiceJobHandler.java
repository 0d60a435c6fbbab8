package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import org.springframework.stereotype.Component;

/** {@code custom/deploy_service}: exposes a built package under {@code /s/<serviceName>}. */
@Component
public class DeployServiceJobHandler implements JobHandler {

    static final String TASK = "deploy_service";

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String vpkgId = JobParams.requireText(params, "vpkgId", TASK);
        String serviceName = JobParams.requireText(params, "serviceName", TASK);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("service", serviceName);
        result.put("endpoint", "/s/" + serviceName);
        result.put("vpkgId", vpkgId);
        return result;
    }
}
