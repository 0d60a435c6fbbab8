package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import org.springframework.stereotype.Component;

/**
 * {@code custom/apx_exec}: hands an APX_EXEC request to the external system.
 * The request is recorded as queued; the target interprets the payload.
 */
@Component
public class ExternalExecJobHandler implements JobHandler {

    static final String TASK = "apx_exec";

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String target = JobParams.requireText(params, "target", TASK);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("target", target);
        result.set("payload", params.path("payload").isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : params.get("payload").deepCopy());
        result.put("status", "queued");
        return result;
    }
}
