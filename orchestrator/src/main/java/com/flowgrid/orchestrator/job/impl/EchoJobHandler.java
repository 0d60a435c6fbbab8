package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import org.springframework.stereotype.Component;

/** CUSTOM jobs without a dedicated task handler: result is {@code {echo: params}}. */
@Component
public class EchoJobHandler implements JobHandler {

    @Override public String key() { return GridJobType.CUSTOM.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        return JsonNodeFactory.instance.objectNode().set("echo", params.deepCopy());
    }
}
