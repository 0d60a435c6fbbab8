package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import org.springframework.stereotype.Component;

@Component
public class TranscodeJobHandler implements JobHandler {

    @Override public String key() { return GridJobType.TRANSCODE.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("status", "transcoded");
        result.put("source", params.path("source").asText("blob://unknown"));
        result.put("targetFormat", params.path("targetFormat").asText("mp4"));
        return result;
    }
}
