package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.WorkerIdentity;
import org.springframework.stereotype.Component;

/**
 * Inference jobs. Two shapes of params are accepted:
 * <ul>
 *   <li>{@code {agent, payload}} from a flow's RUN AGENT step</li>
 *   <li>{@code {prompt, maxTokens}} for a raw completion</li>
 * </ul>
 * No model is attached to the worker; the completion is synthesised from
 * the prompt.
 */
@Component
public class InferenceJobHandler implements JobHandler {

    static final int DEFAULT_MAX_TOKENS = 256;
    private static final int PROMPT_PREVIEW = 120;

    private final WorkerIdentity worker;

    public InferenceJobHandler(WorkerIdentity worker) {
        this.worker = worker;
    }

    @Override public String key() { return GridJobType.INFERENCE.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (params.hasNonNull("agent")) {
            String agent = params.get("agent").asText();
            result.put("agent", agent);
            result.set("payload", params.path("payload").isObject()
                    ? params.get("payload").deepCopy()
                    : JsonNodeFactory.instance.objectNode());
            result.put("status", "completed");
            result.put("worker", worker.workerId());
            return result;
        }
        String prompt = params.path("prompt").asText("");
        int maxTokens = params.path("maxTokens").asInt(DEFAULT_MAX_TOKENS);
        String preview = prompt.length() > PROMPT_PREVIEW ? prompt.substring(0, PROMPT_PREVIEW) : prompt;
        result.put("completion", "Grid(" + worker.workerId() + ") synthetic response: " + preview);
        result.put("maxTokens", maxTokens);
        return result;
    }
}
