package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.flow.runtime.ExecutionMode;
import com.flowgrid.orchestrator.flow.runtime.FlowExecutionResult;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.service.FlowService;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code custom/flow_run}: executes an ASYNC flow run on whichever worker claims it. */
@Component
public class FlowRunJobHandler implements JobHandler {

    static final String TASK = "flow_run";

    private final FlowService flowService;

    public FlowRunJobHandler(FlowService flowService) {
        this.flowService = flowService;
    }

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String source = JobParams.requireText(params, "source", TASK);
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = params.path("inputs").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            inputs.put(field.getKey(), field.getValue());
        }
        FlowExecutionResult run = flowService.run(job.getProjectScope(), source, inputs, ExecutionMode.SYNC);

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ObjectNode outputs = result.putObject("outputs");
        run.outputs().forEach(outputs::set);
        ObjectNode metrics = result.putObject("metrics");
        metrics.put("elapsedMs", run.metrics().elapsedMs());
        metrics.put("nodesExecuted", run.metrics().nodesExecuted());
        return result;
    }
}
