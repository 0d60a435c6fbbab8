package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.job.fib.Fibonacci;
import com.flowgrid.orchestrator.model.GridJob;
import org.springframework.stereotype.Component;

/** {@code custom/fib}: F(n) on a single worker. */
@Component
public class FibJobHandler implements JobHandler {

    static final String TASK = "fib";

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        long n = JobParams.requireNonNegative(params, "n", TASK);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("n", n);
        result.put("fib", Fibonacci.fastDoubling(n).toString());
        return result;
    }
}
