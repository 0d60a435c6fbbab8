package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.job.fib.FibMatrix;
import com.flowgrid.orchestrator.model.GridJob;
import org.springframework.stereotype.Component;

/** {@code custom/fib_matrix}: one segment of a split computation, {@code BASE^power}. */
@Component
public class FibMatrixJobHandler implements JobHandler {

    static final String TASK = "fib_matrix";

    @Override public String key() { return JobHandler.customTask(TASK); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        long power = JobParams.requireNonNegative(params, "power", TASK);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("power", power);
        if (params.has("chunkIndex")) {
            result.set("chunkIndex", params.get("chunkIndex"));
        }
        result.set("matrix", FibMatrix.BASE.pow(power).toJson());
        return result;
    }
}
