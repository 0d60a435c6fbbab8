package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flowgrid.orchestrator.job.BytecodeRunner;
import com.flowgrid.orchestrator.job.JobException;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** Runs a bytecode program ({@code RUN VASM}) on the configured {@link BytecodeRunner}. */
@Component
public class ExecArtifactJobHandler implements JobHandler {

    private final ObjectProvider<BytecodeRunner> runner;

    public ExecArtifactJobHandler(ObjectProvider<BytecodeRunner> runner) {
        this.runner = runner;
    }

    @Override public String key() { return GridJobType.EXEC_ARTIFACT.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String program = JobParams.requireText(params, "program", "execArtifact");
        BytecodeRunner vm = runner.getIfAvailable();
        if (vm == null) {
            throw new JobException(JobException.Kind.BACKEND_UNAVAILABLE, "no bytecode runner configured on this worker");
        }
        JsonNode input = params.path("input").isObject() ? params.get("input") : JsonNodeFactory.instance.objectNode();
        return vm.run(program, input);
    }
}
