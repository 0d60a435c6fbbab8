package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;

/** Interpreter behind {@code execArtifact} jobs. Optional; without a bean such jobs fail. */
public interface BytecodeRunner {

    JsonNode run(String program, JsonNode input);
}
