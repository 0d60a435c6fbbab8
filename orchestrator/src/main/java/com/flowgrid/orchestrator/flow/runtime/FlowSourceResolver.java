package com.flowgrid.orchestrator.flow.runtime;

import java.util.Optional;

/** Finds the FLOW source named by a {@code CALL FLOW "<path>"} step. */
public interface FlowSourceResolver {

    Optional<String> resolve(String path);
}
