package com.flowgrid.orchestrator.job.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.JobHandler;
import com.flowgrid.orchestrator.job.JobParams;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.WorkerIdentity;
import org.springframework.stereotype.Component;

/**
 * Package build requested by BUILD_VPKG. Produces the artifact id that a
 * later DEPLOY_SERVICE step refers to.
 */
@Component
public class BuildArtifactJobHandler implements JobHandler {

    private final WorkerIdentity worker;

    public BuildArtifactJobHandler(WorkerIdentity worker) {
        this.worker = worker;
    }

    @Override public String key() { return GridJobType.BUILD_ARTIFACT.key(); }

    @Override
    public JsonNode handle(GridJob job, JsonNode params) {
        String manifestRef = JobParams.requireText(params, "manifestRef", "buildArtifact");
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("vpkgId", "vpkg-" + manifestRef);
        result.put("manifestRef", manifestRef);
        result.set("manifest", params.path("manifest").isMissingNode()
                ? JsonNodeFactory.instance.nullNode()
                : params.get("manifest").deepCopy());
        result.put("builtBy", worker.workerId());
        return result;
    }
}
