package com.flowgrid.orchestrator.model;

/**
 * Kind of work a grid job carries. {@link #key()} is the handler key; CUSTOM
 * jobs are further routed by their {@code task} param.
 */
public enum GridJobType {
    INFERENCE("inference"),
    TRANSCODE("transcode"),
    ANALYTICS("analytics"),
    CUSTOM("custom"),
    BUILD_ARTIFACT("buildArtifact"),
    EXEC_ARTIFACT("execArtifact");

    private final String key;

    GridJobType(String key) {
        this.key = key;
    }

    public String key() { return key; }
}
