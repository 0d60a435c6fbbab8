package com.flowgrid.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Placement hints carried in job params. A worker that does not satisfy
 * every hint present leaves the job for another worker.
 * <ul>
 *   <li>{@code preferWorkerId}: only that worker may claim</li>
 *   <li>{@code preferLocalEdge}: only edge or village workers</li>
 *   <li>{@code preferVillage}: only village workers</li>
 * </ul>
 */
public final class NodeAffinity {

    public static final String PREFER_WORKER_ID = "preferWorkerId";
    public static final String PREFER_LOCAL_EDGE = "preferLocalEdge";
    public static final String PREFER_VILLAGE = "preferVillage";

    private NodeAffinity() {}

    public static boolean accepts(JsonNode params, WorkerIdentity worker) {
        if (params == null || !params.isObject()) {
            return true;
        }
        JsonNode preferred = params.get(PREFER_WORKER_ID);
        if (preferred != null && !preferred.isNull() && !preferred.asText().equals(worker.workerId())) {
            return false;
        }
        if (params.path(PREFER_LOCAL_EDGE).asBoolean(false) && !worker.isEdge()) {
            return false;
        }
        return !params.path(PREFER_VILLAGE).asBoolean(false) || worker.isVillage();
    }
}
