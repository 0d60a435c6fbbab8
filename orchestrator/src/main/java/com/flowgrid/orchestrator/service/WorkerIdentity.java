package com.flowgrid.orchestrator.service;

import java.util.Locale;

/**
 * Who this process is on the grid. {@code role} is one of {@code core},
 * {@code edge} or {@code village}; affinity hints are matched against it.
 */
public record WorkerIdentity(String workerId, String role) {

    public static final String ROLE_CORE = "core";
    public static final String ROLE_EDGE = "edge";
    public static final String ROLE_VILLAGE = "village";

    public WorkerIdentity {
        role = role == null || role.isBlank() ? ROLE_CORE : role.toLowerCase(Locale.ROOT);
    }

    public boolean isEdge() {
        return ROLE_EDGE.equals(role) || ROLE_VILLAGE.equals(role);
    }

    public boolean isVillage() {
        return ROLE_VILLAGE.equals(role);
    }
}
