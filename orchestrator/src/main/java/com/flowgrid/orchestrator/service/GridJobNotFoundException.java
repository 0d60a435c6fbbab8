package com.flowgrid.orchestrator.service;

import java.util.UUID;

public class GridJobNotFoundException extends RuntimeException {
    public GridJobNotFoundException(UUID id) {
        super("No grid job with id: " + id);
    }
}
