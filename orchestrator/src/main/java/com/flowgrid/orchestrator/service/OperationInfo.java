package com.flowgrid.orchestrator.service;

/** Catalogue entry returned by {@link FlowService#describeOperations()}. */
public record OperationInfo(String name, String category, String description) {}
