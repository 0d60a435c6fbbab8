package com.flowgrid.orchestrator.flow.plan;

/** {@code from} must finish before {@code to} starts; {@code via} is the referenced step name. */
public record PlanEdge(String from, String to, String via) {}
