package com.flowgrid.orchestrator.service;

import com.flowgrid.orchestrator.flow.parser.WorkflowAst;
import com.flowgrid.orchestrator.flow.plan.PlanGraph;

import java.time.Instant;

public record StoredPlan(String id, String projectScope, String source, WorkflowAst ast, PlanGraph graph,
                         Instant createdAt) {}
