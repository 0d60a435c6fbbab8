package com.flowgrid.orchestrator.flow.ops;

public enum SortDirection { ASC, DESC }
