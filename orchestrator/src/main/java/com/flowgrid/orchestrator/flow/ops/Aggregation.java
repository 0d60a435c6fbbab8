package com.flowgrid.orchestrator.flow.ops;

/** One {@code AGG} line; {@code field} is null for {@code count(*)}. */
public record Aggregation(Function function, String field, String alias) {

    public enum Function { COUNT, SUM }
}
