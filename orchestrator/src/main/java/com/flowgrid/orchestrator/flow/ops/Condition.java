package com.flowgrid.orchestrator.flow.ops;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code <field> <op> <value>} where value is a {@code DecimalNode} when the
 * literal is numeric and a {@code TextNode} otherwise (quotes stripped).
 */
public record Condition(String field, ComparisonOperator operator, JsonNode value) {}
