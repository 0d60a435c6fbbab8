package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobParamsTest {

    private static ObjectNode params() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Test
    void requireNonNegative_acceptsIntegersAndIntegerText() {
        JsonNode params = params().put("a", 12).put("b", 9_000_000_000L).put("c", " 7 ");

        assertThat(JobParams.requireNonNegative(params, "a", "fib")).isEqualTo(12);
        assertThat(JobParams.requireNonNegative(params, "b", "fib")).isEqualTo(9_000_000_000L);
        assertThat(JobParams.requireNonNegative(params, "c", "fib")).isEqualTo(7);
    }

    @Test
    void requireNonNegative_rejectsFractionsInsteadOfTruncating() {
        JsonNode params = params().put("d", 2.5).put("e", new BigDecimal("3.75"));

        assertThatThrownBy(() -> JobParams.requireNonNegative(params, "d", "fib"))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("INVALID_PARAMS")
                .hasMessageContaining("2.5");
        assertThatThrownBy(() -> JobParams.requireNonNegative(params, "e", "fib"))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("3.75");
    }

    @Test
    void requireNonNegative_rejectsNegativeAndMissing() {
        JsonNode params = params().put("n", -3);

        assertThatThrownBy(() -> JobParams.requireNonNegative(params, "n", "fib"))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("got: -3");
        assertThatThrownBy(() -> JobParams.requireNonNegative(params, "missing", "fib"))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("missing must be a non-negative integer");
    }

    @Test
    void requireText_rejectsBlank() {
        JsonNode params = params().put("sql", "  ").put("agent", "planner");

        assertThat(JobParams.requireText(params, "agent", "inference")).isEqualTo("planner");
        assertThatThrownBy(() -> JobParams.requireText(params, "sql", "analytics"))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("sql parameter required for analytics job");
    }
}
