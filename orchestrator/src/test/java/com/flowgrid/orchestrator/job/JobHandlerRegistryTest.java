package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.job.impl.EchoJobHandler;
import com.flowgrid.orchestrator.job.impl.FibJobHandler;
import com.flowgrid.orchestrator.job.impl.InferenceJobHandler;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.WorkerIdentity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobHandlerRegistryTest {

    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final JobHandlerRegistry registry = new JobHandlerRegistry(List.of(
            new EchoJobHandler(),
            new FibJobHandler(),
            new InferenceJobHandler(new WorkerIdentity("w1", "core"))), meterRegistry);

    private static ObjectNode params(String task) {
        return JsonNodeFactory.instance.objectNode().put("task", task);
    }

    private static GridJob job(GridJobType type) {
        return new GridJob("acme", type, "{}", null);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    @Test
    void handlerKeys_sorted() {
        assertThat(registry.handlerKeys()).containsExactly("custom", "custom/fib", "inference");
    }

    @Test
    void resolve_customTaskThenFallback() {
        assertThat(registry.resolve(GridJobType.CUSTOM, params("fib"))).isInstanceOf(FibJobHandler.class);
        assertThat(registry.resolve(GridJobType.CUSTOM, params("unknown"))).isInstanceOf(EchoJobHandler.class);
        assertThat(registry.resolve(GridJobType.CUSTOM, JsonNodeFactory.instance.objectNode()))
                .isInstanceOf(EchoJobHandler.class);
        assertThat(registry.resolve(GridJobType.INFERENCE, params("fib"))).isInstanceOf(InferenceJobHandler.class);
    }

    @Test
    void resolve_missingHandler_throws() {
        assertThatThrownBy(() -> registry.resolve(GridJobType.ANALYTICS, JsonNodeFactory.instance.objectNode()))
                .isInstanceOf(JobHandlerNotFoundException.class)
                .hasMessageContaining("analytics");
    }

    @Test
    void duplicateKeys_rejectedAtStartup() {
        assertThatThrownBy(() -> new JobHandlerRegistry(
                List.of(new FibJobHandler(), new FibJobHandler()), meterRegistry))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("custom/fib");
    }

    // ------------------------------------------------------------------
    // Execution metrics
    // ------------------------------------------------------------------

    @Test
    void execute_countsSuccess() {
        JsonNode result = registry.execute(job(GridJobType.CUSTOM), params("fib").put("n", 10));

        assertThat(result.get("fib").textValue()).isEqualTo("55");
        assertThat(meterRegistry.counter("flowgrid.grid.job.runs", "handler", "custom/fib", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.timer("flowgrid.grid.job.duration", "handler", "custom/fib").count()).isEqualTo(1);
    }

    @Test
    void execute_countsControlledFailureByKind() {
        assertThatThrownBy(() -> registry.execute(job(GridJobType.CUSTOM), params("fib")))
                .isInstanceOf(JobException.class)
                .hasMessageStartingWith("[INVALID_PARAMS]");

        assertThat(meterRegistry.counter("flowgrid.grid.job.runs", "handler", "custom/fib", "status", "invalid_params")
                .count()).isEqualTo(1.0);
    }

    @Test
    void execute_countsUnexpectedFailureAsError() {
        JobHandler broken = new JobHandler() {
            @Override public String key() { return "transcode"; }

            @Override
            public JsonNode handle(GridJob job, JsonNode params) {
                throw new IllegalStateException("disk full");
            }
        };
        JobHandlerRegistry withBroken = new JobHandlerRegistry(List.of(broken), meterRegistry);

        assertThatThrownBy(() -> withBroken.execute(job(GridJobType.TRANSCODE), JsonNodeFactory.instance.objectNode()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("disk full");
        assertThat(meterRegistry.counter("flowgrid.grid.job.runs", "handler", "transcode", "status", "error").count())
                .isEqualTo(1.0);
    }
}
