package com.flowgrid.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowgrid.orchestrator.flow.ops.OperationAnalyzer;
import com.flowgrid.orchestrator.flow.parser.CompileResult;
import com.flowgrid.orchestrator.flow.parser.FlowParseException;
import com.flowgrid.orchestrator.flow.parser.StepParser;
import com.flowgrid.orchestrator.flow.plan.FlowPlanner;
import com.flowgrid.orchestrator.flow.plan.PlanGraph;
import com.flowgrid.orchestrator.flow.plan.PlanGraphException;
import com.flowgrid.orchestrator.flow.runtime.ExecutionContext;
import com.flowgrid.orchestrator.flow.runtime.ExecutionMode;
import com.flowgrid.orchestrator.flow.runtime.FlowExecutionEngine;
import com.flowgrid.orchestrator.flow.runtime.FlowExecutionResult;
import com.flowgrid.orchestrator.model.GridJobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlowServiceTest {

    private static final String SOURCE = """
            FLOW "Top customers"
            INPUTS
              file sales
            END INPUTS
            STEP load =
              LOAD CSV FROM sales
            STEP paid =
              FILTER load WHERE amount > 0
            STEP result =
              OUTPUT paid AS "r"
            END FLOW
            """;

    @Mock FlowExecutionEngine engine;
    @Mock GridService gridService;

    FlowService service;

    @BeforeEach
    void setUp() {
        service = new FlowService(new StepParser(), new FlowPlanner(new OperationAnalyzer()), engine, gridService, 256);
    }

    // ------------------------------------------------------------------
    // compile() / plan()
    // ------------------------------------------------------------------

    @Test
    void compile_lenientReportsWarnings() {
        CompileResult result = service.compile("FLOW \"empty\"\n", false);

        assertThat(result.ok()).isTrue();
        assertThat(result.warnings()).isNotEmpty();
    }

    @Test
    void plan_storesPerScope() {
        StoredPlan plan = service.plan("acme", SOURCE);

        assertThat(plan.id()).startsWith("plan-");
        assertThat(plan.graph().nodes()).hasSize(3);
        assertThat(service.getPlan(plan.id(), "acme")).contains(plan);
        assertThat(service.getPlan(plan.id(), "other")).isEmpty();
        assertThat(service.listPlans("acme")).containsExactly(plan);
        assertThat(service.listPlans("other")).isEmpty();
    }

    @Test
    void plan_sameSourceReusesGraph() {
        StoredPlan first = service.plan("acme", SOURCE);
        StoredPlan second = service.plan("acme", SOURCE);

        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(second.graph()).isSameAs(first.graph());
    }

    @Test
    void planCache_evictsLeastRecentlyUsedSource() {
        FlowService small = new FlowService(new StepParser(), new FlowPlanner(new OperationAnalyzer()),
                engine, gridService, 2);
        String a = "FLOW \"a\"\nSTEP x =\n  OUTPUT_TEXT \"a\"\nEND FLOW\n";
        String b = "FLOW \"b\"\nSTEP x =\n  OUTPUT_TEXT \"b\"\nEND FLOW\n";
        String c = "FLOW \"c\"\nSTEP x =\n  OUTPUT_TEXT \"c\"\nEND FLOW\n";

        PlanGraph graphA = small.plan("acme", a).graph();
        PlanGraph graphB = small.plan("acme", b).graph();
        small.plan("acme", a);
        small.plan("acme", c);

        assertThat(small.plan("acme", a).graph()).isSameAs(graphA);
        assertThat(small.plan("acme", b).graph()).isNotSameAs(graphB);
    }

    @Test
    void plan_compileErrors_throw() {
        assertThatThrownBy(() -> service.plan("acme", "STEP a =\n  LOAD TABLE t\n"))
                .isInstanceOf(FlowParseException.class)
                .hasMessageContaining("Missing FLOW header");
    }

    @Test
    void plan_unknownDependency_throws() {
        assertThatThrownBy(() -> service.plan("acme", """
                FLOW "broken"
                STEP paid =
                  FILTER ghost WHERE amount > 0
                END FLOW
                """))
                .isInstanceOf(PlanGraphException.class);
    }

    @Test
    void deletePlan_onlyInOwnScope() {
        StoredPlan plan = service.plan("acme", SOURCE);

        assertThat(service.deletePlan(plan.id(), "other")).isFalse();
        assertThat(service.deletePlan(plan.id(), "acme")).isTrue();
        assertThat(service.getPlan(plan.id(), "acme")).isEmpty();
    }

    // ------------------------------------------------------------------
    // execute() / run()
    // ------------------------------------------------------------------

    @Test
    void execute_sync_runsStoredGraph() {
        StoredPlan plan = service.plan("acme", SOURCE);
        Map<String, JsonNode> inputs = Map.of("sales", TextNode.valueOf("amount\n1"));
        FlowExecutionResult expected = FlowExecutionResult.sync(Map.of(), 4, 3);
        when(engine.execute(eq(plan.graph()), eq(inputs), any(ExecutionContext.class))).thenReturn(expected);

        FlowExecutionResult result = service.execute(plan.id(), "acme", inputs, ExecutionMode.SYNC);

        assertThat(result).isSameAs(expected);
        ArgumentCaptor<ExecutionContext> context = ArgumentCaptor.forClass(ExecutionContext.class);
        verify(engine).execute(eq(plan.graph()), eq(inputs), context.capture());
        assertThat(context.getValue().projectScope()).isEqualTo("acme");
        assertThat(context.getValue().depth()).isZero();
    }

    @Test
    void execute_async_submitsFlowRunJob() {
        StoredPlan plan = service.plan("acme", SOURCE);
        UUID jobId = UUID.randomUUID();
        when(gridService.submit(eq("acme"), eq(GridJobType.CUSTOM), any(), isNull())).thenReturn(jobId);

        FlowExecutionResult result = service.execute(plan.id(), "acme",
                Map.of("sales", TextNode.valueOf("amount\n1")), ExecutionMode.ASYNC);

        assertThat(result.mode()).isEqualTo(ExecutionMode.ASYNC);
        assertThat(result.jobId()).isEqualTo(jobId);
        assertThat(result.outputs()).isEmpty();
        ArgumentCaptor<JsonNode> params = ArgumentCaptor.forClass(JsonNode.class);
        verify(gridService).submit(eq("acme"), eq(GridJobType.CUSTOM), params.capture(), isNull());
        assertThat(params.getValue().get("task").textValue()).isEqualTo("flow_run");
        assertThat(params.getValue().get("source").textValue()).isEqualTo(SOURCE);
        assertThat(params.getValue().at("/inputs/sales").textValue()).isEqualTo("amount\n1");
        verifyNoInteractions(engine);
    }

    @Test
    void execute_planFromOtherScope_isRejected() {
        StoredPlan plan = service.plan("acme", SOURCE);

        assertThatThrownBy(() -> service.execute(plan.id(), "other", Map.of(), ExecutionMode.SYNC))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(engine);
    }

    @Test
    void run_async_stillValidatesSource() {
        assertThatThrownBy(() -> service.run("acme", "FLOW \"x\"\nEND FLOW\n", Map.of(), ExecutionMode.ASYNC))
                .isInstanceOf(FlowParseException.class)
                .hasMessageContaining("No STEP definitions found");
        verifyNoInteractions(gridService);
    }

    // ------------------------------------------------------------------
    // describeOperations()
    // ------------------------------------------------------------------

    @Test
    void describeOperations_listsEveryKind() {
        assertThat(service.describeOperations())
                .hasSize(15)
                .extracting(OperationInfo::name)
                .contains("FILTER", "RUN_AGENT", "CALL_FLOW", "OUTPUT_TEXT");
    }
}
