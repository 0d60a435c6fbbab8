package com.flowgrid.orchestrator.flow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowgrid.orchestrator.flow.ops.OperationAnalyzer;
import com.flowgrid.orchestrator.flow.parser.PayloadParser;
import com.flowgrid.orchestrator.flow.parser.StepParser;
import com.flowgrid.orchestrator.flow.plan.FlowPlanner;
import com.flowgrid.orchestrator.flow.plan.PlanGraph;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.GridService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Runs parsed and planned workflows end to end. Grid-dispatched nodes talk
 * to a mocked {@link GridService}; everything else runs for real.
 */
@ExtendWith(MockitoExtension.class)
class FlowExecutionEngineTest {

    private static final String ORDERS = """
            [
              { region: EU, amount: 10 },
              { region: US, amount: 5 },
              { region: EU, amount: 7.5 },
              { region: APAC, amount: 30 }
            ]
            """;

    @Mock GridService gridService;

    final StepParser parser = new StepParser();
    final FlowPlanner planner = new FlowPlanner(new OperationAnalyzer());
    final Map<String, String> library = new HashMap<>();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    FlowExecutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FlowExecutionEngine(gridService, parser, planner,
                path -> Optional.ofNullable(library.get(path)), meterRegistry, 4, 5, 2000, 2);
    }

    private PlanGraph plan(String source) {
        return planner.build(parser.parse(source, true).ast());
    }

    private FlowExecutionResult run(String source, Map<String, JsonNode> inputs) {
        return engine.execute(plan(source), inputs, ExecutionContext.root("acme"));
    }

    // ------------------------------------------------------------------
    // Data operations
    // ------------------------------------------------------------------

    @Test
    void csvFilterOutput_keepsPositiveRowsUnderLabel() {
        FlowExecutionResult result = run("""
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
                """, Map.of("sales", TextNode.valueOf("customer,amount\nada,120\nbob,0\ncy,-5\ndee,42.5")));

        assertThat(result.mode()).isEqualTo(ExecutionMode.SYNC);
        assertThat(result.outputs()).containsOnlyKeys("r");
        JsonNode rows = result.outputs().get("r");
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("customer").textValue()).isEqualTo("ada");
        assertThat(rows.get(1).get("amount").decimalValue()).isEqualByComparingTo("42.5");
        assertThat(result.metrics().nodesExecuted()).isEqualTo(3);
        assertThat(meterRegistry.counter("flowgrid.flow.executions", "status", "succeeded").count()).isEqualTo(1.0);
        verifyNoInteractions(gridService);
    }

    @Test
    void tableInput_filterKeepsOnlyPositiveAmounts() {
        PlanGraph graph = plan("""
                FLOW "t"
                STEP load =
                  LOAD CSV FROM sales
                STEP valid =
                  FILTER load WHERE amount > 0
                STEP out =
                  OUTPUT valid AS "r"
                END FLOW
                """);
        JsonNode sales = PayloadParser.parse("[{ id: 1, amount: 3 }, { id: 2, amount: 0 }, { id: 3, amount: 0.5 }]");

        FlowExecutionResult result = engine.execute(graph, Map.of("sales", sales), ExecutionContext.root("acme"));

        assertThat(graph.nodes()).hasSize(3);
        assertThat(graph.edges()).hasSize(2);
        assertThat(result.outputs().get("r")).extracting(row -> row.get("id").intValue()).containsExactly(1, 3);
    }

    @Test
    void groupSortTake_producesRankedAggregates() {
        FlowExecutionResult result = run("""
                FLOW "Revenue by region"
                INPUTS
                  table orders
                END INPUTS
                STEP byRegion =
                  GROUP orders BY region
                  AGG count(*) AS n
                  AGG sum(amount) AS revenue
                STEP top =
                  SORT byRegion BY revenue DESC
                  TAKE 2
                STEP out =
                  OUTPUT top AS "top"
                END FLOW
                """, Map.of("orders", PayloadParser.parse(ORDERS)));

        JsonNode top = result.outputs().get("top");
        assertThat(top).hasSize(2);
        assertThat(top.get(0).get("region").textValue()).isEqualTo("APAC");
        assertThat(top.get(0).get("revenue").intValue()).isEqualTo(30);
        assertThat(top.get(1).get("region").textValue()).isEqualTo("EU");
        assertThat(top.get(1).get("n").intValue()).isEqualTo(2);
        assertThat(top.get(1).get("revenue").decimalValue()).isEqualByComparingTo("17.5");
    }

    @Test
    void noOutputStep_returnsEveryNodeById() {
        FlowExecutionResult result = run("""
                FLOW "plain"
                INPUTS
                  table orders
                END INPUTS
                STEP eu =
                  FILTER orders WHERE region == "EU"
                STEP first =
                  TAKE 1
                END FLOW
                """, Map.of("orders", PayloadParser.parse(ORDERS)));

        assertThat(result.outputs()).containsOnlyKeys("step:eu", "step:first");
        assertThat(result.outputs().get("step:eu")).hasSize(2);
        assertThat(result.outputs().get("step:first").get(0).get("amount").intValue()).isEqualTo(10);
    }

    @Test
    void inputsAreNotMutated() {
        JsonNode orders = PayloadParser.parse(ORDERS);
        JsonNode before = orders.deepCopy();

        run("""
                FLOW "sort"
                INPUTS
                  table orders
                END INPUTS
                STEP sorted =
                  SORT orders BY amount
                END FLOW
                """, Map.of("orders", orders));

        assertThat(orders).isEqualTo(before);
    }

    @Test
    void failingNode_stopsDownstreamAndReportsNodeId() {
        assertThatThrownBy(() -> run("""
                FLOW "missing input"
                INPUTS
                  table orders
                END INPUTS
                STEP big =
                  FILTER orders WHERE amount > 5
                STEP out =
                  OUTPUT big
                END FLOW
                """, Map.of()))
                .isInstanceOf(FlowExecutionException.class)
                .hasMessageContaining("missing dataset")
                .satisfies(e -> assertThat(((FlowExecutionException) e).getNodeId()).isEqualTo("step:big"));

        assertThat(meterRegistry.counter("flowgrid.flow.executions", "status", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void payloadTokenNamingLaterStep_staysLiteralText() {
        FlowExecutionEngine sequential = new FlowExecutionEngine(gridService, parser, planner,
                path -> Optional.empty(), meterRegistry, 1, 5, 2000, 2);
        PlanGraph graph = plan("""
                FLOW "forward"
                STEP s0 =
                  OUTPUT_TEXT "seed"
                STEP a =
                  OUTPUT_TEXT { v: s0, w: later }
                STEP later =
                  OUTPUT_TEXT "hi"
                END FLOW
                """);

        FlowExecutionResult result = sequential.execute(graph, Map.of(), ExecutionContext.root("acme"));

        assertThat(graph.edges()).extracting(edge -> edge.from() + "->" + edge.to())
                .containsExactly("step:s0->step:a");
        JsonNode a = result.outputs().get("step:a");
        assertThat(a.get("v").textValue()).isEqualTo("seed");
        assertThat(a.get("w").textValue()).isEqualTo("later");
    }

    // ------------------------------------------------------------------
    // Grid-dispatched operations
    // ------------------------------------------------------------------

    private static final String AGENT_FLOW = """
            FLOW "agents"
            INPUTS
              json brief
            END INPUTS
            STEP plan =
              RUN AGENT "planner" WITH goal = brief.title
            STEP say =
              OUTPUT_TEXT plan.status
            END FLOW
            """;

    @Test
    void agentStep_submitsResolvedPayloadAndUsesResult() {
        UUID jobId = UUID.randomUUID();
        GridJob job = new GridJob("acme", GridJobType.INFERENCE, "{}", null);
        job.markRunning("worker-1");
        job.markSucceeded("{\"status\":\"completed\"}");
        when(gridService.submit(eq("acme"), eq(GridJobType.INFERENCE), any(), any())).thenReturn(jobId);
        when(gridService.awaitJob(eq(jobId), any(), any())).thenReturn(job);
        when(gridService.result(job)).thenReturn(PayloadParser.parse("{ status: completed }"));

        FlowExecutionResult result = run(AGENT_FLOW, Map.of("brief", PayloadParser.parse("{ title: Launch }")));

        ArgumentCaptor<JsonNode> params = ArgumentCaptor.forClass(JsonNode.class);
        ArgumentCaptor<JsonNode> refs = ArgumentCaptor.forClass(JsonNode.class);
        verify(gridService).submit(eq("acme"), eq(GridJobType.INFERENCE), params.capture(), refs.capture());
        assertThat(params.getValue().get("agent").textValue()).isEqualTo("planner");
        assertThat(params.getValue().at("/payload/goal").textValue()).isEqualTo("Launch");
        assertThat(refs.getValue().get("nodeId").textValue()).isEqualTo("step:plan");
        assertThat(refs.getValue().get("runId").textValue()).startsWith("run-");

        assertThat(result.outputs().get("step:say").textValue()).isEqualTo("completed");
    }

    @Test
    void failedGridJob_surfacesJobId() {
        UUID jobId = UUID.randomUUID();
        GridJob job = new GridJob("acme", GridJobType.INFERENCE, "{}", null);
        job.markRunning("worker-1");
        job.markFailed("model offline");
        when(gridService.submit(eq("acme"), eq(GridJobType.INFERENCE), any(), any())).thenReturn(jobId);
        when(gridService.awaitJob(eq(jobId), any(), any())).thenReturn(job);

        assertThatThrownBy(() -> run(AGENT_FLOW, Map.of("brief", PayloadParser.parse("{ title: Launch }"))))
                .isInstanceOf(FlowExecutionException.class)
                .hasMessageContaining("model offline")
                .satisfies(e -> {
                    FlowExecutionException failure = (FlowExecutionException) e;
                    assertThat(failure.getNodeId()).isEqualTo("step:plan");
                    assertThat(failure.getJobId()).isEqualTo(jobId);
                });
        verify(gridService, never()).result(any());
    }

    // ------------------------------------------------------------------
    // CALL FLOW
    // ------------------------------------------------------------------

    @Test
    void callFlow_runsSubflowWithMappedInputs() {
        library.put("lib/big.flow", """
                FLOW "big orders"
                INPUTS
                  table rows
                END INPUTS
                STEP big =
                  FILTER rows WHERE amount > 5
                STEP out =
                  OUTPUT big AS "big"
                END FLOW
                """);

        FlowExecutionResult result = run("""
                FLOW "main"
                INPUTS
                  table orders
                END INPUTS
                STEP sub =
                  CALL FLOW "lib/big.flow" WITH rows = orders
                END FLOW
                """, Map.of("orders", PayloadParser.parse(ORDERS)));

        JsonNode sub = result.outputs().get("step:sub");
        assertThat(sub.get("big")).hasSize(3);
    }

    @Test
    void callFlow_recursionIsBoundedByDepth() {
        library.put("self.flow", """
                FLOW "loop"
                STEP again =
                  CALL FLOW "self.flow" WITH { n: 1 }
                END FLOW
                """);

        assertThatThrownBy(() -> run(library.get("self.flow"), Map.of()))
                .isInstanceOf(FlowExecutionException.class)
                .hasMessageContaining("nesting exceeds 2");
    }

    @Test
    void callFlow_unknownPath_fails() {
        assertThatThrownBy(() -> run("""
                FLOW "main"
                STEP sub =
                  CALL FLOW "nowhere.flow" WITH { n: 1 }
                END FLOW
                """, Map.of()))
                .isInstanceOf(FlowExecutionException.class)
                .hasMessageContaining("no flow found");
    }

    @Test
    void siblingBranchRunsWhileJobNodeIsSuspended() throws Exception {
        UUID plannerId = UUID.randomUUID();
        UUID reporterId = UUID.randomUUID();
        GridJob plannerJob = succeededJob("{\"status\":\"completed\"}");
        GridJob reporterJob = succeededJob("{\"sent\":true}");
        CountDownLatch reporterSubmitted = new CountDownLatch(1);
        AtomicBoolean siblingFinishedFirst = new AtomicBoolean();
        List<String> events = Collections.synchronizedList(new ArrayList<>());

        when(gridService.submit(eq("acme"), eq(GridJobType.INFERENCE), any(), any())).thenAnswer(invocation -> {
            JsonNode params = invocation.getArgument(2);
            String agent = params.get("agent").textValue();
            events.add(agent + " submitted");
            if (agent.equals("reporter")) {
                reporterSubmitted.countDown();
                return reporterId;
            }
            return plannerId;
        });
        when(gridService.awaitJob(eq(plannerId), any(), any())).thenAnswer(invocation -> {
            siblingFinishedFirst.set(reporterSubmitted.await(5, TimeUnit.SECONDS));
            events.add("planner released");
            return plannerJob;
        });
        when(gridService.awaitJob(eq(reporterId), any(), any())).thenReturn(reporterJob);
        when(gridService.result(plannerJob)).thenReturn(PayloadParser.parse("{ status: completed }"));
        when(gridService.result(reporterJob)).thenReturn(PayloadParser.parse("{ sent: true }"));

        FlowExecutionResult result = run("""
                FLOW "branches"
                INPUTS
                  table orders
                  json brief
                END INPUTS
                STEP plan =
                  RUN AGENT "planner" WITH goal = brief.title
                STEP say =
                  OUTPUT_TEXT plan.status
                STEP eu =
                  FILTER orders WHERE region == "EU"
                STEP notify =
                  RUN AGENT "reporter" WITH rows = eu
                END FLOW
                """, Map.of("orders", PayloadParser.parse(ORDERS), "brief", PayloadParser.parse("{ title: Launch }")));

        assertThat(siblingFinishedFirst).isTrue();
        assertThat(events.indexOf("reporter submitted")).isLessThan(events.indexOf("planner released"));
        assertThat(result.outputs().get("step:say").textValue()).isEqualTo("completed");
        assertThat(result.outputs().get("step:notify").get("sent").booleanValue()).isTrue();

        ArgumentCaptor<JsonNode> params = ArgumentCaptor.forClass(JsonNode.class);
        verify(gridService, times(2)).submit(eq("acme"), eq(GridJobType.INFERENCE), params.capture(), any());
        JsonNode reporterParams = params.getAllValues().stream()
                .filter(p -> p.get("agent").textValue().equals("reporter"))
                .findFirst().orElseThrow();
        assertThat(reporterParams.at("/payload/rows")).hasSize(2);
    }

    @Test
    void dependentNeverStartsBeforeUpstreamFinishes() {
        FlowExecutionEngine wide = new FlowExecutionEngine(gridService, parser, planner,
                path -> Optional.empty(), meterRegistry, 8, 5, 2000, 2);
        PlanGraph graph = plan("""
                FLOW "diamond"
                INPUTS
                  table orders
                END INPUTS
                STEP eu =
                  FILTER orders WHERE region == "EU"
                STEP us =
                  FILTER orders WHERE region == "US"
                STEP euTop =
                  SORT eu BY amount DESC
                  TAKE 1
                STEP both =
                  OUTPUT_TEXT { eu: euTop, us: us }
                END FLOW
                """);

        for (int i = 0; i < 20; i++) {
            FlowExecutionResult result = wide.execute(graph, Map.of("orders", PayloadParser.parse(ORDERS)),
                    ExecutionContext.root("acme"));

            JsonNode both = result.outputs().get("step:both");
            assertThat(both.get("eu").isArray()).isTrue();
            assertThat(both.get("eu")).hasSize(1);
            assertThat(both.get("eu").get(0).get("amount").intValue()).isEqualTo(10);
            assertThat(both.get("us")).hasSize(1);
            assertThat(result.metrics().nodesExecuted()).isEqualTo(4);
        }
        verifyNoInteractions(gridService);
    }

    private static GridJob succeededJob(String resultJson) {
        GridJob job = new GridJob("acme", GridJobType.INFERENCE, "{}", null);
        job.markRunning("worker-1");
        job.markSucceeded(resultJson);
        return job;
    }
}
