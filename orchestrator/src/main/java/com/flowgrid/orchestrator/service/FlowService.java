package com.flowgrid.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.flow.ops.OperationKind;
import com.flowgrid.orchestrator.flow.parser.CompileResult;
import com.flowgrid.orchestrator.flow.parser.FlowParseException;
import com.flowgrid.orchestrator.flow.parser.StepParser;
import com.flowgrid.orchestrator.flow.plan.FlowPlanner;
import com.flowgrid.orchestrator.flow.plan.PlanGraph;
import com.flowgrid.orchestrator.flow.runtime.ExecutionContext;
import com.flowgrid.orchestrator.flow.runtime.ExecutionMode;
import com.flowgrid.orchestrator.flow.runtime.FlowExecutionEngine;
import com.flowgrid.orchestrator.flow.runtime.FlowExecutionResult;
import com.flowgrid.orchestrator.model.GridJobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compile, plan and run FLOW workflows.
 *
 * Plans are kept per project scope under an id of the form
 * {@code plan-<uuid>}. Plan graphs are cached by source text, so planning the
 * same source twice analyses it once. The cache keeps the
 * {@code flowgrid.flow.plan-cache-size} most recently used sources.
 */
@Service
public class FlowService {

    private static final Logger log = LoggerFactory.getLogger(FlowService.class);

    static final String FLOW_RUN_TASK = "flow_run";

    private final StepParser stepParser;
    private final FlowPlanner planner;
    private final FlowExecutionEngine engine;
    private final GridService gridService;

    private final Map<String, StoredPlan> plans = new ConcurrentHashMap<>();
    private final Map<String, CompiledFlow> compiledBySource;

    private record CompiledFlow(CompileResult compile, PlanGraph graph) {}

    public FlowService(StepParser stepParser,
                       FlowPlanner planner,
                       FlowExecutionEngine engine,
                       GridService gridService,
                       @Value("${flowgrid.flow.plan-cache-size:256}") int planCacheSize) {
        this.stepParser = stepParser;
        this.planner = planner;
        this.engine = engine;
        this.gridService = gridService;
        // guarded by itself; access order makes the eldest entry the least recently used
        this.compiledBySource = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CompiledFlow> eldest) {
                return size() > planCacheSize;
            }
        };
    }

    // ------------------------------------------------------------------
    // Compile & plan
    // ------------------------------------------------------------------

    public CompileResult compile(String source, boolean strict) {
        return stepParser.parse(source, strict);
    }

    /**
     * Strict compile plus graph build, stored for later {@link #execute}.
     *
     * @throws FlowParseException                                          on compile errors
     * @throws com.flowgrid.orchestrator.flow.ops.OperationSyntaxException on a malformed step
     * @throws com.flowgrid.orchestrator.flow.plan.PlanGraphException      on unresolved names or cycles
     */
    public StoredPlan plan(String projectScope, String source) {
        CompiledFlow compiled = compileStrict(source);
        StoredPlan plan = new StoredPlan("plan-" + UUID.randomUUID(), projectScope, source,
                compiled.compile().ast(), compiled.graph(), Instant.now());
        plans.put(plan.id(), plan);
        log.info("Stored plan {} for FLOW '{}' in scope {}", plan.id(), plan.ast().name(), projectScope);
        return plan;
    }

    public Optional<StoredPlan> getPlan(String planId, String projectScope) {
        StoredPlan plan = plans.get(planId);
        return plan != null && plan.projectScope().equals(projectScope) ? Optional.of(plan) : Optional.empty();
    }

    public List<StoredPlan> listPlans(String projectScope) {
        return plans.values().stream()
                .filter(p -> p.projectScope().equals(projectScope))
                .sorted(Comparator.comparing(StoredPlan::createdAt))
                .toList();
    }

    public boolean deletePlan(String planId, String projectScope) {
        return getPlan(planId, projectScope).map(p -> plans.remove(planId) != null).orElse(false);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public FlowExecutionResult execute(String planId, String projectScope, Map<String, JsonNode> inputs,
                                       ExecutionMode mode) {
        StoredPlan plan = getPlan(planId, projectScope)
                .orElseThrow(() -> new IllegalArgumentException("No plan " + planId + " in scope " + projectScope));
        return mode == ExecutionMode.ASYNC
                ? submitRun(projectScope, plan.source(), inputs)
                : engine.execute(plan.graph(), inputs, ExecutionContext.root(projectScope));
    }

    /** Compile, plan and execute in one call, without storing the plan. */
    public FlowExecutionResult run(String projectScope, String source, Map<String, JsonNode> inputs,
                                   ExecutionMode mode) {
        CompiledFlow compiled = compileStrict(source);
        return mode == ExecutionMode.ASYNC
                ? submitRun(projectScope, source, inputs)
                : engine.execute(compiled.graph(), inputs, ExecutionContext.root(projectScope));
    }

    public List<OperationInfo> describeOperations() {
        return Arrays.stream(OperationKind.values())
                .map(k -> new OperationInfo(k.name(), k.category(), k.description()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CompiledFlow compileStrict(String source) {
        synchronized (compiledBySource) {
            CompiledFlow cached = compiledBySource.get(source);
            if (cached != null) {
                return cached;
            }
        }
        CompileResult result = stepParser.parse(source, true);
        if (!result.ok()) {
            throw new FlowParseException(result.errors());
        }
        CompiledFlow compiled = new CompiledFlow(result, planner.build(result.ast()));
        synchronized (compiledBySource) {
            CompiledFlow raced = compiledBySource.putIfAbsent(source, compiled);
            return raced != null ? raced : compiled;
        }
    }

    private FlowExecutionResult submitRun(String projectScope, String source, Map<String, JsonNode> inputs) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("task", FLOW_RUN_TASK);
        params.put("source", source);
        ObjectNode inputValues = params.putObject("inputs");
        inputs.forEach(inputValues::set);
        UUID jobId = gridService.submit(projectScope, GridJobType.CUSTOM, params, null);
        log.info("Flow run submitted as grid job {}", jobId);
        return FlowExecutionResult.async(jobId);
    }
}
