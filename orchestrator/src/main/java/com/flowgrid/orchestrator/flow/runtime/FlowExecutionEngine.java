package com.flowgrid.orchestrator.flow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgrid.orchestrator.flow.ops.Operation;
import com.flowgrid.orchestrator.flow.parser.CompileResult;
import com.flowgrid.orchestrator.flow.parser.FlowParseException;
import com.flowgrid.orchestrator.flow.parser.StepParser;
import com.flowgrid.orchestrator.flow.plan.FlowPlanner;
import com.flowgrid.orchestrator.flow.plan.PlanGraph;
import com.flowgrid.orchestrator.flow.plan.PlanNode;
import com.flowgrid.orchestrator.model.GridJob;
import com.flowgrid.orchestrator.model.GridJobStatus;
import com.flowgrid.orchestrator.model.GridJobType;
import com.flowgrid.orchestrator.service.GridAwaitTimeoutException;
import com.flowgrid.orchestrator.service.GridService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link PlanGraph}.
 *
 * <p>Scheduling is by in-degree: every node whose upstream nodes have all
 * finished is submitted to a pool of {@code flowgrid.flow.parallelism}
 * threads, and each completion releases its dependents. After the first
 * failure nothing new is started; the nodes already running are drained and
 * the failure is rethrown.
 *
 * <p>Data operations run in-process. Agent, external-exec, package and
 * bytecode operations are submitted to the grid and the node blocks until the
 * job is terminal. CALL FLOW compiles and runs the sub-workflow in-process.
 */
@Component
public class FlowExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowExecutionEngine.class);

    private final GridService gridService;
    private final StepParser stepParser;
    private final FlowPlanner planner;
    private final FlowSourceResolver sourceResolver;
    private final MeterRegistry meterRegistry;
    private final int parallelism;
    private final Duration pollInterval;
    private final Duration awaitTimeout;
    private final int maxCallDepth;

    private final AtomicInteger threadIndex = new AtomicInteger();

    public FlowExecutionEngine(GridService gridService,
                               StepParser stepParser,
                               FlowPlanner planner,
                               FlowSourceResolver sourceResolver,
                               MeterRegistry meterRegistry,
                               @Value("${flowgrid.flow.parallelism:4}") int parallelism,
                               @Value("${flowgrid.grid.await-poll-interval-ms:200}") long pollIntervalMs,
                               @Value("${flowgrid.grid.await-timeout-ms:300000}") long awaitTimeoutMs,
                               @Value("${flowgrid.flow.max-call-depth:8}") int maxCallDepth) {
        this.gridService = gridService;
        this.stepParser = stepParser;
        this.planner = planner;
        this.sourceResolver = sourceResolver;
        this.meterRegistry = meterRegistry;
        this.parallelism = parallelism;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.awaitTimeout = Duration.ofMillis(awaitTimeoutMs);
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Execute every node and collect the outputs.
     *
     * @throws FlowExecutionException for the first node that failed
     */
    public FlowExecutionResult execute(PlanGraph graph, Map<String, JsonNode> inputs, ExecutionContext context) {
        long started = System.nanoTime();
        Map<String, JsonNode> state = new ConcurrentHashMap<>();
        ValueResolver resolver = new ValueResolver(state, new HashMap<>(inputs));

        Map<String, PlanNode> byId = new LinkedHashMap<>();
        graph.nodes().forEach(n -> byId.put(n.id(), n));
        Map<String, Integer> remaining = graph.inDegrees();

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, parallelism), runnable ->
                new Thread(runnable, "flow-" + context.runId() + "-" + threadIndex.incrementAndGet()));
        CompletionService<String> completions = new ExecutorCompletionService<>(pool);
        int inFlight = 0;
        int executed = 0;
        FlowExecutionException failure = null;

        try {
            for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
                if (entry.getValue() == 0) {
                    submit(completions, byId.get(entry.getKey()), state, resolver, context);
                    inFlight++;
                }
            }
            while (inFlight > 0) {
                String finishedId;
                try {
                    finishedId = completions.take().get();
                } catch (ExecutionException e) {
                    inFlight--;
                    if (failure == null) {
                        failure = asFlowFailure(e.getCause());
                    }
                    continue;
                }
                inFlight--;
                executed++;
                if (failure != null) {
                    continue;
                }
                for (String next : graph.downstream(finishedId)) {
                    if (remaining.merge(next, -1, Integer::sum) == 0) {
                        submit(completions, byId.get(next), state, resolver, context);
                        inFlight++;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowExecutionException("-", null, "interrupted while executing run " + context.runId(), e);
        } finally {
            pool.shutdownNow();
        }

        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        if (failure != null) {
            meterRegistry.counter("flowgrid.flow.executions", "status", "failed").increment();
            log.warn("Flow run {} failed after {} nodes: {}", context.runId(), executed, failure.getMessage());
            throw failure;
        }
        meterRegistry.counter("flowgrid.flow.executions", "status", "succeeded").increment();
        log.info("Flow run {} finished: {} nodes in {} ms", context.runId(), executed, elapsedMs);
        return FlowExecutionResult.sync(collectOutputs(graph, state), elapsedMs, executed);
    }

    private void submit(CompletionService<String> completions, PlanNode node, Map<String, JsonNode> state,
                        ValueResolver resolver, ExecutionContext context) {
        completions.submit(() -> {
            MDC.put("runId", context.runId());
            MDC.put("nodeId", node.id());
            try {
                JsonNode value = evaluate(node, resolver.scopedTo(node.inputs()), context);
                state.put(node.stepName(), value == null ? JsonNodeFactory.instance.nullNode() : value);
                log.debug("Node {} done", node.id());
                return node.id();
            } catch (FlowExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FlowExecutionException(node.id(), null, e.getMessage(), e);
            } finally {
                MDC.clear();
            }
        });
    }

    private static FlowExecutionException asFlowFailure(Throwable cause) {
        if (cause instanceof FlowExecutionException) {
            return (FlowExecutionException) cause;
        }
        return new FlowExecutionException("-", null, String.valueOf(cause), cause);
    }

    private static Map<String, JsonNode> collectOutputs(PlanGraph graph, Map<String, JsonNode> state) {
        Map<String, JsonNode> labelled = new LinkedHashMap<>();
        for (PlanNode node : graph.nodes()) {
            if (node.operation() instanceof Operation.Output) {
                labelled.put(((Operation.Output) node.operation()).label(), state.get(node.stepName()));
            }
        }
        if (!labelled.isEmpty()) {
            return labelled;
        }
        Map<String, JsonNode> all = new LinkedHashMap<>();
        for (PlanNode node : graph.nodes()) {
            all.put(node.id(), state.get(node.stepName()));
        }
        return all;
    }

    // ------------------------------------------------------------------
    // Node evaluation
    // ------------------------------------------------------------------

    private JsonNode evaluate(PlanNode node, ValueResolver resolver, ExecutionContext context) {
        Operation op = node.operation();
        return switch (op.kind()) {
            case LOAD_TABLE -> resolver.dataset(((Operation.LoadTable) op).table());
            case LOAD_CSV -> resolver.dataset(((Operation.LoadCsv) op).source());
            case LOAD_JSON -> loadJson((Operation.LoadJson) op, resolver);
            case FILTER -> {
                Operation.Filter filter = (Operation.Filter) op;
                yield TableOperations.filter(resolver.dataset(filter.source()), filter.condition());
            }
            case GROUP_AGG -> {
                Operation.GroupAggregate group = (Operation.GroupAggregate) op;
                yield TableOperations.groupAggregate(resolver.dataset(group.source()), group.groupBy(), group.aggregations());
            }
            case SORT -> {
                Operation.Sort sort = (Operation.Sort) op;
                yield TableOperations.sort(resolver.dataset(sort.source()), sort.field(), sort.direction(), sort.limit());
            }
            case TAKE -> {
                Operation.Take take = (Operation.Take) op;
                yield TableOperations.take(resolver.dataset(take.source()), take.count());
            }
            case OUTPUT -> resolver.dataset(((Operation.Output) op).source());
            case OUTPUT_TEXT -> {
                JsonNode text = resolver.resolveLiteral(((Operation.OutputText) op).value());
                log.info("Flow text output [{}]: {}", node.stepName(), text.isTextual() ? text.textValue() : text);
                yield text;
            }
            case RUN_AGENT -> {
                Operation.RunAgent agent = (Operation.RunAgent) op;
                ObjectNode params = JsonNodeFactory.instance.objectNode();
                params.put("agent", agent.agent());
                params.set("payload", resolver.resolveLiteral(agent.payload()));
                yield dispatch(node, GridJobType.INFERENCE, params, context);
            }
            case APX_EXEC -> {
                Operation.ExternalExec exec = (Operation.ExternalExec) op;
                ObjectNode params = JsonNodeFactory.instance.objectNode();
                params.put("task", "apx_exec");
                params.put("target", exec.target());
                params.set("payload", resolver.resolveLiteral(exec.payload()));
                yield dispatch(node, GridJobType.CUSTOM, params, context);
            }
            case BUILD_VPKG -> {
                Operation.BuildPackage build = (Operation.BuildPackage) op;
                ObjectNode params = JsonNodeFactory.instance.objectNode();
                params.put("manifestRef", build.manifestRef());
                if (build.stepReference()) {
                    params.set("manifest", resolver.reference(build.manifestRef())
                            .orElseThrow(() -> new IllegalArgumentException("unresolved manifest \"" + build.manifestRef() + "\"")));
                }
                yield dispatch(node, GridJobType.BUILD_ARTIFACT, params, context);
            }
            case DEPLOY_SERVICE -> {
                Operation.DeployService deploy = (Operation.DeployService) op;
                ObjectNode params = JsonNodeFactory.instance.objectNode();
                params.put("task", "deploy_service");
                params.put("vpkgId", packageId(deploy, resolver));
                params.put("serviceName", deploy.serviceName());
                yield dispatch(node, GridJobType.CUSTOM, params, context);
            }
            case RUN_VASM -> {
                Operation.RunBytecode vasm = (Operation.RunBytecode) op;
                ObjectNode params = JsonNodeFactory.instance.objectNode();
                params.put("program", vasm.program());
                params.set("input", resolver.resolveLiteral(vasm.input()));
                yield dispatch(node, GridJobType.EXEC_ARTIFACT, params, context);
            }
            case CALL_FLOW -> callSubflow(node, (Operation.CallSubflow) op, resolver, context);
        };
    }

    private static JsonNode loadJson(Operation.LoadJson op, ValueResolver resolver) {
        JsonNode value = resolver.reference(op.source())
                .orElseThrow(() -> new IllegalArgumentException("missing input \"" + op.source() + "\""));
        return value.deepCopy();
    }

    private static String packageId(Operation.DeployService deploy, ValueResolver resolver) {
        if (!deploy.stepReference()) {
            return deploy.packageRef();
        }
        JsonNode built = resolver.reference(deploy.packageRef())
                .orElseThrow(() -> new IllegalArgumentException("unresolved package \"" + deploy.packageRef() + "\""));
        if (built.isTextual()) {
            return built.textValue();
        }
        if (built.hasNonNull("vpkgId")) {
            return built.get("vpkgId").asText();
        }
        throw new IllegalArgumentException("DEPLOY_SERVICE expected a package reference in \"" + deploy.packageRef() + "\"");
    }

    /** Submit, block until terminal, return the job's result. */
    private JsonNode dispatch(PlanNode node, GridJobType type, ObjectNode params, ExecutionContext context) {
        ObjectNode inputRefs = JsonNodeFactory.instance.objectNode();
        inputRefs.put("runId", context.runId());
        inputRefs.put("nodeId", node.id());
        UUID jobId = gridService.submit(context.projectScope(), type, params, inputRefs);
        GridJob job;
        try {
            job = gridService.awaitJob(jobId, pollInterval, awaitTimeout);
        } catch (GridAwaitTimeoutException e) {
            throw new FlowExecutionException(node.id(), jobId, e.getMessage(), e);
        }
        if (job.getStatus() == GridJobStatus.FAILED) {
            throw new FlowExecutionException(node.id(), jobId, "grid job FAILED: " + job.getError(), null);
        }
        return gridService.result(job);
    }

    private JsonNode callSubflow(PlanNode node, Operation.CallSubflow call, ValueResolver resolver,
                                 ExecutionContext context) {
        if (context.depth() >= maxCallDepth) {
            throw new IllegalStateException("CALL FLOW nesting exceeds " + maxCallDepth + " at \"" + call.path() + "\"");
        }
        String source = sourceResolver.resolve(call.path())
                .orElseThrow(() -> new IllegalArgumentException("no flow found at \"" + call.path() + "\""));
        CompileResult compiled = stepParser.parse(source, true);
        if (!compiled.ok()) {
            throw new FlowParseException(compiled.errors());
        }
        PlanGraph subGraph = planner.build(compiled.ast());

        Map<String, JsonNode> subInputs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = resolver.resolveLiteral(call.input()).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            subInputs.put(field.getKey(), field.getValue());
        }
        log.info("Node {} calls flow '{}' ({} inputs)", node.id(), compiled.ast().name(), subInputs.size());
        FlowExecutionResult result = execute(subGraph, subInputs, context.nested());

        ObjectNode outputs = JsonNodeFactory.instance.objectNode();
        result.outputs().forEach(outputs::set);
        return outputs;
    }
}
