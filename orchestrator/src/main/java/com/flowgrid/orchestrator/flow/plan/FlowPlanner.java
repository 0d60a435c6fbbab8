package com.flowgrid.orchestrator.flow.plan;

import com.flowgrid.orchestrator.flow.ops.AnalyzedStep;
import com.flowgrid.orchestrator.flow.ops.Operation;
import com.flowgrid.orchestrator.flow.ops.OperationAnalyzer;
import com.flowgrid.orchestrator.flow.ops.OperationKind;
import com.flowgrid.orchestrator.flow.parser.FlowStep;
import com.flowgrid.orchestrator.flow.parser.WorkflowAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link PlanGraph} for a parsed workflow.
 *
 * <p>Edges come from two places:
 * <ol>
 *   <li>hard dependencies reported by the analyzer (FILTER source, BUILD_VPKG
 *       ref, ...), which must name a step or a declared input;</li>
 *   <li>string tokens inside payload literals whose head segment names a step
 *       declared earlier in the source ({@code goal: plan.result}).</li>
 * </ol>
 * Inputs satisfy a dependency without producing an edge.
 */
@Component
public class FlowPlanner {

    private static final Logger log = LoggerFactory.getLogger(FlowPlanner.class);

    private final OperationAnalyzer analyzer;

    public FlowPlanner(OperationAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public PlanGraph build(WorkflowAst ast) {
        List<FlowStep> steps = ast.steps();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            if (positions.putIfAbsent(steps.get(i).name(), i) != null) {
                throw PlanGraphException.duplicate(steps.get(i).name());
            }
        }
        Set<String> inputNames = ast.inputNames();

        List<PlanNode> nodes = new ArrayList<>();
        List<PlanEdge> edges = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            FlowStep step = steps.get(i);
            AnalyzedStep analyzed = analyzer.analyze(step, i > 0 ? steps.get(i - 1).name() : null);
            String nodeId = PlanNode.idFor(step.name());

            Set<String> dependencies = new LinkedHashSet<>();
            for (String dependency : analyzed.dependencies()) {
                if (!positions.containsKey(dependency) && !inputNames.contains(dependency)) {
                    throw PlanGraphException.unresolved(step.name(), dependency);
                }
                dependencies.add(dependency);
            }
            for (String reference : analyzed.operation().references()) {
                String head = headSegment(reference);
                Integer position = positions.get(head);
                if (position != null && position < i) {
                    dependencies.add(head);
                }
            }
            for (String dependency : dependencies) {
                if (positions.containsKey(dependency)) {
                    edges.add(new PlanEdge(PlanNode.idFor(dependency), nodeId, dependency));
                }
            }

            PlanNodeMeta meta = new PlanNodeMeta(step.name(), step.startLine(), analyzed.warnings());
            nodes.add(new PlanNode(nodeId, kindOf(analyzed.operation()), analyzed.operation(),
                    List.copyOf(dependencies), List.of(step.name()), meta));
        }

        rejectCycles(nodes, edges);
        log.info("Planned FLOW '{}': {} nodes, {} edges", ast.name(), nodes.size(), edges.size());
        return new PlanGraph(nodes, edges);
    }

    static PlanNodeKind kindOf(Operation operation) {
        OperationKind kind = operation.kind();
        return switch (kind) {
            case LOAD_TABLE, LOAD_CSV, LOAD_JSON, FILTER, GROUP_AGG, SORT, TAKE,
                 OUTPUT, OUTPUT_TEXT, CALL_FLOW -> PlanNodeKind.DATA_OP;
            case RUN_VASM -> PlanNodeKind.BYTECODE_OP;
            case RUN_AGENT, APX_EXEC, BUILD_VPKG, DEPLOY_SERVICE -> PlanNodeKind.JOB_OP;
        };
    }

    /** {@code plan.result.items[0]} → {@code plan}. */
    static String headSegment(String reference) {
        int end = reference.length();
        int dot = reference.indexOf('.');
        int bracket = reference.indexOf('[');
        if (dot >= 0) end = Math.min(end, dot);
        if (bracket >= 0) end = Math.min(end, bracket);
        return reference.substring(0, end);
    }

    // ------------------------------------------------------------------
    // Cycle detection (three-colour DFS)
    // ------------------------------------------------------------------

    private enum Colour { WHITE, GREY, BLACK }

    private void rejectCycles(List<PlanNode> nodes, List<PlanEdge> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        nodes.forEach(n -> adjacency.put(n.id(), new ArrayList<>()));
        edges.forEach(e -> adjacency.get(e.from()).add(e.to()));

        Map<String, Colour> colours = new HashMap<>();
        nodes.forEach(n -> colours.put(n.id(), Colour.WHITE));
        for (PlanNode node : nodes) {
            if (colours.get(node.id()) == Colour.WHITE) {
                visit(node.id(), adjacency, colours, new ArrayList<>());
            }
        }
    }

    private void visit(String id, Map<String, List<String>> adjacency, Map<String, Colour> colours, List<String> path) {
        colours.put(id, Colour.GREY);
        path.add(id);
        for (String next : adjacency.get(id)) {
            Colour colour = colours.get(next);
            if (colour == Colour.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                throw PlanGraphException.cycle(cycle.stream().map(FlowPlanner::stepNameOf).toList());
            }
            if (colour == Colour.WHITE) {
                visit(next, adjacency, colours, path);
            }
        }
        path.remove(path.size() - 1);
        colours.put(id, Colour.BLACK);
    }

    private static String stepNameOf(String nodeId) {
        return nodeId.startsWith(PlanNode.ID_PREFIX) ? nodeId.substring(PlanNode.ID_PREFIX.length()) : nodeId;
    }
}
