package com.flowgrid.orchestrator.flow.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable DAG of plan nodes. Nodes keep source order; edges point from
 * producer to consumer.
 */
public record PlanGraph(List<PlanNode> nodes, List<PlanEdge> edges) {

    public PlanGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<PlanNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<String> upstream(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).map(PlanEdge::from).toList();
    }

    public List<String> downstream(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).map(PlanEdge::to).toList();
    }

    /** Number of incoming edges per node id, every node present. */
    public Map<String, Integer> inDegrees() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        nodes.forEach(n -> degrees.put(n.id(), 0));
        edges.forEach(e -> degrees.merge(e.to(), 1, Integer::sum));
        return degrees;
    }

    /**
     * Kahn's algorithm, ties broken by source order.
     *
     * @throws PlanGraphException if the graph is not acyclic
     */
    public List<PlanNode> topologicalOrder() {
        Map<String, Integer> remaining = inDegrees();
        Map<String, PlanNode> byId = new HashMap<>();
        nodes.forEach(n -> byId.put(n.id(), n));

        Deque<String> ready = new ArrayDeque<>();
        remaining.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        List<PlanNode> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(byId.get(id));
            for (String next : downstream(id)) {
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() != nodes.size()) {
            throw new PlanGraphException("Plan graph is not acyclic");
        }
        return order;
    }
}
