package com.eainde.graphagent.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A bounded, read-only view of part of the graph together with the query that
 * produced it. Snapshots are regenerated per use and never mutated.
 */
public record GraphSnapshot(
        List<Node> nodes,
        List<Edge> edges,
        String query,
        int depth,
        List<String> centralNodeIds
) {
    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        centralNodeIds = centralNodeIds == null ? List.of() : List.copyOf(centralNodeIds);
    }

    public static GraphSnapshot empty(String query) {
        return new GraphSnapshot(List.of(), List.of(), query, 0, List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<Node> nodeById(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public List<Node> neighbors(String nodeId) {
        List<Node> neighbors = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.sourceId().equals(nodeId)) {
                nodeById(edge.targetId()).ifPresent(neighbors::add);
            } else if (edge.targetId().equals(nodeId)) {
                nodeById(edge.sourceId()).ifPresent(neighbors::add);
            }
        }
        return neighbors;
    }
}
