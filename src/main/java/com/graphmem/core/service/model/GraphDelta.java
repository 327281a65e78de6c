package com.graphmem.core.service.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Proposed, not yet persisted set of nodes and relationships.
 *
 * Uses the same labels and relationship types as the persisted graph.
 */
public record GraphDelta(List<GraphNode> nodes, List<GraphEdge> edges) {

    public GraphDelta {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static GraphDelta empty() {
        return new GraphDelta(List.of(), List.of());
    }

    /**
     * Message nodes in dialogue order.
     */
    public List<GraphNode> messageNodes() {
        return nodes.stream()
                .filter(node -> GraphLabels.SHORT_TERM_MESSAGE.equals(node.label()))
                .sorted(Comparator.comparingLong(GraphDelta::sequenceOf))
                .toList();
    }

    public Optional<GraphNode> knowledgeNode() {
        return nodes.stream()
                .filter(node -> GraphLabels.KNOWLEDGE.equals(node.label()))
                .findFirst();
    }

    private static long sequenceOf(GraphNode node) {
        Object sequence = node.properties().get("sequence");
        return sequence instanceof Number number ? number.longValue() : 0L;
    }
}
