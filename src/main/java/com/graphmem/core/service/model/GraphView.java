package com.graphmem.core.service.model;

import java.util.List;

/**
 * Exported view of the memory graph.
 */
public record GraphView(List<GraphNode> nodes, List<GraphEdge> edges) {

    public GraphView {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public long countNodes(String label) {
        return nodes.stream().filter(node -> label.equals(node.label())).count();
    }

    public long countEdges(String type) {
        return edges.stream().filter(edge -> type.equals(edge.type())).count();
    }
}
