package io.nodewright.core.analysis;

import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.NodeId;
import java.util.List;

/// Nodes lying on any path between two nodes.
///
/// @param from start node
/// @param to end node
/// @param nodes topologically ordered; members of cycles follow in document order
/// @param edges edges with both endpoints inside the subgraph
public record Subgraph(NodeId from, NodeId to, List<NodeId> nodes, List<Edge> edges) {

    public Subgraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
