package io.nodewright.core.analysis;

import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.NodeId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Result of an upstream or downstream traversal.
///
/// Nodes are kept in discovery order, which is depth order: every node is
/// reported once, at the shortest depth it was reached.
///
/// @param origin the node the traversal started from
/// @param depths reached node to depth, origin excluded, in discovery order
/// @param edges traversed edges, including virtual variable edges
public record Closure(NodeId origin, Map<NodeId, Integer> depths, List<Edge> edges) {

    public Closure {
        depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
        edges = List.copyOf(edges);
    }

    /// @return reached nodes in depth order, origin excluded, never null
    public List<NodeId> nodes() {
        return new ArrayList<>(depths.keySet());
    }

    public boolean contains(NodeId nodeId) {
        return depths.containsKey(nodeId);
    }

    /// @return depth of a reached node, or -1 if it was not reached
    public int depthOf(NodeId nodeId) {
        return depths.getOrDefault(nodeId, -1);
    }
}
