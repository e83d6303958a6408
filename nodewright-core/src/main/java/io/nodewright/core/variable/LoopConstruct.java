package io.nodewright.core.variable;

import io.nodewright.core.graph.NodeId;
import java.util.Optional;
import java.util.Set;

/// A loop start node, its matching end node and the nodes between them.
///
/// @param startId loop start node, never null
/// @param startType type name of the start node, never null
/// @param endId matching end node, null when no end node is wired to the start
/// @param iterations iteration count, null when it is computed at run time
/// @param iterationSource `constant`, `widget`, or the type of the node feeding the count
/// @param iterationNodeId node feeding the count when not a constant, may be null
/// @param body nodes on any path from start to end, both excluded; empty without an end
public record LoopConstruct(
        NodeId startId,
        String startType,
        NodeId endId,
        Integer iterations,
        String iterationSource,
        NodeId iterationNodeId,
        Set<NodeId> body) {

    public LoopConstruct {
        body = Set.copyOf(body);
    }

    public Optional<NodeId> end() {
        return Optional.ofNullable(endId);
    }

    public boolean isClosed() {
        return endId != null;
    }
}
