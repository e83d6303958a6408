package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;
import java.util.List;

/// Longest backward chain ending at an exit node.
///
/// @param exitId the exit node
/// @param exitType type of the exit node
/// @param path node ids from the head of the chain to the exit
/// @param category dominant data type along the chain (`VACE`, `Latent`, `Image`, `Video`, `Mixed`)
public record Pipeline(NodeId exitId, String exitType, List<NodeId> path, String category) {

    public Pipeline {
        path = List.copyOf(path);
    }
}
