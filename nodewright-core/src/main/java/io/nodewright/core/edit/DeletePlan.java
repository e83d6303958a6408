package io.nodewright.core.edit;

import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.NodeId;
import java.util.List;

/// What a delete would remove, computed without touching the document.
///
/// @param requested ids named by the caller
/// @param nodes every node that would be deleted, requested ones first, then cascade victims
/// @param removedLinks links touching any deleted node
/// @param orphanedInputs inputs of surviving nodes that would lose their link
public record DeletePlan(
        List<NodeId> requested,
        List<NodeId> nodes,
        List<Link> removedLinks,
        List<OrphanedInput> orphanedInputs) {

    public DeletePlan {
        requested = List.copyOf(requested);
        nodes = List.copyOf(nodes);
        removedLinks = List.copyOf(removedLinks);
        orphanedInputs = List.copyOf(orphanedInputs);
    }

    /// @return nodes deleted only because of cascading
    public List<NodeId> cascaded() {
        return nodes.stream().filter(id -> !requested.contains(id)).toList();
    }

    /// An input on a surviving node whose feeding link would be removed.
    ///
    /// @param nodeId surviving node
    /// @param nodeType its type
    /// @param slot input slot index
    /// @param name input slot name
    /// @param formerSource node that fed the input
    /// @param formerSourceType type of that node
    public record OrphanedInput(
            NodeId nodeId,
            String nodeType,
            int slot,
            String name,
            NodeId formerSource,
            String formerSourceType) {}
}
