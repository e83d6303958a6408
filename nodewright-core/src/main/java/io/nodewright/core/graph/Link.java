package io.nodewright.core.graph;

import java.util.Objects;

/// Typed directed edge from one node's output slot to another node's input slot.
///
/// The serialized form is the 6-tuple `[id, sourceId, sourceSlot, targetId, targetSlot, type]`.
///
/// @param id link identifier, unique within the document
/// @param sourceId node owning the output slot, never null
/// @param sourceSlot output slot index on the source node
/// @param targetId node owning the input slot, never null
/// @param targetSlot input slot index on the target node
/// @param type carried type tag, never null
public record Link(
        int id, NodeId sourceId, int sourceSlot, NodeId targetId, int targetSlot, String type) {

    public Link {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /// @return the endpoint tuple ignoring link id and type, never null
    public Endpoints endpoints() {
        return new Endpoints(sourceId, sourceSlot, targetId, targetSlot);
    }

    public boolean touches(NodeId nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    /// Link identity for comparisons across documents, where link ids differ.
    ///
    /// @param sourceId source node
    /// @param sourceSlot source output slot index
    /// @param targetId target node
    /// @param targetSlot target input slot index
    public record Endpoints(NodeId sourceId, int sourceSlot, NodeId targetId, int targetSlot) {

        @Override
        public String toString() {
            return "[" + sourceId + "]:" + sourceSlot + " -> [" + targetId + "]:" + targetSlot;
        }
    }
}
