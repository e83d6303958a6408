package io.nodewright.core.graph;

import java.util.Objects;

/// Reference to one slot of one node.
///
/// @param nodeId node owning the slot, never null
/// @param slot zero-based slot index
public record SlotRef(NodeId nodeId, int slot) {

    public SlotRef {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    @Override
    public String toString() {
        return "[" + nodeId + "]:" + slot;
    }
}
