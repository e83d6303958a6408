package io.nodewright.core.exception;

import io.nodewright.core.graph.NodeId;
import java.io.Serial;

/// Thrown when a slot reference cannot be resolved or a wiring attempt
/// connects slots with incompatible type tags.
public class SlotException extends WorkflowGraphException {

    @Serial private static final long serialVersionUID = -3380957125004128464L;

    private final NodeId nodeId;
    private final String slotSpec;

    /// Creates exception for a slot failure on a node.
    ///
    /// @param nodeId node owning the slot, not null
    /// @param slotSpec slot index or name as given by the caller, may be null
    /// @param message description including operation and direction, not null
    public SlotException(NodeId nodeId, String slotSpec, String message) {
        super(message);
        this.nodeId = nodeId;
        this.slotSpec = slotSpec;
    }

    /// @return node owning the slot, never null
    public NodeId getNodeId() {
        return nodeId;
    }

    /// @return slot spec as given by the caller, may be null for type mismatches
    public String getSlotSpec() {
        return slotSpec;
    }
}
