package io.nodewright.core.exception;

import io.nodewright.core.graph.NodeId;
import java.io.Serial;

/// Thrown when an operation references a node id absent from the document.
public class NodeNotFoundException extends WorkflowGraphException {

    @Serial private static final long serialVersionUID = 7925119630071342587L;

    private final NodeId nodeId;

    /// Creates exception for a missing node.
    ///
    /// @param operation name of the failing operation, not null
    /// @param nodeId the id that could not be resolved, not null
    public NodeNotFoundException(String operation, NodeId nodeId) {
        super(operation + ": node " + nodeId + " not found");
        this.nodeId = nodeId;
    }

    /// @return the id that could not be resolved, never null
    public NodeId getNodeId() {
        return nodeId;
    }
}
