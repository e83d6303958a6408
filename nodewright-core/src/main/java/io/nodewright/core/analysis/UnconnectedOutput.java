package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;

/// An output slot feeding nothing.
public record UnconnectedOutput(NodeId nodeId, String nodeType, int slot, String name, String type) {}
