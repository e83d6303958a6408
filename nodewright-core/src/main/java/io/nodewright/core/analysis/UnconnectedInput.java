package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;

/// An input slot with no incoming link, or referencing a link that does not exist.
///
/// @param nodeId owning node
/// @param nodeType owning node type
/// @param slot input slot index
/// @param name input slot name
/// @param type input type tag
/// @param likelyRequired heuristic: first slot, or not marked optional on a simple node
/// @param primary true for slot 0
/// @param brokenLink id of the missing link, null for a plain unconnected slot
public record UnconnectedInput(
        NodeId nodeId,
        String nodeType,
        int slot,
        String name,
        String type,
        boolean likelyRequired,
        boolean primary,
        Integer brokenLink) {}
