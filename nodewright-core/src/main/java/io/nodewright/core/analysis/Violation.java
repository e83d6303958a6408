package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;

/// One integrity problem found by {@link IntegrityVerifier}.
///
/// @param kind category of the problem
/// @param message human-readable description naming the offending ids
/// @param nodeId node involved, may be null
/// @param linkId link involved, may be null
public record Violation(Kind kind, String message, NodeId nodeId, Integer linkId) {

    /// Categories of integrity problems.
    public enum Kind {
        /// Link endpoint node or slot does not exist.
        DANGLING_LINK,
        /// Link type tag incompatible with an endpoint slot.
        TYPE_MISMATCH,
        /// Two links feed the same input slot.
        MULTIPLE_WRITERS,
        /// Two nodes share an id.
        DUPLICATE_NODE_ID,
        /// Two links share an id.
        DUPLICATE_LINK_ID,
        /// Slot link references disagree with the link table.
        SLOT_LINK_MISMATCH,
        /// Group references a node that does not exist.
        ORPHANED_GROUP_REFERENCE
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
