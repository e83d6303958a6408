package io.nodewright.core.graph;

import java.util.Objects;

/// A traversable edge of the effective data flow.
///
/// Real edges mirror a {@link Link}. Virtual edges run from the value feeding a
/// variable store node to each fetch node bound to the same key; they carry no
/// link id and their target slot is `-1`.
///
/// @param sourceId producing node, never null
/// @param sourceSlot output slot index on the producer
/// @param targetId consuming node, never null
/// @param targetSlot input slot index on the consumer, `-1` for virtual edges
/// @param type carried type tag, never null
/// @param linkId backing link id, null for virtual edges
public record Edge(
        NodeId sourceId, int sourceSlot, NodeId targetId, int targetSlot, String type, Integer linkId) {

    public Edge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Edge of(Link link) {
        return new Edge(
                link.sourceId(),
                link.sourceSlot(),
                link.targetId(),
                link.targetSlot(),
                link.type(),
                link.id());
    }

    public boolean isVirtual() {
        return linkId == null;
    }
}
