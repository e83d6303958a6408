package io.nodewright.core.graph;

import java.util.Map;
import java.util.Objects;

/// Input slot of a node. Holds at most one incoming link.
///
/// @param name slot name as declared by the node type, never null
/// @param type declared type tag (e.g. `IMAGE`, `LATENT`, `*`), never null
/// @param link id of the incoming link, or null when unconnected
/// @param attributes remaining serialized fields (`widget`, `label`, `shape`), preserved verbatim
public record InputSlot(String name, String type, Integer link, Map<String, Object> attributes) {

    public InputSlot {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        attributes = Attributes.copyOf(attributes);
    }

    public InputSlot(String name, String type, Integer link) {
        this(name, type, link, Map.of());
    }

    /// Creates an unconnected input slot.
    public static InputSlot unconnected(String name, String type) {
        return new InputSlot(name, type, null);
    }

    public boolean isConnected() {
        return link != null;
    }

    /// Returns a copy of this slot attached to another link.
    ///
    /// @param linkId new incoming link id, or null to disconnect
    /// @return updated slot, never null
    public InputSlot withLink(Integer linkId) {
        return new InputSlot(name, type, linkId, attributes);
    }
}
