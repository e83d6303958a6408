package io.nodewright.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Output slot of a node. Feeds zero or more links.
///
/// @param name slot name as declared by the node type, never null
/// @param type declared type tag, never null
/// @param links ids of outgoing links in creation order, never null
/// @param attributes remaining serialized fields (`slot_index`, `label`, `shape`), preserved verbatim
public record OutputSlot(
        String name, String type, List<Integer> links, Map<String, Object> attributes) {

    public OutputSlot {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        links = links != null ? List.copyOf(links) : List.of();
        attributes = Attributes.copyOf(attributes);
    }

    public OutputSlot(String name, String type, List<Integer> links) {
        this(name, type, links, Map.of());
    }

    /// Creates an output slot with no outgoing links.
    public static OutputSlot unconnected(String name, String type) {
        return new OutputSlot(name, type, List.of());
    }

    public boolean isConnected() {
        return !links.isEmpty();
    }

    /// @return copy of this slot with `linkId` appended, never null
    public OutputSlot plusLink(int linkId) {
        List<Integer> updated = new ArrayList<>(links);
        if (!updated.contains(linkId)) {
            updated.add(linkId);
        }
        return new OutputSlot(name, type, updated, attributes);
    }

    /// @return copy of this slot with `linkId` removed, never null
    public OutputSlot minusLink(int linkId) {
        List<Integer> updated = new ArrayList<>(links);
        updated.remove(Integer.valueOf(linkId));
        return new OutputSlot(name, type, updated, attributes);
    }
}
