package io.nodewright.core.variable;

import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A store node and the fetch nodes sharing its key.
///
/// @param key declared variable key, never null
/// @param storeId the store node, never null
/// @param fetchIds fetch nodes bound to this key in document order, never null
/// @param source real slot feeding the store, null when the store has no input
/// or its input resolves through a cycle
public record VariableBinding(String key, NodeId storeId, List<NodeId> fetchIds, SlotRef source) {

    public VariableBinding {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(storeId, "storeId must not be null");
        fetchIds = List.copyOf(fetchIds);
    }

    public Optional<SlotRef> resolvedSource() {
        return Optional.ofNullable(source);
    }
}
