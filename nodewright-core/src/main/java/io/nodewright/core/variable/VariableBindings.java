package io.nodewright.core.variable;

import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Derived lookup table of variable bindings and loop constructs for one document.
///
/// Recomputed by {@link VariableResolver} for every analysis call; never
/// stored on the document.
public final class VariableBindings {

    private final List<VariableBinding> bindings;
    private final Map<NodeId, SlotRef> fetchSources;
    private final Map<NodeId, VariableBinding> byFetch;
    private final List<LoopConstruct> loops;
    private final List<String> warnings;

    VariableBindings(
            List<VariableBinding> bindings,
            Map<NodeId, SlotRef> fetchSources,
            List<LoopConstruct> loops,
            List<String> warnings) {
        this.bindings = List.copyOf(bindings);
        this.fetchSources = Collections.unmodifiableMap(new LinkedHashMap<>(fetchSources));
        this.loops = List.copyOf(loops);
        this.warnings = List.copyOf(warnings);
        Map<NodeId, VariableBinding> index = new LinkedHashMap<>();
        for (VariableBinding binding : bindings) {
            for (NodeId fetchId : binding.fetchIds()) {
                index.put(fetchId, binding);
            }
        }
        this.byFetch = index;
    }

    static VariableBindings empty() {
        return new VariableBindings(List.of(), Map.of(), List.of(), List.of());
    }

    /// Resolves a fetch node's output to the real slot feeding its store node.
    ///
    /// Chains of fetch-into-store are followed to the first non-variable
    /// source.
    ///
    /// @param nodeId node owning the output, not null
    /// @param slot output slot index
    /// @return the real source, or empty when the node is not a resolved fetch node
    public Optional<SlotRef> resolve(NodeId nodeId, int slot) {
        return Optional.ofNullable(fetchSources.get(nodeId));
    }

    /// @return the binding a fetch node belongs to, if any
    public Optional<VariableBinding> bindingOf(NodeId fetchId) {
        return Optional.ofNullable(byFetch.get(fetchId));
    }

    /// @return bindings in store-node document order, never null
    public List<VariableBinding> bindings() {
        return bindings;
    }

    /// @return resolved fetch node id to real source, never null
    public Map<NodeId, SlotRef> fetchSources() {
        return fetchSources;
    }

    /// @return loop constructs in start-node document order, never null
    public List<LoopConstruct> loops() {
        return loops;
    }

    /// @return human-readable notes on ill-formed pairs and cycles, never null
    public List<String> warnings() {
        return warnings;
    }
}
