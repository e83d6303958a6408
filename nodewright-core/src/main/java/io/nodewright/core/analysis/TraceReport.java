package io.nodewright.core.analysis;

import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.SlotRef;
import java.util.List;

/// Connections of a single node.
///
/// @param node the traced node
/// @param inputs one entry per input slot, in slot order
/// @param outputs one entry per output slot, in slot order
public record TraceReport(Node node, List<InputTrace> inputs, List<OutputTrace> outputs) {

    public TraceReport {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /// Upstream side of one input slot.
    ///
    /// @param slot input slot index
    /// @param name slot name
    /// @param type slot type tag
    /// @param source resolved producer, null when unconnected or the link is broken
    /// @param sourceType type name of the resolved producer, null when unconnected
    /// @param via fetch node the value was resolved through, null for direct links
    /// @param variableKey key of the variable resolved through, null for direct links
    /// @param brokenLink id of a link the slot references but the document lacks
    public record InputTrace(
            int slot,
            String name,
            String type,
            SlotRef source,
            String sourceType,
            SlotRef via,
            String variableKey,
            Integer brokenLink) {

        public boolean isConnected() {
            return source != null;
        }
    }

    /// Downstream side of one output slot.
    ///
    /// @param slot output slot index
    /// @param name slot name
    /// @param type slot type tag
    /// @param targets consuming input slots in link order
    public record OutputTrace(int slot, String name, String type, List<SlotRef> targets) {

        public OutputTrace {
            targets = List.copyOf(targets);
        }
    }
}
