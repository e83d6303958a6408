package io.nodewright.core.edit;

import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.variable.VariableBinding;
import java.util.List;

/// What inlining would do, computed without touching the document.
///
/// @param pairs bindings with a resolved source, which are flattened
/// @param nodesToDelete store and fetch nodes of those bindings
/// @param linksToCreate direct links replacing fetch outputs
/// @param warnings bindings left in place and why
public record InlinePlan(
        List<VariableBinding> pairs,
        List<NodeId> nodesToDelete,
        List<PlannedLink> linksToCreate,
        List<String> warnings) {

    public InlinePlan {
        pairs = List.copyOf(pairs);
        nodesToDelete = List.copyOf(nodesToDelete);
        linksToCreate = List.copyOf(linksToCreate);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return nodesToDelete.isEmpty();
    }

    /// A direct link to be created.
    ///
    /// @param source real producer slot
    /// @param target consumer input slot
    /// @param type type tag carried
    public record PlannedLink(SlotRef source, SlotRef target, String type) {

        @Override
        public String toString() {
            return source + " -> " + target + " (" + type + ")";
        }
    }
}
