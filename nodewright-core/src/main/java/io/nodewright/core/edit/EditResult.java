package io.nodewright.core.edit;

import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of one editing operation.
///
/// @param document the new document state; the caller's input is never modified
/// @param operation operation name, e.g. `wire`
/// @param createdNodes nodes added by the operation
/// @param deletedNodes nodes removed by the operation
/// @param createdLinks links added by the operation
/// @param removedLinks links removed by the operation
/// @param changes human-readable lines describing widget or title changes
/// @param warnings non-fatal problems, e.g. keys that did not fit the widget layout
public record EditResult(
        WorkflowDocument document,
        String operation,
        List<NodeId> createdNodes,
        List<NodeId> deletedNodes,
        List<Link> createdLinks,
        List<Link> removedLinks,
        List<String> changes,
        List<String> warnings) {

    public EditResult {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        createdNodes = List.copyOf(createdNodes);
        deletedNodes = List.copyOf(deletedNodes);
        createdLinks = List.copyOf(createdLinks);
        removedLinks = List.copyOf(removedLinks);
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
    }

    /// @return the first node created by the operation, if any
    public Optional<NodeId> createdNode() {
        return createdNodes.isEmpty() ? Optional.empty() : Optional.of(createdNodes.get(0));
    }

    /// @return true if the operation changed nothing
    public boolean isNoOp() {
        return createdNodes.isEmpty()
                && deletedNodes.isEmpty()
                && createdLinks.isEmpty()
                && removedLinks.isEmpty()
                && changes.isEmpty();
    }

    /// Lists the effects one per line, for change logs and command output.
    ///
    /// @return description lines, never null
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        createdNodes.forEach(id -> lines.add("created node " + id));
        deletedNodes.forEach(id -> lines.add("deleted node " + id));
        removedLinks.forEach(
                link -> lines.add("removed link " + link.id() + " " + link.endpoints()));
        createdLinks.forEach(
                link ->
                        lines.add(
                                "created link "
                                        + link.id()
                                        + " "
                                        + link.endpoints()
                                        + " ("
                                        + link.type()
                                        + ")"));
        lines.addAll(changes);
        return lines;
    }
}
