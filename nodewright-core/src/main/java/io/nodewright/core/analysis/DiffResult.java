package io.nodewright.core.analysis;

import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import java.util.List;

/// Differences between two documents.
///
/// @param added nodes present only in the second document, in id order
/// @param removed nodes present only in the first document, in id order
/// @param modified nodes present in both whose type, title or widget values differ
/// @param addedLinks link endpoints present only in the second document
/// @param removedLinks link endpoints present only in the first document
public record DiffResult(
        List<Node> added,
        List<Node> removed,
        List<NodeChange> modified,
        List<Link.Endpoints> addedLinks,
        List<Link.Endpoints> removedLinks) {

    public DiffResult {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
        addedLinks = List.copyOf(addedLinks);
        removedLinks = List.copyOf(removedLinks);
    }

    public boolean isEmpty() {
        return added.isEmpty()
                && removed.isEmpty()
                && modified.isEmpty()
                && addedLinks.isEmpty()
                && removedLinks.isEmpty();
    }

    /// A node present in both documents with differing fields.
    ///
    /// @param before the node in the first document
    /// @param after the node in the second document
    /// @param changes changed fields in type, title, widget order
    public record NodeChange(Node before, Node after, List<FieldChange> changes) {

        public NodeChange {
            changes = List.copyOf(changes);
        }
    }

    /// One changed field. Widget fields are named `widgets[i]` or `widgets.key`.
    public record FieldChange(String field, Object before, Object after) {

        @Override
        public String toString() {
            return field + ": " + before + " -> " + after;
        }
    }
}
