package io.nodewright.core.analysis;

import io.nodewright.core.analysis.DiffResult.FieldChange;
import io.nodewright.core.analysis.DiffResult.NodeChange;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/// Compares two documents by node id and by link endpoints.
///
/// Link ids are ignored: two links are the same when they join the same slots.
public final class WorkflowDiff {

    /// @param before first document, not null
    /// @param after second document, not null
    /// @return differences, never null
    public DiffResult diff(WorkflowDocument before, WorkflowDocument after) {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        Map<NodeId, Node> left = byId(before);
        Map<NodeId, Node> right = byId(after);

        List<Node> added = new ArrayList<>();
        List<NodeChange> modified = new ArrayList<>();
        for (Map.Entry<NodeId, Node> entry : right.entrySet()) {
            Node previous = left.get(entry.getKey());
            if (previous == null) {
                added.add(entry.getValue());
                continue;
            }
            List<FieldChange> changes = compare(previous, entry.getValue());
            if (!changes.isEmpty()) {
                modified.add(new NodeChange(previous, entry.getValue(), changes));
            }
        }
        List<Node> removed = new ArrayList<>();
        for (Map.Entry<NodeId, Node> entry : left.entrySet()) {
            if (!right.containsKey(entry.getKey())) {
                removed.add(entry.getValue());
            }
        }

        Set<Link.Endpoints> leftLinks = endpoints(before);
        Set<Link.Endpoints> rightLinks = endpoints(after);
        List<Link.Endpoints> addedLinks = new ArrayList<>(rightLinks);
        addedLinks.removeAll(leftLinks);
        List<Link.Endpoints> removedLinks = new ArrayList<>(leftLinks);
        removedLinks.removeAll(rightLinks);
        return new DiffResult(added, removed, modified, addedLinks, removedLinks);
    }

    private static Map<NodeId, Node> byId(WorkflowDocument document) {
        Map<NodeId, Node> result = new TreeMap<>();
        for (Node node : document.nodes()) {
            result.putIfAbsent(node.getId(), node);
        }
        return result;
    }

    private static Set<Link.Endpoints> endpoints(WorkflowDocument document) {
        Set<Link.Endpoints> result = new LinkedHashSet<>();
        for (Link link : document.links()) {
            result.add(link.endpoints());
        }
        return result;
    }

    private static List<FieldChange> compare(Node before, Node after) {
        List<FieldChange> changes = new ArrayList<>();
        if (!before.getType().equals(after.getType())) {
            changes.add(new FieldChange("type", before.getType(), after.getType()));
        }
        if (!Objects.equals(before.getTitle(), after.getTitle())) {
            changes.add(new FieldChange("title", before.getTitle(), after.getTitle()));
        }
        WidgetValues a = before.getWidgets();
        WidgetValues b = after.getWidgets();
        if (a.equals(b)) {
            return changes;
        }
        if (a.layout() != b.layout()
                && a.layout() != WidgetValues.Layout.ABSENT
                && b.layout() != WidgetValues.Layout.ABSENT) {
            changes.add(new FieldChange("widgets", a, b));
            return changes;
        }
        if (a.layout() == WidgetValues.Layout.KEYED || b.layout() == WidgetValues.Layout.KEYED) {
            Set<String> keys = new LinkedHashSet<>(a.asMap().keySet());
            keys.addAll(b.asMap().keySet());
            for (String key : keys) {
                if (!Objects.equals(a.get(key), b.get(key))) {
                    changes.add(new FieldChange("widgets." + key, a.get(key), b.get(key)));
                }
            }
        } else {
            int size = Math.max(a.asList().size(), b.asList().size());
            for (int i = 0; i < size; i++) {
                if (!Objects.equals(a.get(i), b.get(i))) {
                    changes.add(new FieldChange("widgets[" + i + "]", a.get(i), b.get(i)));
                }
            }
        }
        return changes;
    }
}
