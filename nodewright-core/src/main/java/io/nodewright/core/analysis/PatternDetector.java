package io.nodewright.core.analysis;

import io.nodewright.core.analysis.PatternRules.FragmentRule;
import io.nodewright.core.analysis.PatternRules.ModeRule;
import io.nodewright.core.analysis.PatternRules.ParameterRule;
import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.EdgeIndex;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Best-effort classifier of a whole workflow.
///
/// Never fails: a document matching no rule gets the fallback label.
public final class PatternDetector {

    private static final int MAX_FLOWS = 5;
    private static final Set<String> OUTPUT_TYPES =
            Set.of("SaveImage", "PreviewImage", "VHS_VideoCombine", "SaveVideo");

    private final PatternRules rules;

    public PatternDetector(PatternRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /// Builds the label for a multiset of type names.
    ///
    /// @param typeNames node type names, not null
    /// @return label, never null or empty
    public String detect(List<String> typeNames) {
        List<String> types = typeNames.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        List<String> parts = new ArrayList<>();
        for (FragmentRule family : rules.families()) {
            if (family.matches(types)) {
                parts.add(family.label());
                break;
            }
        }
        for (ModeRule mode : rules.modes()) {
            if (mode.matches(types)) {
                parts.add(mode.label());
                break;
            }
        }
        for (FragmentRule modifier : rules.modifiers()) {
            if (modifier.matches(types)) {
                parts.add(modifier.label());
            }
        }
        return parts.isEmpty() ? rules.fallbackLabel() : String.join(" ", parts);
    }

    /// Extracts headline parameters. Nodes are visited in creation (id) order
    /// and the first non-empty value for a parameter name wins.
    ///
    /// @param document source document, not null
    /// @return parameter name to value in rule order, never null
    public Map<String, Object> extractParameters(WorkflowDocument document) {
        List<Node> ordered = new ArrayList<>(document.nodes());
        ordered.sort(Comparator.comparing(Node::getId));
        Map<String, Object> found = new LinkedHashMap<>();
        for (ParameterRule rule : rules.parameters()) {
            if (found.containsKey(rule.name())) {
                continue;
            }
            for (Node node : ordered) {
                if (!node.getType().equals(rule.nodeType())) {
                    continue;
                }
                Object value = widgetValue(node.getWidgets(), rule);
                if (value != null && !"".equals(value)) {
                    found.put(rule.name(), truncate(value));
                    break;
                }
            }
        }
        return found;
    }

    private static Object widgetValue(WidgetValues widgets, ParameterRule rule) {
        return switch (widgets.layout()) {
            case POSITIONAL -> widgets.get(rule.widgetIndex());
            case KEYED -> rule.widgetKey() != null ? widgets.get(rule.widgetKey()) : null;
            case ABSENT -> null;
        };
    }

    private Object truncate(Object value) {
        int max = rules.maxValueLength();
        if (value instanceof String text && text.length() > max) {
            return text.substring(0, max - 3) + "...";
        }
        return value;
    }

    /// Traces up to five main flows from entry nodes towards output nodes,
    /// preferring links of the configured priority types.
    ///
    /// @param document source document, not null
    /// @return flows as node id chains of at least two nodes, never null
    public List<List<NodeId>> traceFlows(WorkflowDocument document) {
        EdgeIndex edges = EdgeIndex.of(document);
        Set<NodeId> exits = new HashSet<>();
        for (Node node : document.nodes()) {
            if (OUTPUT_TYPES.contains(node.getType())) {
                exits.add(node.getId());
            }
        }
        if (exits.isEmpty()) {
            for (Node node : document.nodes()) {
                if (edges.outgoing(node.getId()).isEmpty()) {
                    exits.add(node.getId());
                }
            }
        }
        List<NodeId> entries = new ArrayList<>();
        for (Node node : document.nodes()) {
            if (edges.incoming(node.getId()).isEmpty()) {
                entries.add(node.getId());
            }
        }
        entries.sort(Comparator.naturalOrder());

        Set<NodeId> visited = new HashSet<>();
        List<List<NodeId>> flows = new ArrayList<>();
        for (NodeId entry : entries) {
            if (flows.size() == MAX_FLOWS) {
                break;
            }
            if (visited.contains(entry)) {
                continue;
            }
            List<NodeId> path = new ArrayList<>();
            path.add(entry);
            visited.add(entry);
            NodeId current = entry;
            while (!exits.contains(current)) {
                NodeId next = pickNext(edges.outgoing(current), visited);
                if (next == null) {
                    break;
                }
                path.add(next);
                visited.add(next);
                current = next;
            }
            if (path.size() > 1) {
                flows.add(path);
            }
        }
        return flows;
    }

    private NodeId pickNext(List<Edge> outgoing, Set<NodeId> visited) {
        for (String type : rules.flowPriority()) {
            for (Edge edge : outgoing) {
                if (edge.type().equals(type) && !visited.contains(edge.targetId())) {
                    return edge.targetId();
                }
            }
        }
        for (Edge edge : outgoing) {
            if (!visited.contains(edge.targetId())) {
                return edge.targetId();
            }
        }
        return null;
    }

    /// Summarizes a document: label, headline parameters, flows and counts.
    ///
    /// @param document source document, not null
    /// @return summary, never null
    public WorkflowSummary summarize(WorkflowDocument document) {
        List<String> types = document.nodes().stream().map(Node::getType).toList();
        return new WorkflowSummary(
                document.nodes().isEmpty() ? rules.fallbackLabel() : detect(types),
                extractParameters(document),
                traceFlows(document),
                document.nodes().size(),
                document.links().size());
    }
}
