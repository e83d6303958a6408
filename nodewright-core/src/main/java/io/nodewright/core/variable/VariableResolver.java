package io.nodewright.core.variable;

import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.graph.EdgeIndex;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Detects variable store/fetch pairs and loop constructs in a document.
///
/// Store and fetch nodes are matched on a key taken from their first widget
/// value, falling back to the title with the configured `Set_`/`Get_` prefix
/// removed. The first store in document order owns a key; later stores with the
/// same key are reported and ignored.
///
/// Ill-formed pairs never fail resolution. They are collected as warnings and
/// the affected fetch nodes stay unresolved, so analysis treats them as opaque
/// gaps.
///
/// @implNote Stateless and thread-safe. Every call recomputes the bindings from
/// the document passed in.
public final class VariableResolver {

    private static final Logger logger = Logger.getLogger(VariableResolver.class.getName());

    private final GraphEngineConfig config;

    public VariableResolver(GraphEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Computes the bindings and loop constructs of a document.
    ///
    /// @param document document to inspect, not null
    /// @return derived lookup table, never null
    public VariableBindings resolve(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        List<String> warnings = new ArrayList<>();

        Map<String, Node> stores = new LinkedHashMap<>();
        Map<String, List<NodeId>> fetches = new LinkedHashMap<>();
        for (Node node : document.nodes()) {
            if (!config.isStore(node.getType())) {
                continue;
            }
            String key = storeKey(node);
            if (key == null) {
                warnings.add("Store node " + node.displayName() + " has no key");
            } else if (stores.containsKey(key)) {
                warnings.add(
                        "Duplicate store key '"
                                + key
                                + "': "
                                + node.displayName()
                                + " ignored, "
                                + stores.get(key).displayName()
                                + " wins");
            } else {
                stores.put(key, node);
                fetches.put(key, new ArrayList<>());
            }
        }
        for (Node node : document.nodes()) {
            if (!config.isFetch(node.getType())) {
                continue;
            }
            String key = fetchKey(node);
            if (key == null) {
                warnings.add("Fetch node " + node.displayName() + " has no key");
            } else if (!stores.containsKey(key)) {
                warnings.add("Fetch node " + node.displayName() + " has no store for key '" + key + "'");
            } else {
                fetches.get(key).add(node.getId());
            }
        }

        Map<String, SlotRef> directSources = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : stores.entrySet()) {
            directSource(document, entry.getValue())
                    .ifPresentOrElse(
                            source -> directSources.put(entry.getKey(), source),
                            () ->
                                    warnings.add(
                                            "Store '"
                                                    + entry.getKey()
                                                    + "' "
                                                    + entry.getValue().displayName()
                                                    + " has no input"));
        }

        Map<NodeId, String> fetchKeys = new LinkedHashMap<>();
        fetches.forEach((key, ids) -> ids.forEach(id -> fetchKeys.put(id, key)));

        List<VariableBinding> bindings = new ArrayList<>();
        Map<NodeId, SlotRef> fetchSources = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : stores.entrySet()) {
            String key = entry.getKey();
            SlotRef source = follow(key, directSources, fetchKeys, new HashSet<>(), warnings);
            List<NodeId> fetchIds = fetches.get(key);
            bindings.add(new VariableBinding(key, entry.getValue().getId(), fetchIds, source));
            if (source != null) {
                fetchIds.forEach(id -> fetchSources.put(id, source));
            }
        }

        List<LoopConstruct> loops = detectLoops(document, EdgeIndex.of(document, fetchSources));
        for (String warning : warnings) {
            logger.warning(warning);
        }
        logger.fine(
                "Resolved "
                        + bindings.size()
                        + " variable(s) and "
                        + loops.size()
                        + " loop(s)");
        return new VariableBindings(bindings, fetchSources, loops, warnings);
    }

    private SlotRef follow(
            String key,
            Map<String, SlotRef> directSources,
            Map<NodeId, String> fetchKeys,
            Set<String> visiting,
            List<String> warnings) {
        if (!visiting.add(key)) {
            warnings.add("Variable cycle through key '" + key + "'");
            return null;
        }
        SlotRef source = directSources.get(key);
        if (source == null) {
            return null;
        }
        String upstreamKey = fetchKeys.get(source.nodeId());
        if (upstreamKey == null) {
            return source;
        }
        return follow(upstreamKey, directSources, fetchKeys, visiting, warnings);
    }

    private static Optional<SlotRef> directSource(WorkflowDocument document, Node store) {
        for (int i = 0; i < store.getInputs().size(); i++) {
            Optional<Link> link = document.incomingLink(store.getId(), i);
            if (link.isPresent()) {
                return Optional.of(new SlotRef(link.get().sourceId(), link.get().sourceSlot()));
            }
        }
        return Optional.empty();
    }

    /// Returns the variable key of a store node, or null when it has none.
    public String storeKey(Node node) {
        return key(node, config.getStoreTitlePrefix());
    }

    /// Returns the variable key of a fetch node, or null when it has none.
    public String fetchKey(Node node) {
        return key(node, config.getFetchTitlePrefix());
    }

    private static String key(Node node, String titlePrefix) {
        WidgetValues widgets = node.getWidgets();
        Object value =
                switch (widgets.layout()) {
                    case POSITIONAL -> widgets.get(0);
                    case KEYED ->
                            widgets.asMap().isEmpty()
                                    ? null
                                    : widgets.asMap().values().iterator().next();
                    case ABSENT -> null;
                };
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        String title = node.getTitle();
        if (title != null && title.startsWith(titlePrefix) && title.length() > titlePrefix.length()) {
            return title.substring(titlePrefix.length());
        }
        return null;
    }

    private List<LoopConstruct> detectLoops(WorkflowDocument document, EdgeIndex edges) {
        List<LoopConstruct> loops = new ArrayList<>();
        for (Node start : document.nodes()) {
            if (!config.isLoopStart(start.getType())) {
                continue;
            }
            Integer iterations = null;
            String iterationSource = null;
            NodeId iterationNode = null;
            for (int i = 0; i < start.getInputs().size(); i++) {
                InputSlot input = start.getInputs().get(i);
                if (!config.isIterationInput(input.name())) {
                    continue;
                }
                Optional<Link> link = document.incomingLink(start.getId(), i);
                if (link.isPresent()) {
                    Node feeder = document.findNode(link.get().sourceId()).orElse(null);
                    if (feeder != null && isConstant(feeder)) {
                        if (feeder.getWidgets().get(0) instanceof Number number) {
                            iterations = number.intValue();
                            iterationSource = "constant";
                        }
                    } else if (feeder != null) {
                        iterationSource = feeder.getType();
                        iterationNode = feeder.getId();
                    }
                } else {
                    Object own = ownIterationWidget(start, input.name());
                    if (own instanceof Number number) {
                        iterations = number.intValue();
                        iterationSource = "widget";
                    }
                }
                break;
            }

            Node end = findEnd(document, start.getId());
            Set<NodeId> body = new LinkedHashSet<>();
            if (end != null) {
                Set<NodeId> fromStart = edges.reachable(List.of(start.getId()), true);
                Set<NodeId> toEnd = edges.reachable(List.of(end.getId()), false);
                for (NodeId id : fromStart) {
                    if (toEnd.contains(id)) {
                        body.add(id);
                    }
                }
                body.remove(start.getId());
                body.remove(end.getId());
            }
            loops.add(
                    new LoopConstruct(
                            start.getId(),
                            start.getType(),
                            end != null ? end.getId() : null,
                            iterations,
                            iterationSource,
                            iterationNode,
                            body));
        }
        return loops;
    }

    private Node findEnd(WorkflowDocument document, NodeId startId) {
        for (Node candidate : document.nodes()) {
            if (!config.isLoopEnd(candidate.getType())) {
                continue;
            }
            for (Link link : document.linksInto(candidate.getId())) {
                if (link.sourceId().equals(startId)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static boolean isConstant(Node node) {
        String type = node.getType().toLowerCase(Locale.ROOT);
        return type.contains("constant") || type.contains("primitive");
    }

    private static Object ownIterationWidget(Node start, String inputName) {
        WidgetValues widgets = start.getWidgets();
        if (widgets.layout() == WidgetValues.Layout.KEYED) {
            return widgets.get(inputName);
        }
        for (Object value : widgets.asList()) {
            if (value instanceof Number) {
                return value;
            }
        }
        return null;
    }
}
