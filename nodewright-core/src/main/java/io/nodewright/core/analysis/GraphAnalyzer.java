package io.nodewright.core.analysis;

import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.analysis.TraceReport.InputTrace;
import io.nodewright.core.analysis.TraceReport.OutputTrace;
import io.nodewright.core.exception.NodeNotFoundException;
import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.EdgeIndex;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.variable.VariableBinding;
import io.nodewright.core.variable.VariableBindings;
import io.nodewright.core.variable.VariableResolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
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

/// Read-only queries over a workflow document.
///
/// Traversals see through variable store/fetch pairs: each call resolves the
/// document's bindings and adds a virtual edge from the value feeding a store
/// node to every fetch node bound to it. Graphs may contain cycles (loop
/// constructs feed back); every traversal tracks visited nodes.
///
/// No operation mutates the document passed in.
///
/// @implNote Stateless and thread-safe; all state is derived per call.
/// @see VariableResolver
/// @see IntegrityVerifier
/// @see PatternDetector
public final class GraphAnalyzer {

    private static final Logger logger = Logger.getLogger(GraphAnalyzer.class.getName());

    /// Depth bound meaning "unbounded".
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final GraphEngineConfig config;
    private final VariableResolver variableResolver;
    private final PatternDetector patternDetector;
    private final IntegrityVerifier integrityVerifier;
    private final WorkflowDiff workflowDiff;

    public GraphAnalyzer(GraphEngineConfig config, PatternRules rules) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.variableResolver = new VariableResolver(config);
        this.patternDetector = new PatternDetector(Objects.requireNonNull(rules, "rules must not be null"));
        this.integrityVerifier = new IntegrityVerifier();
        this.workflowDiff = new WorkflowDiff();
    }

    public GraphAnalyzer() {
        this(GraphEngineConfig.defaults(), PatternRules.defaults());
    }

    // --- Statistics and lookups ---

    /// @return counts and per-type frequencies, most frequent type first
    public WorkflowInfo info(WorkflowDocument document) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Node node : document.nodes()) {
            counts.merge(node.getType(), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> sorted = new LinkedHashMap<>();
        entries.forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return new WorkflowInfo(
                document.nodes().size(),
                document.links().size(),
                document.groups().size(),
                document.lastNodeId(),
                document.lastLinkId(),
                sorted);
    }

    /// @return nodes whose type contains `typePattern`, ignoring case, in document order
    public List<Node> query(WorkflowDocument document, String typePattern) {
        return document.findNodesByType(typePattern);
    }

    /// @throws NodeNotFoundException if the node does not exist
    public WidgetValues values(WorkflowDocument document, NodeId nodeId)
            throws NodeNotFoundException {
        return document.node(nodeId).getWidgets();
    }

    /// Resolves store/fetch bindings and loop constructs.
    public VariableBindings variables(WorkflowDocument document) {
        return variableResolver.resolve(document);
    }

    // --- Traversal ---

    /// Reports both sides of every slot of a node.
    ///
    /// Inputs fed by a resolved fetch node report the real producer, with the
    /// fetch node kept in {@link InputTrace#via()}.
    ///
    /// @param document source document, not null
    /// @param nodeId node to trace, not null
    /// @return trace report, never null
    /// @throws NodeNotFoundException if the node does not exist
    public TraceReport trace(WorkflowDocument document, NodeId nodeId) throws NodeNotFoundException {
        Node node = document.node(nodeId);
        VariableBindings variables = variableResolver.resolve(document);

        List<InputTrace> inputs = new ArrayList<>();
        for (int i = 0; i < node.getInputs().size(); i++) {
            InputSlot input = node.getInputs().get(i);
            Optional<Link> link = document.incomingLink(nodeId, i);
            if (link.isEmpty()) {
                Integer broken = input.isConnected() ? input.link() : null;
                inputs.add(new InputTrace(i, input.name(), input.type(), null, null, null, null, broken));
                continue;
            }
            SlotRef direct = new SlotRef(link.get().sourceId(), link.get().sourceSlot());
            Optional<SlotRef> resolved = variables.resolve(direct.nodeId(), direct.slot());
            SlotRef source = resolved.orElse(direct);
            SlotRef via = resolved.isPresent() ? direct : null;
            String key = variables.bindingOf(direct.nodeId()).map(VariableBinding::key).orElse(null);
            String sourceType = document.findNode(source.nodeId()).map(Node::getType).orElse("?");
            inputs.add(
                    new InputTrace(
                            i,
                            input.name(),
                            input.type(),
                            source,
                            sourceType,
                            via,
                            resolved.isPresent() ? key : null,
                            null));
        }

        List<OutputTrace> outputs = new ArrayList<>();
        List<Link> outgoing = document.linksFrom(nodeId);
        for (int i = 0; i < node.getOutputs().size(); i++) {
            OutputSlot output = node.getOutputs().get(i);
            List<SlotRef> targets = new ArrayList<>();
            for (Link link : outgoing) {
                if (link.sourceSlot() == i) {
                    targets.add(new SlotRef(link.targetId(), link.targetSlot()));
                }
            }
            outputs.add(new OutputTrace(i, output.name(), output.type(), targets));
        }
        return new TraceReport(node, inputs, outputs);
    }

    /// @see #upstream(WorkflowDocument, NodeId, int, String)
    public Closure upstream(WorkflowDocument document, NodeId nodeId) throws NodeNotFoundException {
        return upstream(document, nodeId, UNBOUNDED, null);
    }

    /// Breadth-first closure over everything feeding a node.
    ///
    /// @param document source document, not null
    /// @param nodeId target node, not null
    /// @param maxDepth maximum edge distance, {@link #UNBOUNDED} for no limit
    /// @param inputFilter restricts the first hop to one input slot, matched
    ///        by exact name, then by name fragment, then by index; null for all inputs
    /// @return closure in depth order, never null
    /// @throws NodeNotFoundException if the node does not exist
    public Closure upstream(WorkflowDocument document, NodeId nodeId, int maxDepth, String inputFilter)
            throws NodeNotFoundException {
        Node target = document.node(nodeId);
        EdgeIndex edges = edgeIndex(document);
        List<Edge> seeds = edges.incoming(nodeId);
        if (inputFilter != null) {
            List<String> names = target.getInputs().stream().map(InputSlot::name).toList();
            int slot = matchSlot(names, inputFilter);
            seeds = seeds.stream().filter(edge -> edge.targetSlot() == slot && slot >= 0).toList();
        }
        return breadthFirst(nodeId, seeds, edges, maxDepth, false);
    }

    /// @see #downstream(WorkflowDocument, NodeId, int, String)
    public Closure downstream(WorkflowDocument document, NodeId nodeId)
            throws NodeNotFoundException {
        return downstream(document, nodeId, UNBOUNDED, null);
    }

    /// Breadth-first closure over everything a node feeds.
    ///
    /// @param document source document, not null
    /// @param nodeId source node, not null
    /// @param maxDepth maximum edge distance, {@link #UNBOUNDED} for no limit
    /// @param outputFilter restricts the first hop to one output slot, null for all outputs
    /// @return closure in depth order, never null
    /// @throws NodeNotFoundException if the node does not exist
    public Closure downstream(
            WorkflowDocument document, NodeId nodeId, int maxDepth, String outputFilter)
            throws NodeNotFoundException {
        Node source = document.node(nodeId);
        EdgeIndex edges = edgeIndex(document);
        List<Edge> seeds = edges.outgoing(nodeId);
        if (outputFilter != null) {
            List<String> names = source.getOutputs().stream().map(OutputSlot::name).toList();
            int slot = matchSlot(names, outputFilter);
            seeds = seeds.stream().filter(edge -> edge.sourceSlot() == slot && slot >= 0).toList();
        }
        return breadthFirst(nodeId, seeds, edges, maxDepth, true);
    }

    private static Closure breadthFirst(
            NodeId origin, List<Edge> seeds, EdgeIndex edges, int maxDepth, boolean forward) {
        Map<NodeId, Integer> depths = new LinkedHashMap<>();
        Set<Edge> traversed = new LinkedHashSet<>();
        if (maxDepth < 1) {
            return new Closure(origin, depths, List.of());
        }
        Deque<NodeId> queue = new ArrayDeque<>();
        for (Edge edge : seeds) {
            traversed.add(edge);
            NodeId next = forward ? edge.targetId() : edge.sourceId();
            if (!next.equals(origin) && !depths.containsKey(next)) {
                depths.put(next, 1);
                queue.add(next);
            }
        }
        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            int depth = depths.get(current);
            if (depth >= maxDepth) {
                continue;
            }
            for (Edge edge : forward ? edges.outgoing(current) : edges.incoming(current)) {
                traversed.add(edge);
                NodeId next = forward ? edge.targetId() : edge.sourceId();
                if (!next.equals(origin) && !depths.containsKey(next)) {
                    depths.put(next, depth + 1);
                    queue.add(next);
                }
            }
        }
        logger.fine("Closure from " + origin + " reached " + depths.size() + " node(s)");
        return new Closure(origin, depths, new ArrayList<>(traversed));
    }

    private static int matchSlot(List<String> names, String filter) {
        String wanted = filter.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).toLowerCase(Locale.ROOT).contains(wanted)) {
                return i;
            }
        }
        try {
            int index = Integer.parseInt(wanted);
            return index < names.size() ? index : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /// Finds the shortest path by edge count.
    ///
    /// Ties are broken by breadth-first discovery order from `from`.
    ///
    /// @param document source document, not null
    /// @param from start node, not null
    /// @param to end node, not null
    /// @return node ids from `from` to `to` inclusive, or empty when unreachable
    /// @throws NodeNotFoundException if either node does not exist
    public Optional<List<NodeId>> path(WorkflowDocument document, NodeId from, NodeId to)
            throws NodeNotFoundException {
        document.node(from);
        document.node(to);
        if (from.equals(to)) {
            return Optional.of(List.of(from));
        }
        EdgeIndex edges = edgeIndex(document);
        Map<NodeId, NodeId> parents = new HashMap<>();
        Set<NodeId> visited = new HashSet<>();
        visited.add(from);
        Deque<NodeId> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            for (Edge edge : edges.outgoing(current)) {
                NodeId next = edge.targetId();
                if (!visited.add(next)) {
                    continue;
                }
                parents.put(next, current);
                if (next.equals(to)) {
                    List<NodeId> path = new ArrayList<>();
                    for (NodeId step = to; step != null; step = parents.get(step)) {
                        path.add(step);
                    }
                    Collections.reverse(path);
                    return Optional.of(path);
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    /// Extracts every node lying on any path from `from` to `to`.
    ///
    /// Computed as the intersection of the downstream closure of `from` and
    /// the upstream closure of `to`, both endpoints included.
    ///
    /// @param document source document, not null
    /// @param from start node, not null
    /// @param to end node, not null
    /// @return subgraph, empty when `to` is unreachable from `from`
    /// @throws NodeNotFoundException if either node does not exist
    public Subgraph subgraph(WorkflowDocument document, NodeId from, NodeId to)
            throws NodeNotFoundException {
        document.node(from);
        document.node(to);
        EdgeIndex edges = edgeIndex(document);
        Set<NodeId> reachable = edges.reachable(List.of(from), true);
        Set<NodeId> reaching = edges.reachable(List.of(to), false);

        List<NodeId> between = new ArrayList<>();
        Set<NodeId> seen = new HashSet<>();
        for (Node node : document.nodes()) {
            NodeId id = node.getId();
            if (reachable.contains(id) && reaching.contains(id) && seen.add(id)) {
                between.add(id);
            }
        }
        if (between.isEmpty()) {
            return new Subgraph(from, to, List.of(), List.of());
        }

        Set<Edge> internal = new LinkedHashSet<>();
        for (NodeId id : between) {
            for (Edge edge : edges.outgoing(id)) {
                if (seen.contains(edge.targetId())) {
                    internal.add(edge);
                }
            }
        }
        return new Subgraph(from, to, topologicalOrder(between, internal), new ArrayList<>(internal));
    }

    private static List<NodeId> topologicalOrder(List<NodeId> nodes, Collection<Edge> edges) {
        Map<NodeId, Integer> inDegree = new HashMap<>();
        Map<NodeId, List<NodeId>> successors = new HashMap<>();
        for (NodeId id : nodes) {
            inDegree.put(id, 0);
        }
        for (Edge edge : edges) {
            inDegree.merge(edge.targetId(), 1, Integer::sum);
            successors.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.targetId());
        }
        Deque<NodeId> queue = new ArrayDeque<>();
        for (NodeId id : nodes) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
            }
        }
        List<NodeId> ordered = new ArrayList<>();
        Set<NodeId> placed = new HashSet<>();
        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            ordered.add(current);
            placed.add(current);
            for (NodeId next : successors.getOrDefault(current, List.of())) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(next);
                }
            }
        }
        for (NodeId id : nodes) {
            if (!placed.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    /// Classifies nodes by role, looking only at edges between the given nodes.
    ///
    /// @param document source document, not null
    /// @param nodeIds nodes to classify, not null
    /// @return role per node in the given order, unknown ids skipped
    public Map<NodeId, NodeRole> roles(WorkflowDocument document, Collection<NodeId> nodeIds) {
        EdgeIndex edges = edgeIndex(document);
        Set<NodeId> within = new HashSet<>(nodeIds);
        Map<NodeId, NodeRole> roles = new LinkedHashMap<>();
        for (NodeId id : nodeIds) {
            Optional<Node> node = document.findNode(id);
            if (node.isEmpty()) {
                continue;
            }
            List<String> inTypes = new ArrayList<>();
            for (Edge edge : edges.incoming(id)) {
                if (within.contains(edge.sourceId())) {
                    inTypes.add(edge.type());
                }
            }
            List<String> outTypes = new ArrayList<>();
            for (Edge edge : edges.outgoing(id)) {
                if (within.contains(edge.targetId())) {
                    outTypes.add(edge.type());
                }
            }
            roles.put(id, NodeRole.classify(node.get().getType(), inTypes, outTypes));
        }
        return roles;
    }

    // --- Connectivity checks ---

    /// Lists input slots with no incoming link or with a reference to a missing link.
    ///
    /// @param document source document, not null
    /// @param primaryOnly only report slot 0 of each node
    /// @return unconnected inputs in document order, never null
    public List<UnconnectedInput> unconnectedInputs(WorkflowDocument document, boolean primaryOnly) {
        List<UnconnectedInput> result = new ArrayList<>();
        for (Node node : document.nodes()) {
            List<InputSlot> inputs = node.getInputs();
            for (int i = 0; i < inputs.size(); i++) {
                if (primaryOnly && i > 0) {
                    break;
                }
                InputSlot input = inputs.get(i);
                if (input.link() == null) {
                    boolean likelyRequired =
                            i == 0
                                    || !input.name().toLowerCase(Locale.ROOT).contains("optional")
                                            && !config.getOptionalHeavyTypes().contains(node.getType());
                    result.add(
                            new UnconnectedInput(
                                    node.getId(),
                                    node.getType(),
                                    i,
                                    input.name(),
                                    input.type(),
                                    likelyRequired,
                                    i == 0,
                                    null));
                } else if (document.findLink(input.link()).isEmpty()) {
                    result.add(
                            new UnconnectedInput(
                                    node.getId(),
                                    node.getType(),
                                    i,
                                    input.name(),
                                    input.type(),
                                    true,
                                    i == 0,
                                    input.link()));
                }
            }
        }
        return result;
    }

    /// Lists output slots feeding nothing, skipping terminal node types.
    ///
    /// @param document source document, not null
    /// @return unconnected outputs in document order, never null
    public List<UnconnectedOutput> unconnectedOutputs(WorkflowDocument document) {
        List<UnconnectedOutput> result = new ArrayList<>();
        for (Node node : document.nodes()) {
            if (config.getTerminalTypes().contains(node.getType())) {
                continue;
            }
            List<OutputSlot> outputs = node.getOutputs();
            for (int i = 0; i < outputs.size(); i++) {
                if (!outputs.get(i).isConnected()) {
                    OutputSlot output = outputs.get(i);
                    result.add(
                            new UnconnectedOutput(node.getId(), node.getType(), i, output.name(), output.type()));
                }
            }
        }
        return result;
    }

    // --- Whole-document reports ---

    /// Computes entry and exit points, main pipelines, variables and loops.
    ///
    /// @param document source document, not null
    /// @return structural overview, never null
    public WorkflowStructure structure(WorkflowDocument document) {
        VariableBindings variables = variableResolver.resolve(document);
        EdgeIndex edges = EdgeIndex.of(document, variables.fetchSources());
        Set<NodeId> consumedStores = new HashSet<>();
        for (VariableBinding binding : variables.bindings()) {
            if (!binding.fetchIds().isEmpty()) {
                consumedStores.add(binding.storeId());
            }
        }

        List<NodeId> entries = new ArrayList<>();
        List<NodeId> exits = new ArrayList<>();
        for (Node node : document.nodes()) {
            if (config.isVisual(node.getType())) {
                continue;
            }
            boolean resolvedFetch = variables.fetchSources().containsKey(node.getId());
            if (!resolvedFetch && node.getInputs().stream().noneMatch(InputSlot::isConnected)) {
                entries.add(node.getId());
            }
            if (!consumedStores.contains(node.getId())
                    && node.getOutputs().stream().noneMatch(OutputSlot::isConnected)) {
                exits.add(node.getId());
            }
        }
        entries.sort(null);
        exits.sort(null);

        List<NodeId> primaryInputs = new ArrayList<>();
        List<NodeId> modelLoaders = new ArrayList<>();
        for (NodeId id : entries) {
            String type = typeOf(document, id);
            if (containsAny(type, "loadvideo", "loadimage", "vhs_load")) {
                primaryInputs.add(id);
            } else if (containsAny(type, "loader", "load", "model", "vae", "lora")) {
                modelLoaders.add(id);
            }
        }
        List<NodeId> primaryOutputs = new ArrayList<>();
        for (NodeId id : exits) {
            if (containsAny(typeOf(document, id), "save", "combine", "output")) {
                primaryOutputs.add(id);
            }
        }
        boolean video =
                document.nodes().stream()
                        .anyMatch(node -> containsAny(typeOf(document, node.getId()), "video", "vhs"));

        List<Pipeline> pipelines = new ArrayList<>();
        Map<NodeId, List<Edge>> memo = new HashMap<>();
        for (NodeId exit : exits) {
            List<Edge> chain = longestChain(exit, edges, memo, new HashSet<>());
            if (chain.isEmpty()) {
                continue;
            }
            List<NodeId> path = new ArrayList<>();
            path.add(chain.get(0).sourceId());
            List<String> types = new ArrayList<>();
            for (Edge edge : chain) {
                path.add(edge.targetId());
                types.add(edge.type());
            }
            pipelines.add(new Pipeline(exit, typeOf(document, exit), path, categorize(types)));
        }

        return new WorkflowStructure(
                entries,
                exits,
                primaryInputs,
                modelLoaders,
                primaryOutputs,
                video ? "Video" : "General",
                pipelines,
                variables.bindings(),
                variables.loops(),
                variables.warnings());
    }

    private static List<Edge> longestChain(
            NodeId node, EdgeIndex edges, Map<NodeId, List<Edge>> memo, Set<NodeId> onStack) {
        List<Edge> cached = memo.get(node);
        if (cached != null) {
            return cached;
        }
        onStack.add(node);
        List<Edge> best = List.of();
        for (Edge edge : edges.incoming(node)) {
            if (onStack.contains(edge.sourceId())) {
                continue;
            }
            List<Edge> candidate = new ArrayList<>(longestChain(edge.sourceId(), edges, memo, onStack));
            candidate.add(edge);
            if (candidate.size() > best.size()) {
                best = candidate;
            }
        }
        onStack.remove(node);
        memo.put(node, best);
        return best;
    }

    private static String categorize(List<String> types) {
        Set<String> upper = new HashSet<>();
        types.forEach(type -> upper.add(type.toUpperCase(Locale.ROOT)));
        if (upper.stream().anyMatch(type -> type.contains("VACE"))) return "VACE";
        if (upper.contains("LATENT")) return "Latent";
        if (upper.contains("IMAGE")) return "Image";
        if (upper.contains("VIDEO")) return "Video";
        return "Mixed";
    }

    private static String typeOf(WorkflowDocument document, NodeId id) {
        return document.findNode(id).map(n -> n.getType().toLowerCase(Locale.ROOT)).orElse("");
    }

    private static boolean containsAny(String text, String... fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /// @return pattern label, headline parameters, main flows and counts
    public WorkflowSummary summarize(WorkflowDocument document) {
        return patternDetector.summarize(document);
    }

    /// @return integrity violations, empty when the document is clean
    public List<Violation> verify(WorkflowDocument document) {
        return integrityVerifier.verify(document);
    }

    /// @return differences from `before` to `after`
    public DiffResult diff(WorkflowDocument before, WorkflowDocument after) {
        return workflowDiff.diff(before, after);
    }

    private EdgeIndex edgeIndex(WorkflowDocument document) {
        return EdgeIndex.of(document, variableResolver.resolve(document).fetchSources());
    }
}
