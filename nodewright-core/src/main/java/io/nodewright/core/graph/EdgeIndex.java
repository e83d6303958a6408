package io.nodewright.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Forward and backward adjacency over a document's links, optionally extended
/// with virtual edges.
///
/// Built per call from the current document and never cached, so it is always
/// consistent with the document it was built from. Links whose endpoints do
/// not exist are skipped.
public final class EdgeIndex {

    private final Map<NodeId, List<Edge>> outgoing = new HashMap<>();
    private final Map<NodeId, List<Edge>> incoming = new HashMap<>();

    private EdgeIndex() {}

    /// Indexes the real links of a document.
    ///
    /// @param document source document, not null
    /// @return new index, never null
    public static EdgeIndex of(WorkflowDocument document) {
        return of(document, Map.of());
    }

    /// Indexes the real links of a document plus one virtual edge per entry of
    /// `virtualSources`, running from the mapped slot to the keyed node.
    ///
    /// @param document source document, not null
    /// @param virtualSources fetch node id to the real slot feeding it, not null
    /// @return new index, never null
    public static EdgeIndex of(WorkflowDocument document, Map<NodeId, SlotRef> virtualSources) {
        EdgeIndex index = new EdgeIndex();
        for (Link link : document.links()) {
            if (document.containsNode(link.sourceId()) && document.containsNode(link.targetId())) {
                index.add(Edge.of(link));
            }
        }
        for (Map.Entry<NodeId, SlotRef> entry : virtualSources.entrySet()) {
            SlotRef source = entry.getValue();
            if (!document.containsNode(source.nodeId()) || !document.containsNode(entry.getKey())) {
                continue;
            }
            OutputSlot slot = document.findNode(source.nodeId()).get().output(source.slot());
            String type = slot != null ? slot.type() : TypeTags.WILDCARD;
            index.add(new Edge(source.nodeId(), source.slot(), entry.getKey(), -1, type, null));
        }
        return index;
    }

    private void add(Edge edge) {
        outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
    }

    /// @return edges leaving `nodeId`, real edges in link order first, never null
    public List<Edge> outgoing(NodeId nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /// @return edges entering `nodeId`, never null
    public List<Edge> incoming(NodeId nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    /// Returns every node reachable from the seeds, seeds included.
    ///
    /// @param seeds start nodes, not null
    /// @param forward true to follow outgoing edges, false for incoming
    /// @return reachable nodes in discovery order, never null
    public Set<NodeId> reachable(Iterable<NodeId> seeds, boolean forward) {
        Set<NodeId> visited = new LinkedHashSet<>();
        Deque<NodeId> queue = new ArrayDeque<>();
        for (NodeId seed : seeds) {
            if (visited.add(seed)) {
                queue.add(seed);
            }
        }
        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            for (Edge edge : forward ? outgoing(current) : incoming(current)) {
                NodeId next = forward ? edge.targetId() : edge.sourceId();
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
