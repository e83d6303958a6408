package io.nodewright.core.graph;

import io.nodewright.core.exception.IntegrityException;
import io.nodewright.core.exception.NodeNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A workflow document: the owner of all nodes, links and groups.
///
/// Nodes and links are kept in document order. Lookups by id go through an
/// index that resolves to the first record carrying the id, so documents with
/// duplicate ids can still be loaded and reported on by verification.
///
/// ### Invariants enforced by the mutators
/// - every link's endpoints reference existing nodes and existing slots
/// - an input slot holds at most one incoming link
/// - a link's type tag is compatible with both endpoint slots
/// - slot link references and the link table agree
///
/// A mutator that would break an invariant throws {@link IntegrityException}
/// before changing anything.
///
/// ### Ownership
/// Documents are mutable containers of immutable {@link Node} and {@link Link}
/// records. Editing operations call {@link #copy()} first and mutate the copy,
/// so the caller's document is never changed. {@link #copy()} is cheap: only
/// the containers are duplicated.
///
/// @implNote **Not thread-safe**. A document must not be shared across
/// concurrent operations.
public final class WorkflowDocument {

    private final List<Node> nodes;
    private final List<Link> links;
    private final List<Group> groups;
    private final Map<String, Object> attributes;
    private long lastNodeId;
    private int lastLinkId;

    private Map<NodeId, Node> nodeIndex;
    private Map<Integer, Link> linkIndex;

    private WorkflowDocument(
            List<Node> nodes,
            List<Link> links,
            List<Group> groups,
            Map<String, Object> attributes,
            long lastNodeId,
            int lastLinkId) {
        this.nodes = new ArrayList<>(nodes);
        this.links = new ArrayList<>(links);
        this.groups = new ArrayList<>(groups);
        this.attributes = Attributes.copyOf(attributes);
        this.lastNodeId = lastNodeId;
        this.lastLinkId = lastLinkId;
        reindex();
    }

    /// Creates a document from already-parsed records without validating them.
    ///
    /// Parsers use this so that malformed-but-loadable documents (dangling
    /// links, duplicate ids) can still be inspected and verified.
    ///
    /// @param nodes node records in document order, not null
    /// @param links link records in document order, not null
    /// @param groups group records, not null
    /// @param attributes remaining top-level fields, may be null
    /// @param lastNodeId the document's `last_node_id` counter (0 if absent)
    /// @param lastLinkId the document's `last_link_id` counter (0 if absent)
    /// @return new document, never null
    public static WorkflowDocument of(
            List<Node> nodes,
            List<Link> links,
            List<Group> groups,
            Map<String, Object> attributes,
            long lastNodeId,
            int lastLinkId) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(links, "links must not be null");
        Objects.requireNonNull(groups, "groups must not be null");
        return new WorkflowDocument(nodes, links, groups, attributes, lastNodeId, lastLinkId);
    }

    /// @return new empty document, never null
    public static WorkflowDocument empty() {
        return new WorkflowDocument(List.of(), List.of(), List.of(), Map.of(), 0, 0);
    }

    /// @return independent copy sharing the immutable node and link records, never null
    public WorkflowDocument copy() {
        return new WorkflowDocument(nodes, links, groups, attributes, lastNodeId, lastLinkId);
    }

    private void reindex() {
        Map<NodeId, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            byId.putIfAbsent(node.getId(), node);
        }
        Map<Integer, Link> byLinkId = new LinkedHashMap<>();
        for (Link link : links) {
            byLinkId.putIfAbsent(link.id(), link);
        }
        this.nodeIndex = byId;
        this.linkIndex = byLinkId;
    }

    // --- Accessors ---

    /// @return unmodifiable nodes in document order, never null
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /// @return unmodifiable links in document order, never null
    public List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    /// @return unmodifiable groups, never null
    public List<Group> groups() {
        return Collections.unmodifiableList(groups);
    }

    /// @return unmodifiable top-level fields other than nodes, links, groups and counters
    public Map<String, Object> attributes() {
        return attributes;
    }

    public long lastNodeId() {
        return lastNodeId;
    }

    public int lastLinkId() {
        return lastLinkId;
    }

    /// Returns the node with the given id.
    ///
    /// @param id node id, not null
    /// @return the node, never null
    /// @throws NodeNotFoundException if no node has this id
    public Node node(NodeId id) throws NodeNotFoundException {
        Node node = nodeIndex.get(id);
        if (node == null) {
            throw new NodeNotFoundException("node", id);
        }
        return node;
    }

    /// @return the node with the given id, if present
    public Optional<Node> findNode(NodeId id) {
        return Optional.ofNullable(nodeIndex.get(id));
    }

    public boolean containsNode(NodeId id) {
        return nodeIndex.containsKey(id);
    }

    /// @return the link with the given id, if present
    public Optional<Link> findLink(int linkId) {
        return Optional.ofNullable(linkIndex.get(linkId));
    }

    /// Returns the link feeding an input slot, if any.
    ///
    /// @param nodeId target node, not null
    /// @param slot input slot index
    /// @return the incoming link, or empty when unconnected or the reference is broken
    public Optional<Link> incomingLink(NodeId nodeId, int slot) {
        Node node = nodeIndex.get(nodeId);
        if (node == null || node.input(slot) == null || !node.input(slot).isConnected()) {
            return Optional.empty();
        }
        return findLink(node.input(slot).link());
    }

    /// @return links whose target is `nodeId`, in document order, never null
    public List<Link> linksInto(NodeId nodeId) {
        List<Link> result = new ArrayList<>();
        for (Link link : links) {
            if (link.targetId().equals(nodeId)) {
                result.add(link);
            }
        }
        return result;
    }

    /// @return links whose source is `nodeId`, in document order, never null
    public List<Link> linksFrom(NodeId nodeId) {
        List<Link> result = new ArrayList<>();
        for (Link link : links) {
            if (link.sourceId().equals(nodeId)) {
                result.add(link);
            }
        }
        return result;
    }

    /// Finds nodes whose type contains `pattern`, ignoring case.
    ///
    /// @param pattern substring of the type name, not null
    /// @return matching nodes in document order, never null
    public List<Node> findNodesByType(String pattern) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.getType().toLowerCase(Locale.ROOT).contains(needle)) {
                result.add(node);
            }
        }
        return result;
    }

    /// Returns an identifier not used by any node.
    ///
    /// Monotonic: the result is above both the document's `last_node_id`
    /// counter and every numeric id present, and skips ids whose textual form
    /// is already taken by a string id.
    ///
    /// @return unused numeric id, never null
    public NodeId nextId() {
        long candidate = lastNodeId;
        for (Node node : nodes) {
            if (node.getId().numeric()) {
                candidate = Math.max(candidate, node.getId().asLong());
            }
        }
        candidate++;
        while (isIdTaken(candidate)) {
            candidate++;
        }
        return NodeId.of(candidate);
    }

    private boolean isIdTaken(long candidate) {
        String text = Long.toString(candidate);
        for (Node node : nodes) {
            if (node.getId().value().equals(text)) {
                return true;
            }
        }
        return false;
    }

    /// @return link id above the `last_link_id` counter and every link id present
    public int nextLinkId() {
        int candidate = lastLinkId;
        for (Link link : links) {
            candidate = Math.max(candidate, link.id());
        }
        return candidate + 1;
    }

    // --- Mutators ---

    /// Adds an unconnected node.
    ///
    /// @param node node to add, not null; its slots must not reference links
    /// @throws IntegrityException if the id is taken or a slot references a link
    public void addNode(Node node) throws IntegrityException {
        Objects.requireNonNull(node, "node must not be null");
        if (nodeIndex.containsKey(node.getId())) {
            throw new IntegrityException(
                    "addNode: duplicate node id " + node.getId() + " (" + node.getType() + ")");
        }
        for (InputSlot input : node.getInputs()) {
            if (input.isConnected()) {
                throw new IntegrityException(
                        "addNode: input '"
                                + input.name()
                                + "' of new node "
                                + node.getId()
                                + " references link "
                                + input.link());
            }
        }
        for (OutputSlot output : node.getOutputs()) {
            if (output.isConnected()) {
                throw new IntegrityException(
                        "addNode: output '"
                                + output.name()
                                + "' of new node "
                                + node.getId()
                                + " references links "
                                + output.links());
            }
        }
        nodes.add(node);
        if (node.getId().numeric()) {
            lastNodeId = Math.max(lastNodeId, node.getId().asLong());
        }
        reindex();
    }

    /// Replaces a node's title, widgets or attributes.
    ///
    /// The replacement must keep the node's id, and its slots must carry the
    /// same link references as the current node; wiring changes go through
    /// {@link #addLink} and {@link #removeLink}.
    ///
    /// @param node replacement node, not null
    /// @throws NodeNotFoundException if no node has the replacement's id
    /// @throws IntegrityException if slot link references differ
    public void updateNode(Node node) throws NodeNotFoundException, IntegrityException {
        Node current = node(node.getId());
        if (!sameLinkReferences(current, node)) {
            throw new IntegrityException(
                    "updateNode: slot link references of node "
                            + node.getId()
                            + " must not change outside addLink/removeLink");
        }
        replace(current, node);
    }

    private static boolean sameLinkReferences(Node a, Node b) {
        if (a.getInputs().size() != b.getInputs().size()
                || a.getOutputs().size() != b.getOutputs().size()) {
            return false;
        }
        for (int i = 0; i < a.getInputs().size(); i++) {
            if (!Objects.equals(a.getInputs().get(i).link(), b.getInputs().get(i).link())) {
                return false;
            }
        }
        for (int i = 0; i < a.getOutputs().size(); i++) {
            if (!a.getOutputs().get(i).links().equals(b.getOutputs().get(i).links())) {
                return false;
            }
        }
        return true;
    }

    private void replace(Node current, Node replacement) {
        int position = nodes.indexOf(current);
        nodes.set(position, replacement);
        reindex();
    }

    /// Removes a node and every link touching it.
    ///
    /// Inputs on surviving nodes that were fed by the removed node become
    /// unconnected.
    ///
    /// @param id node to remove, not null
    /// @return links removed along with the node, in document order, never null
    /// @throws NodeNotFoundException if no node has this id
    public List<Link> removeNode(NodeId id) throws NodeNotFoundException {
        Node node = node(id);
        List<Link> touching = new ArrayList<>();
        for (Link link : links) {
            if (link.touches(id)) {
                touching.add(link);
            }
        }
        for (Link link : touching) {
            detach(link);
        }
        nodes.removeIf(candidate -> candidate.getId().equals(node.getId()));
        reindex();
        return touching;
    }

    /// Connects an output slot to an input slot.
    ///
    /// @param sourceId node owning the output slot, not null
    /// @param sourceSlot output slot index
    /// @param targetId node owning the input slot, not null
    /// @param targetSlot input slot index
    /// @return the created link, carrying the source slot's type tag, never null
    /// @throws IntegrityException if an endpoint or slot is missing, the input
    /// is already connected, or the slot types are incompatible. An input
    /// referencing a link missing from the link table counts as unconnected
    /// and is overwritten.
    public Link addLink(NodeId sourceId, int sourceSlot, NodeId targetId, int targetSlot)
            throws IntegrityException {
        Node source = nodeIndex.get(sourceId);
        Node target = nodeIndex.get(targetId);
        if (source == null || target == null) {
            throw new IntegrityException(
                    "addLink: endpoint node "
                            + (source == null ? sourceId : targetId)
                            + " does not exist");
        }
        OutputSlot output = source.output(sourceSlot);
        if (output == null) {
            throw new IntegrityException(
                    "addLink: node " + sourceId + " has no output slot " + sourceSlot);
        }
        InputSlot input = target.input(targetSlot);
        if (input == null) {
            throw new IntegrityException(
                    "addLink: node " + targetId + " has no input slot " + targetSlot);
        }
        if (input.isConnected() && linkIndex.containsKey(input.link())) {
            throw new IntegrityException(
                    "addLink: input "
                            + targetSlot
                            + " ('"
                            + input.name()
                            + "') of node "
                            + targetId
                            + " already holds link "
                            + input.link());
        }
        if (!TypeTags.compatible(output.type(), input.type())) {
            throw new IntegrityException(
                    "addLink: type mismatch "
                            + output.type()
                            + " -> "
                            + input.type()
                            + " between node "
                            + sourceId
                            + " and node "
                            + targetId);
        }

        Link link =
                new Link(nextLinkId(), sourceId, sourceSlot, targetId, targetSlot, output.type());
        links.add(link);
        lastLinkId = Math.max(lastLinkId, link.id());

        Node updatedSource =
                source.toBuilder()
                        .replaceOutput(sourceSlot, output.plusLink(link.id()))
                        .build();
        replace(source, updatedSource);
        Node currentTarget = nodeIndex.get(targetId);
        Node updatedTarget =
                currentTarget.toBuilder()
                        .replaceInput(targetSlot, input.withLink(link.id()))
                        .build();
        replace(currentTarget, updatedTarget);
        return link;
    }

    /// Removes a link and clears the slot references to it.
    ///
    /// @param linkId link to remove
    /// @return the removed link, never null
    /// @throws IntegrityException if no link has this id
    public Link removeLink(int linkId) throws IntegrityException {
        Link link = linkIndex.get(linkId);
        if (link == null) {
            throw new IntegrityException("removeLink: link " + linkId + " does not exist");
        }
        detach(link);
        reindex();
        return link;
    }

    private void detach(Link link) {
        links.remove(link);
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            Node.Builder builder = null;
            List<InputSlot> inputs = node.getInputs();
            for (int slot = 0; slot < inputs.size(); slot++) {
                if (Objects.equals(inputs.get(slot).link(), link.id())
                        && node.getId().equals(link.targetId())) {
                    builder = builder != null ? builder : node.toBuilder();
                    builder.replaceInput(slot, inputs.get(slot).withLink(null));
                }
            }
            List<OutputSlot> outputs = node.getOutputs();
            for (int slot = 0; slot < outputs.size(); slot++) {
                if (outputs.get(slot).links().contains(link.id())
                        && node.getId().equals(link.sourceId())) {
                    builder = builder != null ? builder : node.toBuilder();
                    builder.replaceOutput(slot, outputs.get(slot).minusLink(link.id()));
                }
            }
            if (builder != null) {
                nodes.set(i, builder.build());
            }
        }
        reindex();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDocument other)) return false;
        return nodes.equals(other.nodes)
                && links.equals(other.links)
                && groups.equals(other.groups)
                && lastNodeId == other.lastNodeId
                && lastLinkId == other.lastLinkId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, links, groups, lastNodeId, lastLinkId);
    }

    @Override
    public String toString() {
        return "WorkflowDocument{nodes=" + nodes.size() + ", links=" + links.size() + "}";
    }
}
