package io.nodewright.core.edit;

import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.edit.DeletePlan.OrphanedInput;
import io.nodewright.core.edit.InlinePlan.PlannedLink;
import io.nodewright.core.exception.IntegrityException;
import io.nodewright.core.exception.NodeNotFoundException;
import io.nodewright.core.exception.SlotException;
import io.nodewright.core.graph.EdgeIndex;
import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.TypeTags;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.schema.NodeSchema;
import io.nodewright.core.schema.NodeSchemaRegistry;
import io.nodewright.core.schema.SlotDeclaration;
import io.nodewright.core.schema.SlotResolver;
import io.nodewright.core.variable.VariableBinding;
import io.nodewright.core.variable.VariableBindings;
import io.nodewright.core.variable.VariableResolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Mutating operations over workflow documents.
///
/// Every operation copies the document it is given and edits the copy, so
/// the caller's document is never modified. An operation either returns a
/// consistent new state in {@link EditResult#document()} or throws before
/// anything is visible to the caller.
///
/// ### Contracts
/// - **Precondition**: the input document is not mutated concurrently
/// - **Postcondition**: the returned document satisfies the link invariants
///   enforced by {@link WorkflowDocument}
///
/// Slot references are resolved through the {@link NodeSchemaRegistry}, so
/// callers may name slots instead of counting them.
///
/// @implNote Stateless and thread-safe.
public final class GraphEditor {

    private static final Logger logger = Logger.getLogger(GraphEditor.class.getName());

    private final GraphEngineConfig config;
    private final NodeSchemaRegistry schemas;
    private final SlotResolver slotResolver;
    private final VariableResolver variableResolver;

    public GraphEditor(GraphEngineConfig config, NodeSchemaRegistry schemas) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
        this.slotResolver = new SlotResolver(schemas);
        this.variableResolver = new VariableResolver(config);
    }

    public SlotResolver getSlotResolver() {
        return slotResolver;
    }

    // --- copy ---

    /// Duplicates a node as an unconnected template.
    ///
    /// The copy gets a fresh id, no links, and a position offset by the
    /// configured copy offset. Widget overrides follow the rules of
    /// {@link #set(WorkflowDocument, NodeId, Map)}.
    ///
    /// @param document current document, not null
    /// @param nodeId node to copy, not null
    /// @param title title of the copy, null to keep the original's
    /// @param values widget overrides by index or name, not null (may be empty)
    /// @return result whose {@link EditResult#createdNode()} is the copy
    /// @throws NodeNotFoundException if the node does not exist
    /// @throws IntegrityException if the copy cannot be added
    public EditResult copy(
            WorkflowDocument document, NodeId nodeId, String title, Map<String, Object> values)
            throws NodeNotFoundException, IntegrityException {
        Node template = require(document, nodeId, "copy");
        WorkflowDocument next = document.copy();
        NodeId newId = next.nextId();

        List<InputSlot> inputs = new ArrayList<>();
        template.getInputs().forEach(input -> inputs.add(input.withLink(null)));
        List<OutputSlot> outputs = new ArrayList<>();
        template.getOutputs()
                .forEach(
                        output ->
                                outputs.add(
                                        new OutputSlot(
                                                output.name(),
                                                output.type(),
                                                List.of(),
                                                output.attributes())));

        Map<String, Object> attributes = new LinkedHashMap<>(template.getAttributes());
        offsetPosition(attributes);

        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Node draft =
                template.toBuilder()
                        .id(newId)
                        .inputs(inputs)
                        .outputs(outputs)
                        .attributes(attributes)
                        .title(title != null ? title : template.getTitle())
                        .build();
        WidgetValues widgets = assign(draft, values, changes, warnings);
        Node copy = draft.toBuilder().widgets(widgets).build();
        next.addNode(copy);

        logger.info("Copied node " + nodeId + " to " + newId);
        return new EditResult(
                next, "copy", List.of(newId), List.of(), List.of(), List.of(), changes, warnings);
    }

    private void offsetPosition(Map<String, Object> attributes) {
        Object pos = attributes.get("pos");
        double dx = config.getCopyOffsetX();
        double dy = config.getCopyOffsetY();
        if (pos instanceof List<?> list && list.size() >= 2) {
            List<Object> moved = new ArrayList<>(list);
            moved.set(0, offset(list.get(0), dx));
            moved.set(1, offset(list.get(1), dy));
            attributes.put("pos", moved);
        } else if (pos instanceof Map<?, ?> map) {
            Map<Object, Object> moved = new LinkedHashMap<>(map);
            moved.put("0", offset(map.get("0"), dx));
            moved.put("1", offset(map.get("1"), dy));
            attributes.put("pos", moved);
        }
    }

    private static Object offset(Object coordinate, double delta) {
        if (coordinate instanceof Integer value && delta == Math.rint(delta)) {
            return value + (int) delta;
        }
        if (coordinate instanceof Number value) {
            return value.doubleValue() + delta;
        }
        return delta;
    }

    // --- wire ---

    /// Connects an output slot to an input slot.
    ///
    /// Any existing link into the input is replaced. Wiring a connection that
    /// already exists leaves the document unchanged.
    ///
    /// @param document current document, not null
    /// @param sourceId producing node, not null
    /// @param sourceSlot output slot index or name, not null
    /// @param targetId consuming node, not null
    /// @param targetSlot input slot index or name, not null
    /// @return result listing the created and replaced links
    /// @throws NodeNotFoundException if either node does not exist
    /// @throws SlotException if a slot is missing or the types are incompatible
    /// @throws IntegrityException if the link cannot be added
    public EditResult wire(
            WorkflowDocument document,
            NodeId sourceId,
            String sourceSlot,
            NodeId targetId,
            String targetSlot)
            throws NodeNotFoundException, SlotException, IntegrityException {
        Node source = require(document, sourceId, "wire");
        Node target = require(document, targetId, "wire");
        int out = slotResolver.resolveOutput(source, sourceSlot);
        int in = slotResolver.resolveInput(target, targetSlot);
        OutputSlot output = source.output(out);
        InputSlot input = target.input(in);
        if (!TypeTags.compatible(output.type(), input.type())) {
            throw new SlotException(
                    targetId,
                    targetSlot,
                    "wire: type mismatch "
                            + output.type()
                            + " ("
                            + source.displayName()
                            + " output "
                            + out
                            + ") -> "
                            + input.type()
                            + " ("
                            + target.displayName()
                            + " input "
                            + in
                            + ")");
        }

        Optional<Link> existing = document.incomingLink(targetId, in);
        if (existing.isPresent()
                && existing.get().sourceId().equals(sourceId)
                && existing.get().sourceSlot() == out) {
            return unchanged(document, "wire");
        }

        WorkflowDocument next = document.copy();
        List<Link> removed = new ArrayList<>();
        if (existing.isPresent()) {
            removed.add(next.removeLink(existing.get().id()));
        }
        Link link = next.addLink(sourceId, out, targetId, in);
        logger.info("Wired " + link.endpoints() + " as link " + link.id());
        return new EditResult(
                next, "wire", List.of(), List.of(), List.of(link), removed, List.of(), List.of());
    }

    /// Removes every link touching a node.
    ///
    /// @throws NodeNotFoundException if the node does not exist
    /// @throws IntegrityException if a link cannot be removed
    public EditResult disconnect(WorkflowDocument document, NodeId nodeId)
            throws NodeNotFoundException, IntegrityException {
        require(document, nodeId, "disconnect");
        WorkflowDocument next = document.copy();
        List<Link> removed = new ArrayList<>();
        for (Link link : document.links()) {
            if (link.touches(nodeId) && next.findLink(link.id()).isPresent()) {
                removed.add(next.removeLink(link.id()));
            }
        }
        logger.info("Disconnected node " + nodeId + ", removed " + removed.size() + " link(s)");
        return new EditResult(
                next, "disconnect", List.of(), List.of(), List.of(), removed, List.of(), List.of());
    }

    // --- set ---

    /// Assigns one widget value.
    ///
    /// @see #set(WorkflowDocument, NodeId, Map)
    public EditResult set(WorkflowDocument document, NodeId nodeId, String key, Object value)
            throws NodeNotFoundException, IntegrityException {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return set(document, nodeId, values);
    }

    /// Assigns widget values by positional index or by name.
    ///
    /// Positional widgets take numeric keys, or names the node type's schema
    /// declares. Keyed widgets take any key. Keys that do not fit the node's
    /// representation are skipped and reported as warnings.
    ///
    /// @param document current document, not null
    /// @param nodeId node to edit, not null
    /// @param values keys to values in assignment order, not null
    /// @return result with one change line per assigned value
    /// @throws NodeNotFoundException if the node does not exist
    /// @throws IntegrityException if the node cannot be updated
    public EditResult set(WorkflowDocument document, NodeId nodeId, Map<String, Object> values)
            throws NodeNotFoundException, IntegrityException {
        Node node = require(document, nodeId, "set");
        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        WidgetValues widgets = assign(node, values, changes, warnings);
        WorkflowDocument next = document.copy();
        next.updateNode(node.toBuilder().widgets(widgets).build());
        logger.info("Set " + changes.size() + " value(s) on node " + nodeId);
        return new EditResult(
                next, "set", List.of(), List.of(), List.of(), List.of(), changes, warnings);
    }

    private WidgetValues assign(
            Node node, Map<String, Object> values, List<String> changes, List<String> warnings) {
        WidgetValues widgets = node.getWidgets();
        Optional<NodeSchema> schema = schemas.get(node.getType());
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            Integer index = parseIndex(key);
            if (widgets.layout() == WidgetValues.Layout.KEYED) {
                if (index != null && !widgets.asMap().containsKey(key)) {
                    warnings.add(
                            "Numeric key '"
                                    + key
                                    + "' on keyed widgets of "
                                    + node.displayName()
                                    + "; use the key name");
                }
                changes.add(change(node, "widgets." + key, widgets.get(key), value));
                widgets = widgets.with(key, value);
                continue;
            }
            if (index == null) {
                int declared = schema.map(s -> s.widgetIndex(key)).orElse(-1);
                if (declared >= 0) {
                    index = declared;
                } else if (widgets.layout() == WidgetValues.Layout.ABSENT) {
                    changes.add(change(node, "widgets." + key, null, value));
                    widgets = widgets.with(key, value);
                    continue;
                }
            }
            if (index == null || index < 0) {
                warnings.add(
                        "Cannot use key '"
                                + key
                                + "' on positional widgets of "
                                + node.displayName()
                                + " (use a numeric index)");
                continue;
            }
            changes.add(change(node, "widgets[" + index + "]", widgets.get(index), value));
            widgets = widgets.with(index, value);
        }
        return widgets;
    }

    private static Integer parseIndex(String key) {
        if (key.isEmpty()) {
            return null;
        }
        for (int i = key.charAt(0) == '-' ? 1 : 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return null;
            }
        }
        return key.equals("-") || key.length() > 9 ? null : Integer.valueOf(key);
    }

    private static String change(Node node, String field, Object before, Object after) {
        return "[" + node.getId() + "] " + field + ": " + before + " -> " + after;
    }

    // --- delete ---

    /// Computes what {@link #delete} would remove without changing anything.
    ///
    /// With `cascade`, every node downstream of the deleted ones that is no
    /// longer reachable from a surviving root (a node with no incoming link)
    /// is deleted too. Only real links count for reachability.
    ///
    /// @param document current document, not null
    /// @param nodeIds nodes to delete, not null or empty
    /// @param cascade also delete nodes left without a surviving source
    /// @return the deletion plan, never null
    /// @throws NodeNotFoundException if any id does not exist
    public DeletePlan planDelete(
            WorkflowDocument document, Collection<NodeId> nodeIds, boolean cascade)
            throws NodeNotFoundException {
        Set<NodeId> requested = new LinkedHashSet<>();
        for (NodeId id : nodeIds) {
            require(document, id, "delete");
            requested.add(id);
        }
        Set<NodeId> doomed = new LinkedHashSet<>(requested);
        if (cascade) {
            EdgeIndex edges = EdgeIndex.of(document);
            Set<NodeId> candidates = edges.reachable(requested, true);
            candidates.removeAll(requested);
            Set<NodeId> survivors = reachableAvoiding(document, edges, requested, candidates);
            for (Node node : document.nodes()) {
                if (candidates.contains(node.getId()) && !survivors.contains(node.getId())) {
                    doomed.add(node.getId());
                }
            }
        }

        List<Link> removedLinks = new ArrayList<>();
        for (Link link : document.links()) {
            if (doomed.contains(link.sourceId()) || doomed.contains(link.targetId())) {
                removedLinks.add(link);
            }
        }
        List<OrphanedInput> orphaned = new ArrayList<>();
        for (Link link : removedLinks) {
            if (doomed.contains(link.targetId())) {
                continue;
            }
            Node target = document.findNode(link.targetId()).orElse(null);
            InputSlot input = target != null ? target.input(link.targetSlot()) : null;
            if (input == null) {
                continue;
            }
            orphaned.add(
                    new OrphanedInput(
                            target.getId(),
                            target.getType(),
                            link.targetSlot(),
                            input.name(),
                            link.sourceId(),
                            document.findNode(link.sourceId()).map(Node::getType).orElse("?")));
        }
        return new DeletePlan(
                new ArrayList<>(requested), new ArrayList<>(doomed), removedLinks, orphaned);
    }

    /// Every node outside the requested set and the cascade candidates is a survivor seed,
    /// so a surviving cycle without a root still keeps its downstream alive.
    private static Set<NodeId> reachableAvoiding(
            WorkflowDocument document,
            EdgeIndex edges,
            Set<NodeId> removed,
            Set<NodeId> candidates) {
        Set<NodeId> visited = new LinkedHashSet<>();
        Deque<NodeId> queue = new ArrayDeque<>();
        for (Node node : document.nodes()) {
            NodeId id = node.getId();
            if (!removed.contains(id) && !candidates.contains(id) && visited.add(id)) {
                queue.add(id);
            }
        }
        while (!queue.isEmpty()) {
            for (Edge edge : edges.outgoing(queue.poll())) {
                NodeId next = edge.targetId();
                if (!removed.contains(next) && visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    /// Deletes nodes and every link touching them.
    ///
    /// @param document current document, not null
    /// @param nodeIds nodes to delete, not null
    /// @param cascade also delete nodes left without a surviving source
    /// @return result listing deleted nodes and removed links
    /// @throws NodeNotFoundException if any id does not exist
    /// @see #planDelete
    public EditResult delete(
            WorkflowDocument document, Collection<NodeId> nodeIds, boolean cascade)
            throws NodeNotFoundException {
        DeletePlan plan = planDelete(document, nodeIds, cascade);
        WorkflowDocument next = document.copy();
        for (NodeId id : plan.nodes()) {
            next.removeNode(id);
        }
        List<String> warnings = new ArrayList<>();
        for (OrphanedInput orphan : plan.orphanedInputs()) {
            warnings.add(
                    "Input '"
                            + orphan.name()
                            + "' of ["
                            + orphan.nodeId()
                            + "] "
                            + orphan.nodeType()
                            + " lost its link from ["
                            + orphan.formerSource()
                            + "] "
                            + orphan.formerSourceType());
        }
        logger.info(
                "Deleted "
                        + plan.nodes().size()
                        + " node(s) ("
                        + plan.cascaded().size()
                        + " by cascade), removed "
                        + plan.removedLinks().size()
                        + " link(s)");
        return new EditResult(
                next,
                "delete",
                List.of(),
                plan.nodes(),
                List.of(),
                plan.removedLinks(),
                List.of(),
                warnings);
    }

    // --- create ---

    /// Creates an unconnected node.
    ///
    /// Slots not given explicitly are taken from the type's schema, as are the
    /// default widget values. Unknown types without explicit slots get none.
    ///
    /// @param document current document, not null
    /// @param type declared type name, not null
    /// @param title node title, may be null
    /// @param inputs input declarations, empty to use the schema's
    /// @param outputs output declarations, empty to use the schema's
    /// @param values widget overrides by index or name, not null
    /// @return result whose {@link EditResult#createdNode()} is the new node
    /// @throws IntegrityException if the node cannot be added
    public EditResult create(
            WorkflowDocument document,
            String type,
            String title,
            List<SlotDeclaration> inputs,
            List<SlotDeclaration> outputs,
            Map<String, Object> values)
            throws IntegrityException {
        Objects.requireNonNull(type, "type must not be null");
        Optional<NodeSchema> schema = schemas.get(type);
        List<SlotDeclaration> inputDecls =
                inputs.isEmpty() ? schema.map(NodeSchema::inputs).orElse(List.of()) : inputs;
        List<SlotDeclaration> outputDecls =
                outputs.isEmpty() ? schema.map(NodeSchema::outputs).orElse(List.of()) : outputs;

        WorkflowDocument next = document.copy();
        NodeId newId = next.nextId();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("pos", List.of(100, 100));
        attributes.put("size", List.of(200, 100));
        attributes.put("flags", Map.of());
        attributes.put("order", document.nodes().size());
        attributes.put("mode", 0);
        attributes.put("properties", Map.of());

        Node.Builder builder =
                Node.builder()
                        .id(newId)
                        .type(type)
                        .title(title)
                        .attributes(attributes)
                        .widgets(
                                WidgetValues.positional(
                                        schema.map(NodeSchema::defaults).orElse(List.of())));
        inputDecls.forEach(decl -> builder.input(InputSlot.unconnected(decl.name(), decl.type())));
        outputDecls.forEach(decl -> builder.output(OutputSlot.unconnected(decl.name(), decl.type())));
        Node draft = builder.build();

        List<String> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Node node = draft.toBuilder().widgets(assign(draft, values, changes, warnings)).build();
        next.addNode(node);
        logger.info("Created node " + newId + " of type " + type);
        return new EditResult(
                next, "create", List.of(newId), List.of(), List.of(), List.of(), changes, warnings);
    }

    // --- inline ---

    /// Computes what {@link #inline} would do without changing anything.
    ///
    /// @param document current document, not null
    /// @return the inlining plan, never null
    public InlinePlan planInline(WorkflowDocument document) {
        VariableBindings variables = variableResolver.resolve(document);
        List<String> warnings = new ArrayList<>(variables.warnings());
        List<VariableBinding> pairs = new ArrayList<>();
        Set<NodeId> nodesToDelete = new LinkedHashSet<>();
        for (VariableBinding binding : variables.bindings()) {
            if (binding.fetchIds().isEmpty()) {
                continue;
            }
            if (binding.source() == null) {
                warnings.add("Variable '" + binding.key() + "' has no resolved source; kept");
                continue;
            }
            pairs.add(binding);
            nodesToDelete.add(binding.storeId());
            nodesToDelete.addAll(binding.fetchIds());
        }

        List<PlannedLink> links = new ArrayList<>();
        for (VariableBinding binding : pairs) {
            SlotRef source = binding.source();
            String type =
                    document.findNode(source.nodeId())
                            .map(node -> node.output(source.slot()))
                            .map(OutputSlot::type)
                            .orElse(TypeTags.WILDCARD);
            for (NodeId fetchId : binding.fetchIds()) {
                for (Link link : document.linksFrom(fetchId)) {
                    if (nodesToDelete.contains(link.targetId())) {
                        continue;
                    }
                    links.add(
                            new PlannedLink(
                                    source, new SlotRef(link.targetId(), link.targetSlot()), type));
                }
            }
        }
        return new InlinePlan(pairs, new ArrayList<>(nodesToDelete), links, warnings);
    }

    /// Replaces variable indirection with direct links.
    ///
    /// Every consumer of a resolved fetch node is linked straight to the real
    /// source of its store node, then the store and fetch nodes are removed.
    /// Bindings without a resolved source are left in place and reported.
    /// Running it on its own output changes nothing.
    ///
    /// @param document current document, not null
    /// @return result listing removed nodes and created links
    /// @throws IntegrityException if a direct link cannot be created
    public EditResult inline(WorkflowDocument document) throws IntegrityException {
        InlinePlan plan = planInline(document);
        if (plan.isEmpty()) {
            return new EditResult(
                    document.copy(),
                    "inline",
                    List.of(),
                    List.of(),
                    List.of(),
                    List.of(),
                    List.of(),
                    plan.warnings());
        }
        WorkflowDocument next = document.copy();
        List<Link> removed = new ArrayList<>();
        for (NodeId id : plan.nodesToDelete()) {
            try {
                removed.addAll(next.removeNode(id));
            } catch (NodeNotFoundException e) {
                throw new IntegrityException("inline: node " + id + " vanished during inlining");
            }
        }
        List<Link> created = new ArrayList<>();
        for (PlannedLink planned : plan.linksToCreate()) {
            created.add(
                    next.addLink(
                            planned.source().nodeId(),
                            planned.source().slot(),
                            planned.target().nodeId(),
                            planned.target().slot()));
        }
        logger.info(
                "Inlined "
                        + plan.pairs().size()
                        + " variable(s): removed "
                        + plan.nodesToDelete().size()
                        + " node(s), created "
                        + created.size()
                        + " link(s)");
        return new EditResult(
                next,
                "inline",
                List.of(),
                plan.nodesToDelete(),
                created,
                removed,
                List.of(),
                plan.warnings());
    }

    // --- helpers ---

    private static Node require(WorkflowDocument document, NodeId nodeId, String operation)
            throws NodeNotFoundException {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        return document.findNode(nodeId)
                .orElseThrow(() -> new NodeNotFoundException(operation, nodeId));
    }

    private static EditResult unchanged(WorkflowDocument document, String operation) {
        return new EditResult(
                document.copy(),
                operation,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of());
    }
}
