package io.nodewright.core.analysis;

import io.nodewright.core.analysis.Violation.Kind;
import io.nodewright.core.graph.Group;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.TypeTags;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Checks every structural invariant of a document and lists the violations.
///
/// ### Checks
/// - duplicate node ids and duplicate link ids
/// - links whose endpoint node or slot is missing
/// - links whose type tag is incompatible with either endpoint slot
/// - input slots fed by more than one link
/// - slot link references that disagree with the link table
/// - group references to missing nodes
///
/// A document built only through the {@link WorkflowDocument} mutators always
/// verifies clean.
public final class IntegrityVerifier {

    /// Verifies a document.
    ///
    /// @param document document to check, not null
    /// @return violations in discovery order, empty when the document is clean
    public List<Violation> verify(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        List<Violation> violations = new ArrayList<>();
        checkDuplicates(document, violations);
        checkLinks(document, violations);
        checkSlots(document, violations);
        checkGroups(document, violations);
        return violations;
    }

    private static void checkDuplicates(WorkflowDocument document, List<Violation> violations) {
        Set<NodeId> seenNodes = new HashSet<>();
        for (Node node : document.nodes()) {
            if (!seenNodes.add(node.getId())) {
                violations.add(
                        new Violation(
                                Kind.DUPLICATE_NODE_ID,
                                "Node id " + node.getId() + " is used more than once",
                                node.getId(),
                                null));
            }
        }
        Set<Integer> seenLinks = new HashSet<>();
        for (Link link : document.links()) {
            if (!seenLinks.add(link.id())) {
                violations.add(
                        new Violation(
                                Kind.DUPLICATE_LINK_ID,
                                "Link id " + link.id() + " is used more than once",
                                null,
                                link.id()));
            }
        }
    }

    private static void checkLinks(WorkflowDocument document, List<Violation> violations) {
        Map<SlotRef, Integer> writers = new HashMap<>();
        for (Link link : document.links()) {
            Optional<Node> source = document.findNode(link.sourceId());
            Optional<Node> target = document.findNode(link.targetId());
            if (source.isEmpty() || target.isEmpty()) {
                violations.add(
                        dangling(
                                link,
                                (source.isEmpty() ? "source" : "target")
                                        + " node "
                                        + (source.isEmpty() ? link.sourceId() : link.targetId())
                                        + " not found"));
                continue;
            }
            OutputSlot output = source.get().output(link.sourceSlot());
            InputSlot input = target.get().input(link.targetSlot());
            if (output == null) {
                violations.add(
                        dangling(
                                link,
                                "source node "
                                        + link.sourceId()
                                        + " has no output slot "
                                        + link.sourceSlot()));
            }
            if (input == null) {
                violations.add(
                        dangling(
                                link,
                                "target node "
                                        + link.targetId()
                                        + " has no input slot "
                                        + link.targetSlot()));
            }
            if (output != null && !TypeTags.compatible(output.type(), link.type())
                    || input != null && !TypeTags.compatible(link.type(), input.type())) {
                violations.add(
                        new Violation(
                                Kind.TYPE_MISMATCH,
                                "Link "
                                        + link.id()
                                        + " carries "
                                        + link.type()
                                        + " from "
                                        + (output != null ? output.type() : "?")
                                        + " into "
                                        + (input != null ? input.type() : "?"),
                                link.targetId(),
                                link.id()));
            }
            SlotRef inputRef = new SlotRef(link.targetId(), link.targetSlot());
            Integer previous = writers.putIfAbsent(inputRef, link.id());
            if (previous != null) {
                violations.add(
                        new Violation(
                                Kind.MULTIPLE_WRITERS,
                                "Input "
                                        + inputRef
                                        + " is fed by links "
                                        + previous
                                        + " and "
                                        + link.id(),
                                link.targetId(),
                                link.id()));
            }
        }
    }

    private static Violation dangling(Link link, String reason) {
        return new Violation(Kind.DANGLING_LINK, "Link " + link.id() + ": " + reason, null, link.id());
    }

    private static void checkSlots(WorkflowDocument document, List<Violation> violations) {
        for (Node node : document.nodes()) {
            List<InputSlot> inputs = node.getInputs();
            for (int i = 0; i < inputs.size(); i++) {
                Integer linkId = inputs.get(i).link();
                if (linkId == null) {
                    continue;
                }
                Optional<Link> link = document.findLink(linkId);
                if (link.isEmpty()) {
                    violations.add(
                            mismatch(node, linkId, "input " + i + " references missing link " + linkId));
                } else if (!link.get().targetId().equals(node.getId())
                        || link.get().targetSlot() != i) {
                    violations.add(
                            mismatch(
                                    node,
                                    linkId,
                                    "input " + i + " references link " + linkId + " which targets "
                                            + new SlotRef(link.get().targetId(), link.get().targetSlot())));
                }
            }
            List<OutputSlot> outputs = node.getOutputs();
            for (int i = 0; i < outputs.size(); i++) {
                for (Integer linkId : outputs.get(i).links()) {
                    Optional<Link> link = document.findLink(linkId);
                    if (link.isEmpty()) {
                        violations.add(
                                mismatch(
                                        node,
                                        linkId,
                                        "output " + i + " references missing link " + linkId));
                    } else if (!link.get().sourceId().equals(node.getId())
                            || link.get().sourceSlot() != i) {
                        violations.add(
                                mismatch(
                                        node,
                                        linkId,
                                        "output " + i + " references link " + linkId
                                                + " which starts at "
                                                + new SlotRef(link.get().sourceId(), link.get().sourceSlot())));
                    }
                }
            }
        }
        for (Link link : document.links()) {
            document.findNode(link.targetId())
                    .map(target -> target.input(link.targetSlot()))
                    .filter(input -> !Objects.equals(input.link(), link.id()))
                    .ifPresent(
                            input ->
                                    violations.add(
                                            new Violation(
                                                    Kind.SLOT_LINK_MISMATCH,
                                                    "Link "
                                                            + link.id()
                                                            + " is not referenced by input "
                                                            + link.targetSlot()
                                                            + " of node "
                                                            + link.targetId(),
                                                    link.targetId(),
                                                    link.id())));
            document.findNode(link.sourceId())
                    .map(source -> source.output(link.sourceSlot()))
                    .filter(output -> !output.links().contains(link.id()))
                    .ifPresent(
                            output ->
                                    violations.add(
                                            new Violation(
                                                    Kind.SLOT_LINK_MISMATCH,
                                                    "Link "
                                                            + link.id()
                                                            + " is not referenced by output "
                                                            + link.sourceSlot()
                                                            + " of node "
                                                            + link.sourceId(),
                                                    link.sourceId(),
                                                    link.id())));
        }
    }

    private static Violation mismatch(Node node, Integer linkId, String reason) {
        return new Violation(
                Kind.SLOT_LINK_MISMATCH, "Node " + node.getId() + ": " + reason, node.getId(), linkId);
    }

    private static void checkGroups(WorkflowDocument document, List<Violation> violations) {
        for (Group group : document.groups()) {
            for (NodeId nodeId : group.nodeIds()) {
                if (!document.containsNode(nodeId)) {
                    violations.add(
                            new Violation(
                                    Kind.ORPHANED_GROUP_REFERENCE,
                                    "Group '" + group.title() + "' references missing node " + nodeId,
                                    nodeId,
                                    null));
                }
            }
        }
    }
}
