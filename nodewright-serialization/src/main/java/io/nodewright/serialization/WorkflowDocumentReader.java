package io.nodewright.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nodewright.core.exception.WorkflowParseException;
import io.nodewright.core.graph.Group;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Builds a {@link WorkflowDocument} from a parsed JSON tree.
///
/// Node and link records are read positionally so that failures can be
/// reported with the index of the offending record. Fields the graph model
/// does not interpret are kept as attributes on the owning record.
///
/// Links are accepted in both serialized forms:
/// - the 6-tuple `[id, sourceId, sourceSlot, targetId, targetSlot, type]`
/// - an object with `id`, `origin_id`, `origin_slot`, `target_id`, `target_slot`, `type`
///
/// The reader does not validate references between records. Dangling links
/// and duplicate ids load fine and are reported by verification instead.
///
/// @implNote Package-private. Used by {@link WorkflowJson} and {@link WorkflowDocumentDeserializer}.
final class WorkflowDocumentReader {

    private static final Logger logger = Logger.getLogger(WorkflowDocumentReader.class.getName());

    private static final Set<String> DOCUMENT_FIELDS =
            Set.of("nodes", "links", "groups", "last_node_id", "last_link_id");
    private static final Set<String> NODE_FIELDS =
            Set.of("id", "type", "title", "inputs", "outputs", "widgets_values");
    private static final Set<String> INPUT_FIELDS = Set.of("name", "type", "link");
    private static final Set<String> OUTPUT_FIELDS = Set.of("name", "type", "links");
    private static final Set<String> GROUP_FIELDS = Set.of("title", "bounding", "nodes");

    private final ObjectMapper mapper;

    WorkflowDocumentReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    WorkflowDocument read(JsonNode root) throws WorkflowParseException {
        if (root == null || !root.isObject()) {
            throw new WorkflowParseException("Workflow document must be a JSON object");
        }
        JsonNode nodesNode = root.get("nodes");
        if (nodesNode == null || !nodesNode.isArray()) {
            if (looksLikeApiPrompt(root)) {
                throw new WorkflowParseException(
                        "API-format prompts are not supported; export the workflow with its graph layout");
            }
            throw new WorkflowParseException("Workflow document has no 'nodes' array");
        }

        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < nodesNode.size(); i++) {
            nodes.add(readNode(i, nodesNode.get(i)));
        }

        List<Link> links = new ArrayList<>();
        JsonNode linksNode = root.get("links");
        if (linksNode != null && !linksNode.isNull()) {
            if (!linksNode.isArray()) {
                throw new WorkflowParseException("'links' must be an array");
            }
            for (int i = 0; i < linksNode.size(); i++) {
                links.add(readLink(i, linksNode.get(i)));
            }
        }

        List<Group> groups = new ArrayList<>();
        JsonNode groupsNode = root.get("groups");
        if (groupsNode != null && groupsNode.isArray()) {
            for (JsonNode group : groupsNode) {
                groups.add(readGroup(group));
            }
        }

        WorkflowDocument document =
                WorkflowDocument.of(
                        nodes,
                        links,
                        groups,
                        remaining(root, DOCUMENT_FIELDS),
                        root.path("last_node_id").asLong(0),
                        root.path("last_link_id").asInt(0));
        logger.fine(
                "Parsed workflow document: " + nodes.size() + " nodes, " + links.size() + " links");
        return document;
    }

    private Node readNode(int index, JsonNode record) throws WorkflowParseException {
        if (record == null || !record.isObject()) {
            throw WorkflowParseException.atNode(index, "expected an object");
        }
        NodeId id = readId(record.get("id"));
        if (id == null) {
            throw WorkflowParseException.atNode(index, "missing or invalid 'id'");
        }
        JsonNode type = record.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw WorkflowParseException.atNode(index, "node " + id + " has no 'type'");
        }

        Node.Builder builder =
                Node.builder()
                        .id(id)
                        .type(type.asText())
                        .title(record.hasNonNull("title") ? record.get("title").asText() : null)
                        .widgets(readWidgets(index, record.get("widgets_values")))
                        .attributes(remaining(record, NODE_FIELDS));

        JsonNode inputs = record.get("inputs");
        if (inputs != null && !inputs.isNull()) {
            if (!inputs.isArray()) {
                throw WorkflowParseException.atNode(index, "'inputs' must be an array");
            }
            for (int slot = 0; slot < inputs.size(); slot++) {
                builder.input(readInput(index, slot, inputs.get(slot)));
            }
        }
        JsonNode outputs = record.get("outputs");
        if (outputs != null && !outputs.isNull()) {
            if (!outputs.isArray()) {
                throw WorkflowParseException.atNode(index, "'outputs' must be an array");
            }
            for (int slot = 0; slot < outputs.size(); slot++) {
                builder.output(readOutput(index, slot, outputs.get(slot)));
            }
        }
        return builder.build();
    }

    private InputSlot readInput(int index, int slot, JsonNode record) throws WorkflowParseException {
        if (record == null || !record.isObject() || !record.hasNonNull("name")) {
            throw WorkflowParseException.atNode(index, "input " + slot + " has no name");
        }
        JsonNode link = record.get("link");
        Integer linkId = null;
        if (link != null && !link.isNull()) {
            if (!link.canConvertToInt()) {
                throw WorkflowParseException.atNode(
                        index, "input " + slot + " has a non-integer link '" + link + "'");
            }
            linkId = link.asInt();
        }
        return new InputSlot(
                record.get("name").asText(),
                typeTag(record.get("type")),
                linkId,
                remaining(record, INPUT_FIELDS));
    }

    private OutputSlot readOutput(int index, int slot, JsonNode record)
            throws WorkflowParseException {
        if (record == null || !record.isObject() || !record.hasNonNull("name")) {
            throw WorkflowParseException.atNode(index, "output " + slot + " has no name");
        }
        List<Integer> linkIds = new ArrayList<>();
        JsonNode links = record.get("links");
        if (links != null && links.isArray()) {
            for (JsonNode link : links) {
                if (!link.canConvertToInt()) {
                    throw WorkflowParseException.atNode(
                            index, "output " + slot + " has a non-integer link '" + link + "'");
                }
                linkIds.add(link.asInt());
            }
        }
        return new OutputSlot(
                record.get("name").asText(),
                typeTag(record.get("type")),
                linkIds,
                remaining(record, OUTPUT_FIELDS));
    }

    private WidgetValues readWidgets(int index, JsonNode values) throws WorkflowParseException {
        if (values == null) {
            return WidgetValues.absent();
        }
        if (values.isArray()) {
            return WidgetValues.positional(mapper.convertValue(values, List.class));
        }
        if (values.isObject()) {
            return WidgetValues.keyed(toMap(values));
        }
        if (values.isNull()) {
            return WidgetValues.positional(List.of());
        }
        throw WorkflowParseException.atNode(index, "'widgets_values' must be an array or object");
    }

    private Link readLink(int index, JsonNode record) throws WorkflowParseException {
        if (record != null && record.isArray()) {
            if (record.size() < 6) {
                throw WorkflowParseException.atLink(
                        index,
                        "expected [id, sourceId, sourceSlot, targetId, targetSlot, type], got "
                                + record);
            }
            return link(
                    index,
                    record.get(0),
                    record.get(1),
                    record.get(2),
                    record.get(3),
                    record.get(4),
                    record.get(5));
        }
        if (record != null && record.isObject()) {
            return link(
                    index,
                    record.get("id"),
                    record.get("origin_id"),
                    record.get("origin_slot"),
                    record.get("target_id"),
                    record.get("target_slot"),
                    record.get("type"));
        }
        throw WorkflowParseException.atLink(index, "expected an array or object");
    }

    private Link link(
            int index,
            JsonNode id,
            JsonNode source,
            JsonNode sourceSlot,
            JsonNode target,
            JsonNode targetSlot,
            JsonNode type)
            throws WorkflowParseException {
        if (id == null || !id.canConvertToInt()) {
            throw WorkflowParseException.atLink(index, "missing or invalid link id");
        }
        NodeId sourceId = readId(source);
        NodeId targetId = readId(target);
        if (sourceId == null || targetId == null) {
            throw WorkflowParseException.atLink(index, "missing or invalid endpoint node id");
        }
        if (sourceSlot == null
                || !sourceSlot.canConvertToInt()
                || targetSlot == null
                || !targetSlot.canConvertToInt()) {
            throw WorkflowParseException.atLink(index, "slot indexes must be integers");
        }
        return new Link(
                id.asInt(), sourceId, sourceSlot.asInt(), targetId, targetSlot.asInt(), typeTag(type));
    }

    private Group readGroup(JsonNode record) {
        List<Double> bounding = new ArrayList<>();
        record.path("bounding").forEach(value -> bounding.add(value.asDouble()));
        List<NodeId> nodeIds = new ArrayList<>();
        for (JsonNode member : record.path("nodes")) {
            NodeId id = readId(member);
            if (id != null) {
                nodeIds.add(id);
            }
        }
        return new Group(
                record.path("title").asText(""), bounding, nodeIds, remaining(record, GROUP_FIELDS));
    }

    /// Numbers become numeric ids; strings are kept verbatim as string ids.
    static NodeId readId(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return NodeId.of(value.asLong());
        }
        if (value.isTextual() && !value.asText().isBlank()) {
            return NodeId.ofString(value.asText());
        }
        return null;
    }

    private static String typeTag(JsonNode type) {
        if (type == null || type.isNull()) {
            return "*";
        }
        if (type.isTextual()) {
            return type.asText();
        }
        // some extension packs write the wildcard as 0
        return type.isNumber() ? "*" : type.toString();
    }

    private Map<String, Object> remaining(JsonNode record, Set<String> modelled) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!modelled.contains(field.getKey())) {
                attributes.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }
        return attributes;
    }

    private Map<String, Object> toMap(JsonNode object) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
        }
        return values;
    }

    private static boolean looksLikeApiPrompt(JsonNode root) {
        Iterator<JsonNode> values = root.elements();
        return values.hasNext() && values.next().has("class_type");
    }
}
