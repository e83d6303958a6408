package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.nodewright.core.graph.Group;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a {@link WorkflowDocument} to the authoring tool's document format.
///
/// Counters come first, then `nodes`, `links` as 6-tuples, `groups`, and
/// finally every top-level field the document was loaded with (`config`,
/// `extra`, `version`, ...).
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
/// @see WorkflowDocumentDeserializer for the inverse operation
class WorkflowDocumentSerializer extends StdSerializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = -4584012659447260938L;

    WorkflowDocumentSerializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public void serialize(WorkflowDocument document, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("last_node_id", document.lastNodeId());
        gen.writeNumberField("last_link_id", document.lastLinkId());

        gen.writeArrayFieldStart("nodes");
        for (Node node : document.nodes()) {
            provider.defaultSerializeValue(node, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("links");
        for (Link link : document.links()) {
            gen.writeStartArray();
            gen.writeNumber(link.id());
            provider.defaultSerializeValue(link.sourceId(), gen);
            gen.writeNumber(link.sourceSlot());
            provider.defaultSerializeValue(link.targetId(), gen);
            gen.writeNumber(link.targetSlot());
            gen.writeString(link.type());
            gen.writeEndArray();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("groups");
        for (Group group : document.groups()) {
            writeGroup(group, gen, provider);
        }
        gen.writeEndArray();

        for (Map.Entry<String, Object> entry : document.attributes().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeGroup(Group group, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("title", group.title());
        gen.writeArrayFieldStart("bounding");
        for (Double value : group.bounding()) {
            // integral coordinates are written back without a fraction
            if (value == Math.rint(value) && !value.isInfinite()) {
                gen.writeNumber(value.longValue());
            } else {
                gen.writeNumber(value);
            }
        }
        gen.writeEndArray();
        if (!group.nodeIds().isEmpty()) {
            provider.defaultSerializeField("nodes", group.nodeIds(), gen);
        }
        for (Map.Entry<String, Object> entry : group.attributes().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
