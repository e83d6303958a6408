package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.WidgetValues;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;
import java.util.Set;

/// Serializes a {@link Node} to its workflow document record.
///
/// ```
/// Field            Source
/// ─────────────────+──────────────────────────────────────────
/// id, type, title  │ node identity (title omitted when null)
/// pos, size, ...   │ attributes, in load order
/// inputs           │ name, type, link, slot attributes
/// outputs          │ name, type, links, slot attributes
/// properties, ...  │ trailing attributes (properties, colours)
/// widgets_values   │ widget values, omitted when absent
/// ```
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 5520961817335474109L;

    private static final Set<String> TRAILING = Set.of("properties", "color", "bgcolor", "shape");

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("id", node.getId(), gen);
        gen.writeStringField("type", node.getType());
        if (node.getTitle() != null) {
            gen.writeStringField("title", node.getTitle());
        }
        writeAttributes(node.getAttributes(), false, gen, provider);

        gen.writeArrayFieldStart("inputs");
        for (InputSlot input : node.getInputs()) {
            gen.writeStartObject();
            gen.writeStringField("name", input.name());
            gen.writeStringField("type", input.type());
            if (input.link() != null) {
                gen.writeNumberField("link", input.link());
            } else {
                gen.writeNullField("link");
            }
            writeAttributes(input.attributes(), null, gen, provider);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("outputs");
        for (OutputSlot output : node.getOutputs()) {
            gen.writeStartObject();
            gen.writeStringField("name", output.name());
            gen.writeStringField("type", output.type());
            provider.defaultSerializeField("links", output.links(), gen);
            writeAttributes(output.attributes(), null, gen, provider);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        writeAttributes(node.getAttributes(), true, gen, provider);
        if (node.getWidgets().layout() != WidgetValues.Layout.ABSENT) {
            provider.defaultSerializeField("widgets_values", node.getWidgets(), gen);
        }
        gen.writeEndObject();
    }

    /// Writes attributes; `trailing` selects the leading or trailing subset, null writes all.
    private static void writeAttributes(
            Map<String, Object> attributes,
            Boolean trailing,
            JsonGenerator gen,
            SerializerProvider provider)
            throws IOException {
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            if (trailing == null || TRAILING.contains(entry.getKey()) == trailing) {
                provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
            }
        }
    }
}
