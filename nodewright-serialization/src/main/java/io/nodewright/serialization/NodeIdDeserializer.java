package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.nodewright.core.graph.NodeId;
import java.io.IOException;
import java.io.Serial;

/// Reads a node id from a JSON number or string.
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
/// @see NodeIdSerializer for the inverse operation
class NodeIdDeserializer extends StdDeserializer<NodeId> {

    @Serial private static final long serialVersionUID = 7051370682740046224L;

    NodeIdDeserializer() {
        super(NodeId.class);
    }

    @Override
    public NodeId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode value = p.readValueAsTree();
        NodeId id = WorkflowDocumentReader.readId(value);
        if (id == null) {
            return (NodeId) ctxt.handleUnexpectedToken(NodeId.class, p);
        }
        return id;
    }
}
