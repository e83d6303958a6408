package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.nodewright.core.graph.NodeId;
import java.io.IOException;
import java.io.Serial;

/// Writes numeric node ids as JSON numbers and string ids as JSON strings.
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
class NodeIdSerializer extends StdSerializer<NodeId> {

    @Serial private static final long serialVersionUID = 3418227590214657310L;

    NodeIdSerializer() {
        super(NodeId.class);
    }

    @Override
    public void serialize(NodeId id, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (id.numeric()) {
            gen.writeNumber(id.asLong());
        } else {
            gen.writeString(id.value());
        }
    }

    /// Writes node ids used as map keys, e.g. closure depths.
    static class Key extends StdSerializer<NodeId> {

        @Serial private static final long serialVersionUID = -6202483517318875049L;

        Key() {
            super(NodeId.class);
        }

        @Override
        public void serialize(NodeId id, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            gen.writeFieldName(id.value());
        }
    }
}
