package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.nodewright.core.exception.WorkflowParseException;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a {@link WorkflowDocument} when it is embedded in a larger JSON value.
///
/// Parse failures surface as `JsonMappingException` with the
/// {@link WorkflowParseException} as cause. Top-level documents should be
/// read through {@link WorkflowJson#fromJson(String)}, which reports the
/// parse exception directly.
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
/// @see WorkflowDocumentSerializer for the inverse operation
class WorkflowDocumentDeserializer extends StdDeserializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = 2294012850183621597L;

    WorkflowDocumentDeserializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public WorkflowDocument deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return new WorkflowDocumentReader(mapper).read(root);
        } catch (WorkflowParseException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
