package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.nodewright.core.exception.WorkflowParseException;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Utility class for reading and writing workflow documents and rendering
/// analysis reports as JSON.
///
/// ### Usage
/// {@snippet :
/// // Load
/// WorkflowDocument document = WorkflowJson.read(Path.of("flow.json"));
///
/// // Save
/// WorkflowJson.write(edited, Path.of("flow_v2.json"));
///
/// // Report
/// String json = WorkflowJson.toReportJson(analyzer.trace(document, NodeId.of(3)));
/// }
///
/// @implNote Thread-safe. The shared mapper is configured once and never
/// reconfigured afterwards.
/// @see NodewrightJacksonModule for the registered type handlers
public final class WorkflowJson {

    private static final Logger logger = Logger.getLogger(WorkflowJson.class.getName());

    private static final ObjectMapper MAPPER = createMapper();

    private WorkflowJson() {}

    /// Parses a workflow document from raw text.
    ///
    /// @param json document text, not null
    /// @return parsed document, never null
    /// @throws WorkflowParseException if the text is not JSON or a record is malformed
    public static WorkflowDocument fromJson(String json) throws WorkflowParseException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException(
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return new WorkflowDocumentReader(MAPPER).read(root);
    }

    /// Reads and parses a workflow document file.
    ///
    /// @param path file to read, not null
    /// @return parsed document, never null
    /// @throws IOException if the file cannot be read
    /// @throws WorkflowParseException if the content is malformed
    public static WorkflowDocument read(Path path) throws IOException, WorkflowParseException {
        WorkflowDocument document = fromJson(Files.readString(path, StandardCharsets.UTF_8));
        logger.fine("Loaded " + path + " (" + document.nodes().size() + " nodes)");
        return document;
    }

    /// Serializes a document to pretty-printed JSON.
    ///
    /// @param document the document, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Writes a document to a file, replacing any existing content.
    ///
    /// @param document the document, not null
    /// @param path target file, not null
    /// @throws IOException if the file cannot be written
    public static void write(WorkflowDocument document, Path path) throws IOException {
        Files.writeString(path, toJson(document) + System.lineSeparator(), StandardCharsets.UTF_8);
        logger.fine("Wrote " + path + " (" + document.nodes().size() + " nodes)");
    }

    /// Renders any analysis or editing report as pretty-printed JSON.
    ///
    /// @param report a report record, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if the report cannot be serialized
    public static String toReportJson(Object report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to render report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for nodewright documents.
    ///
    /// Registers:
    /// - `NodewrightJacksonModule` for the graph types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - `FAIL_ON_EMPTY_BEANS` disabled so opaque report fields render as `{}`
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new NodewrightJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
