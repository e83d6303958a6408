package io.nodewright.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all nodewright serialization in one place.
///
/// - `WorkflowDocument`: `WorkflowDocumentSerializer` / `WorkflowDocumentDeserializer`
/// - `Node`: `NodeSerializer`, the document record form
/// - `NodeId`: numbers or strings, also as map keys
/// - `WidgetValues`: array or object, as loaded
///
/// Analysis and editing reports are records and need no registration; the
/// handlers above cover the graph types they contain.
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see WorkflowJson for the convenience factory API
public class NodewrightJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 6349021187537205415L;

    public NodewrightJacksonModule() {
        super("NodewrightJacksonModule");

        addSerializer(WorkflowDocument.class, new WorkflowDocumentSerializer());
        addDeserializer(WorkflowDocument.class, new WorkflowDocumentDeserializer());

        addSerializer(Node.class, new NodeSerializer());

        addSerializer(NodeId.class, new NodeIdSerializer());
        addKeySerializer(NodeId.class, new NodeIdSerializer.Key());
        addDeserializer(NodeId.class, new NodeIdDeserializer());

        addSerializer(WidgetValues.class, new WidgetValuesSerializer());
    }
}
