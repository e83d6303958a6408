package io.nodewright.core.schema;

import java.util.List;
import java.util.Optional;

/// Capability lookup from node type name to its declared schema.
///
/// The engine never branches on specific type names to find slots or widgets;
/// it asks the registry. Types missing from the registry fall back to the
/// slots present on the node itself.
///
/// @see InMemoryNodeSchemaRegistry for the default implementation
public interface NodeSchemaRegistry {

    /// Registers a schema, replacing any schema with the same type name.
    ///
    /// @param schema the schema, not null
    void register(NodeSchema schema);

    /// Looks up the schema for a type name.
    ///
    /// @param typeName declared type name, not null
    /// @return the schema if registered, empty otherwise
    Optional<NodeSchema> get(String typeName);

    /// @return all registered schemas, never null
    List<NodeSchema> all();

    /// @return true if a schema is registered for `typeName`
    default boolean contains(String typeName) {
        return get(typeName).isPresent();
    }
}
