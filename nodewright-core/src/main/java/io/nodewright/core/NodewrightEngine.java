package io.nodewright.core;

import io.nodewright.core.analysis.GraphAnalyzer;
import io.nodewright.core.batch.BatchInterpreter;
import io.nodewright.core.edit.GraphEditor;
import io.nodewright.core.schema.NodeSchemaRegistry;

/// Container holding the wired Nodewright components.
///
/// The engine keeps no per-document state. Each operation takes the document
/// it works on and returns its result, so one engine can serve any number of
/// documents.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Postcondition**: All getters return the same instances passed to constructor
///
/// @apiNote Create instances via {@link NodewrightFactory#createEngine()} or
/// {@link NodewrightFactory.Builder} rather than direct construction.
///
/// @see NodewrightFactory
public final class NodewrightEngine {

    private final GraphEngineConfig config;
    private final NodeSchemaRegistry schemaRegistry;
    private final GraphAnalyzer analyzer;
    private final GraphEditor editor;
    private final BatchInterpreter batchInterpreter;

    /// Creates an engine from already wired components.
    ///
    /// @param config engine configuration, not null
    /// @param schemaRegistry node type schemas, not null
    /// @param analyzer read-only analysis operations, not null
    /// @param editor mutating operations, not null
    /// @param batchInterpreter script runner built on `editor`, not null
    public NodewrightEngine(
            GraphEngineConfig config,
            NodeSchemaRegistry schemaRegistry,
            GraphAnalyzer analyzer,
            GraphEditor editor,
            BatchInterpreter batchInterpreter) {
        this.config = config;
        this.schemaRegistry = schemaRegistry;
        this.analyzer = analyzer;
        this.editor = editor;
        this.batchInterpreter = batchInterpreter;
    }

    /// @return the configuration the components were built with, never null
    public GraphEngineConfig getConfig() {
        return config;
    }

    /// Returns the registry consulted for slot names and widget defaults.
    ///
    /// @return the schema registry, never null
    public NodeSchemaRegistry getSchemaRegistry() {
        return schemaRegistry;
    }

    /// @return the analysis operations, never null
    public GraphAnalyzer getAnalyzer() {
        return analyzer;
    }

    /// @return the editing operations, never null
    public GraphEditor getEditor() {
        return editor;
    }

    /// @return the batch script runner, never null
    public BatchInterpreter getBatchInterpreter() {
        return batchInterpreter;
    }
}
