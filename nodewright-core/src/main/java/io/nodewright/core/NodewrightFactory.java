package io.nodewright.core;

import io.nodewright.core.analysis.GraphAnalyzer;
import io.nodewright.core.analysis.PatternRules;
import io.nodewright.core.batch.BatchInterpreter;
import io.nodewright.core.edit.GraphEditor;
import io.nodewright.core.schema.InMemoryNodeSchemaRegistry;
import io.nodewright.core.schema.NodeSchemaRegistry;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link NodewrightEngine} instances.
///
/// ### Usage Patterns
///
/// **Defaults**:
/// {@snippet :
/// var engine = NodewrightFactory.createEngine();
/// }
///
/// **Builder with custom rules**:
/// {@snippet :
/// var engine = NodewrightFactory.builder()
///     .config(GraphEngineConfig.builder().copyOffset(80, 0).build())
///     .patternRules(PatternRules.defaults().toBuilder()
///         .family(PatternRules.FragmentRule.of("HunyuanVideo", "hunyuan"))
///         .build())
///     .build();
/// }
///
/// @implNote Utility class with only static methods. Components receive their
/// collaborators through constructors.
///
/// @see NodewrightEngine
/// @see GraphEngineConfig
public final class NodewrightFactory {

    private static final Logger logger = Logger.getLogger(NodewrightFactory.class.getName());

    private NodewrightFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine with default configuration, schemas and pattern rules.
    ///
    /// @return a fully wired engine, never null
    public static NodewrightEngine createEngine() {
        return createEngine(GraphEngineConfig.defaults());
    }

    /// Creates an engine with custom configuration and default schemas and
    /// pattern rules.
    ///
    /// @param config engine configuration, not null
    /// @return a fully wired engine, never null
    public static NodewrightEngine createEngine(GraphEngineConfig config) {
        return builder().config(config).build();
    }

    /// Creates an engine from explicit components.
    ///
    /// This is the primary factory method that other overloads delegate to.
    ///
    /// @param config engine configuration, not null
    /// @param schemaRegistry node type schemas, not null
    /// @param patternRules pattern detection rules, not null
    /// @return a fully wired engine, never null
    public static NodewrightEngine createEngine(
            GraphEngineConfig config,
            NodeSchemaRegistry schemaRegistry,
            PatternRules patternRules) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
        Objects.requireNonNull(patternRules, "patternRules must not be null");

        GraphAnalyzer analyzer = new GraphAnalyzer(config, patternRules);
        GraphEditor editor = new GraphEditor(config, schemaRegistry);
        BatchInterpreter batchInterpreter = new BatchInterpreter(editor);
        logger.fine("Engine wired with " + schemaRegistry.all().size() + " node schema(s)");
        return new NodewrightEngine(config, schemaRegistry, analyzer, editor, batchInterpreter);
    }

    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link NodewrightEngine} instances.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private GraphEngineConfig config = GraphEngineConfig.defaults();
        private NodeSchemaRegistry schemaRegistry;
        private PatternRules patternRules = PatternRules.defaults();

        /// Sets the engine configuration.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(GraphEngineConfig config) {
            this.config = config;
            return this;
        }

        /// Sets a custom schema registry.
        ///
        /// @param schemaRegistry the registry, may be null for the default schemas
        /// @return this builder for chaining, never null
        public Builder schemaRegistry(NodeSchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        /// Sets the pattern detection rules.
        ///
        /// @param patternRules the rules, not null
        /// @return this builder for chaining, never null
        public Builder patternRules(PatternRules patternRules) {
            this.patternRules = patternRules;
            return this;
        }

        /// Wires the engine.
        ///
        /// @return a fully wired engine, never null
        public NodewrightEngine build() {
            NodeSchemaRegistry registry =
                    schemaRegistry != null
                            ? schemaRegistry
                            : InMemoryNodeSchemaRegistry.withDefaults();
            return createEngine(config, registry, patternRules);
        }
    }
}
