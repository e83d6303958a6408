package io.nodewright.core;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.nodewright.core.analysis.PatternRules;
import io.nodewright.core.analysis.PatternRules.FragmentRule;
import io.nodewright.core.edit.EditResult;
import io.nodewright.core.schema.NodeSchemaRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("NodewrightFactory")
@ExtendWith(MockitoExtension.class)
class NodewrightFactoryTest {

    @Mock private NodeSchemaRegistry mockSchemaRegistry;

    @Test
    @DisplayName("createEngine wires default components")
    void shouldWireDefaults() throws Exception {
        NodewrightEngine engine = NodewrightFactory.createEngine();

        assertThat(engine.getSchemaRegistry().contains("KSampler")).isTrue();
        assertThat(engine.getAnalyzer().path(TestWorkflows.linearChain(), id(1), id(4))).isPresent();
        assertThat(engine.getBatchInterpreter()).isNotNull();
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("uses the given schema registry for editing")
        void shouldUseCustomSchemaRegistry() throws Exception {
            when(mockSchemaRegistry.get(anyString())).thenReturn(Optional.empty());
            NodewrightEngine engine = NodewrightFactory.builder().schemaRegistry(mockSchemaRegistry).build();

            EditResult result =
                    engine.getEditor().create(TestWorkflows.linearChain(), "KSampler", null, List.of(), List.of(), Map.of());

            assertThat(engine.getSchemaRegistry()).isSameAs(mockSchemaRegistry);
            assertThat(result.document().node(id(5)).getInputs()).isEmpty();
            verify(mockSchemaRegistry, atLeastOnce()).get("KSampler");
        }

        @Test
        @DisplayName("uses the given pattern rules for summaries")
        void shouldUseCustomPatternRules() throws Exception {
            PatternRules rules =
                    PatternRules.defaults().toBuilder()
                            .family(FragmentRule.of("Checkpoint", "checkpoint"))
                            .build();
            NodewrightEngine engine = NodewrightFactory.builder().patternRules(rules).build();

            assertThat(engine.getAnalyzer().summarize(TestWorkflows.linearChain()).pattern())
                    .startsWith("Checkpoint");
        }

        @Test
        @DisplayName("passes the configuration through")
        void shouldKeepConfig() {
            GraphEngineConfig config = GraphEngineConfig.builder().copyOffset(10, 0).build();

            assertThat(NodewrightFactory.createEngine(config).getConfig()).isSameAs(config);
        }
    }
}
