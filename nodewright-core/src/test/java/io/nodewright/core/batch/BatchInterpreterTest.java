package io.nodewright.core.batch;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.TestWorkflows;
import io.nodewright.core.edit.GraphEditor;
import io.nodewright.core.exception.BatchScriptException;
import io.nodewright.core.exception.NodeNotFoundException;
import io.nodewright.core.exception.SlotException;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.schema.InMemoryNodeSchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BatchInterpreter")
class BatchInterpreterTest {

    private BatchInterpreter interpreter;
    private WorkflowDocument chain;

    @BeforeEach
    void setUp() throws Exception {
        interpreter =
                new BatchInterpreter(
                        new GraphEditor(
                                GraphEngineConfig.defaults(), InMemoryNodeSchemaRegistry.withDefaults()));
        chain = TestWorkflows.linearChain();
    }

    @Nested
    @DisplayName("successful scripts")
    class Success {

        @Test
        @DisplayName("binds created nodes and uses them in later lines")
        void shouldBindAndReuseNames() throws Exception {
            String script =
                    String.join(
                            "\n",
                            "# second save branch",
                            "copy 4 as $save2 filename_prefix=\"branch\"",
                            "wire 3:IMAGE -> $save2:images",
                            "set 2 steps=35 cfg=6.5");

            BatchResult result = interpreter.run(chain, script, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.linesExecuted()).isEqualTo(3);
            assertThat(result.bindings()).containsEntry("save2", id(5));
            WorkflowDocument doc = result.document();
            assertThat(doc.node(id(5)).getWidgets().get(0)).isEqualTo("branch");
            assertThat(doc.incomingLink(id(5), 0).map(Link::sourceId)).contains(id(3));
            assertThat(doc.node(id(2)).getWidgets().get(2)).isEqualTo(35);
            assertThat(result.details()).hasSize(3);
        }

        @Test
        @DisplayName("cascade delete spares nodes fed by a surviving source")
        void shouldCreateFindAndDelete() throws Exception {
            String script =
                    String.join(
                            "\n",
                            "create UpscaleModelLoader as $up",
                            "create ImageUpscaleWithModel as $scale",
                            "wire $up:0 → $scale:upscale_model",
                            "find decode as $dec",
                            "wire $dec:0 -> $scale:image",
                            "delete 2 --cascade");

            BatchResult result = interpreter.run(chain, script, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.bindings()).containsEntry("dec", id(3));
            assertThat(result.document().nodes())
                    .extracting(Node::getType)
                    .containsExactly(
                            "CheckpointLoaderSimple", "UpscaleModelLoader", "ImageUpscaleWithModel");
        }

        @Test
        @DisplayName("dry run reports effects but returns the input document")
        void shouldNotKeepDryRunEffects() throws Exception {
            BatchResult result = interpreter.run(chain, "delete 4\ninline", true);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.dryRun()).isTrue();
            assertThat(result.document()).isSameAs(chain);
            assertThat(result.edits()).hasSize(2);
            assertThat(chain.nodes()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("failing scripts")
    class Failure {

        @Test
        @DisplayName("stops at the failing line and keeps earlier effects")
        void shouldKeepEarlierLines() throws Exception {
            BatchResult result = interpreter.run(chain, "delete 4\ncopy 99\nset 2 steps=1", false);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.linesExecuted()).isEqualTo(1);
            assertThat(result.failure()).hasValueSatisfying(failure -> {
                assertThat(failure.lineNumber()).isEqualTo(2);
                assertThat(failure.cause()).isInstanceOf(NodeNotFoundException.class);
            });
            assertThat(result.document().nodes()).hasSize(3);
            assertThat(result.document().node(id(2)).getWidgets().get(2)).isEqualTo(20);
        }

        @Test
        @DisplayName("an oversized slot index fails its line instead of escaping")
        void shouldReportOversizedSlotIndex() throws Exception {
            BatchResult result =
                    interpreter.run(chain, "set 1 0=\"x\"\nwire 1:99999999999 -> 2:0", false);

            assertThat(result.linesExecuted()).isEqualTo(1);
            assertThat(result.failure()).hasValueSatisfying(failure -> {
                assertThat(failure.lineNumber()).isEqualTo(2);
                assertThat(failure.cause()).isInstanceOf(SlotException.class);
                assertThat(failure.message()).contains("99999999999", "out of range");
            });
            assertThat(result.document().node(id(1)).getWidgets().get(0)).isEqualTo("x");
        }

        @Test
        @DisplayName("unexpected runtime errors are captured with their line")
        void shouldCaptureRuntimeErrors() throws Exception {
            GraphEditor editor = mock(GraphEditor.class);
            when(editor.disconnect(any(), any()))
                    .thenThrow(new IllegalStateException("index corrupted"));

            BatchResult result = new BatchInterpreter(editor).run(chain, "\ndisconnect 2", false);

            assertThat(result.failure()).hasValueSatisfying(failure -> {
                assertThat(failure.lineNumber()).isEqualTo(2);
                assertThat(failure.cause()).isInstanceOf(BatchScriptException.class);
                assertThat(failure.cause()).hasRootCauseInstanceOf(IllegalStateException.class);
                assertThat(failure.message()).contains("index corrupted");
            });
        }

        @Test
        @DisplayName("undefined bindings are script errors")
        void shouldRejectUndefinedBinding() throws Exception {
            BatchResult result = interpreter.run(chain, "wire $ghost:0 -> 2:0", false);

            assertThat(result.failure()).hasValueSatisfying(failure -> {
                assertThat(failure.cause()).isInstanceOf(BatchScriptException.class);
                assertThat(failure.message()).contains("undefined variable '$ghost'");
            });
            assertThat(result.document()).isSameAs(chain);
        }

        @Test
        @DisplayName("unknown operations and malformed wires are script errors")
        void shouldRejectMalformedLines() throws Exception {
            assertThat(interpreter.run(chain, "explode 3", false).failure())
                    .hasValueSatisfying(f -> assertThat(f.message()).contains("unknown operation"));
            assertThat(interpreter.run(chain, "wire 1 -> 2", false).failure())
                    .hasValueSatisfying(f -> assertThat(f.message()).contains("invalid wire endpoint"));
        }
    }
}
