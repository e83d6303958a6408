package io.nodewright.core.variable;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;

import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.TestWorkflows;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VariableResolver")
class VariableResolverTest {

    private VariableResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new VariableResolver(GraphEngineConfig.defaults());
    }

    @Nested
    @DisplayName("store/fetch pairs")
    class Pairs {

        @Test
        @DisplayName("binds fetches to the store's real source")
        void shouldResolveFetchToSource() throws Exception {
            VariableBindings bindings = resolver.resolve(TestWorkflows.storeFetchPair());

            assertThat(bindings.bindings()).hasSize(1);
            VariableBinding binding = bindings.bindings().get(0);
            assertThat(binding.key()).isEqualTo("m");
            assertThat(binding.storeId()).isEqualTo(id(2));
            assertThat(binding.fetchIds()).containsExactly(id(3));
            assertThat(bindings.resolve(id(3), 0)).contains(new SlotRef(id(1), 0));
            assertThat(bindings.warnings()).isEmpty();
        }

        @Test
        @DisplayName("follows a fetch feeding another store")
        void shouldFollowChains() throws Exception {
            WorkflowDocument doc = WorkflowDocument.empty();
            doc.addNode(TestWorkflows.loader(1));
            doc.addNode(TestWorkflows.store(2, "a"));
            doc.addNode(TestWorkflows.fetch(3, "a"));
            doc.addNode(TestWorkflows.store(4, "b"));
            doc.addNode(TestWorkflows.fetch(5, "b"));
            doc.addNode(TestWorkflows.sampler(6));
            doc.addLink(id(1), 0, id(2), 0);
            doc.addLink(id(3), 0, id(4), 0);
            doc.addLink(id(5), 0, id(6), 0);

            VariableBindings bindings = resolver.resolve(doc);

            assertThat(bindings.resolve(id(5), 0)).contains(new SlotRef(id(1), 0));
            assertThat(bindings.bindingOf(id(5)).map(VariableBinding::key)).contains("b");
        }

        @Test
        @DisplayName("first store wins a duplicate key and the clash is reported")
        void shouldKeepFirstStoreOnDuplicateKey() throws Exception {
            WorkflowDocument doc = TestWorkflows.storeFetchPair();
            doc.addNode(TestWorkflows.store(5, "m"));

            VariableBindings bindings = resolver.resolve(doc);

            assertThat(bindings.bindings()).singleElement().extracting(VariableBinding::storeId).isEqualTo(id(2));
            assertThat(bindings.warnings()).anyMatch(w -> w.contains("Duplicate store key 'm'"));
        }

        @Test
        @DisplayName("leaves fetches without a store unresolved")
        void shouldReportMissingStore() throws Exception {
            WorkflowDocument doc = WorkflowDocument.empty();
            doc.addNode(TestWorkflows.fetch(1, "ghost"));

            VariableBindings bindings = resolver.resolve(doc);

            assertThat(bindings.resolve(id(1), 0)).isEmpty();
            assertThat(bindings.warnings()).anyMatch(w -> w.contains("no store for key 'ghost'"));
        }

        @Test
        @DisplayName("takes the key from the title when widgets are empty")
        void shouldFallBackToTitle() {
            var node =
                    TestWorkflows.node(1, "GetNode")
                            .title("Get_vae")
                            .widgets(WidgetValues.positional(List.of("")))
                            .build();

            assertThat(resolver.fetchKey(node)).isEqualTo("vae");
        }
    }

    @Nested
    @DisplayName("loops")
    class Loops {

        @Test
        @DisplayName("detects body and a constant iteration count")
        void shouldDetectLoopWithConstantCount() throws Exception {
            WorkflowDocument doc = loopWorkflow(true);

            VariableBindings bindings = resolver.resolve(doc);

            assertThat(bindings.loops()).hasSize(1);
            LoopConstruct loop = bindings.loops().get(0);
            assertThat(loop.startId()).isEqualTo(id(10));
            assertThat(loop.endId()).isEqualTo(id(13));
            assertThat(loop.iterations()).isEqualTo(5);
            assertThat(loop.iterationSource()).isEqualTo("constant");
            assertThat(loop.body()).containsExactly(id(12));
        }

        @Test
        @DisplayName("reads the count from the start node's own widget")
        void shouldReadOwnWidget() throws Exception {
            WorkflowDocument doc = loopWorkflow(false);

            LoopConstruct loop = resolver.resolve(doc).loops().get(0);

            assertThat(loop.iterations()).isEqualTo(3);
            assertThat(loop.iterationSource()).isEqualTo("widget");
        }

        private WorkflowDocument loopWorkflow(boolean constantFeeder) throws Exception {
            WorkflowDocument doc = WorkflowDocument.empty();
            doc.addNode(
                    TestWorkflows.node(10, "easy forLoopStart")
                            .input(InputSlot.unconnected("initial_value1", "*"))
                            .input(InputSlot.unconnected("total", "INT"))
                            .output(OutputSlot.unconnected("flow", "FLOW_CONTROL"))
                            .output(OutputSlot.unconnected("index", "INT"))
                            .output(OutputSlot.unconnected("value1", "*"))
                            .widgets(WidgetValues.positional(List.of(3)))
                            .build());
            doc.addNode(
                    TestWorkflows.node(11, "PrimitiveNode")
                            .output(OutputSlot.unconnected("INT", "INT"))
                            .widgets(WidgetValues.positional(List.of(5, "fixed")))
                            .build());
            doc.addNode(
                    TestWorkflows.node(12, "ImageScale")
                            .input(InputSlot.unconnected("image", "*"))
                            .output(OutputSlot.unconnected("IMAGE", "IMAGE"))
                            .build());
            doc.addNode(
                    TestWorkflows.node(13, "easy forLoopEnd")
                            .input(InputSlot.unconnected("flow", "FLOW_CONTROL"))
                            .input(InputSlot.unconnected("initial_value1", "*"))
                            .output(OutputSlot.unconnected("value1", "*"))
                            .build());
            if (constantFeeder) {
                doc.addLink(id(11), 0, id(10), 1);
            }
            doc.addLink(id(10), 2, id(12), 0);
            doc.addLink(id(10), 0, id(13), 0);
            doc.addLink(id(12), 0, id(13), 1);
            return doc;
        }
    }
}
