package io.nodewright.core.analysis;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nodewright.core.TestWorkflows;
import io.nodewright.core.analysis.TraceReport.InputTrace;
import io.nodewright.core.exception.NodeNotFoundException;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraphAnalyzer")
class GraphAnalyzerTest {

    private GraphAnalyzer analyzer;
    private WorkflowDocument chain;

    @BeforeEach
    void setUp() throws Exception {
        analyzer = new GraphAnalyzer();
        chain = TestWorkflows.linearChain();
    }

    @Nested
    @DisplayName("trace")
    class Trace {

        @Test
        @DisplayName("reports the producer and consumer of a middle node")
        void shouldTraceBothSides() throws Exception {
            TraceReport report = analyzer.trace(chain, id(2));

            InputTrace model = report.inputs().get(0);
            assertThat(model.source()).isEqualTo(new SlotRef(id(1), 0));
            assertThat(model.sourceType()).isEqualTo("CheckpointLoaderSimple");
            assertThat(model.via()).isNull();
            assertThat(report.inputs().subList(1, 4)).noneMatch(InputTrace::isConnected);
            assertThat(report.outputs().get(0).targets()).containsExactly(new SlotRef(id(3), 0));
        }

        @Test
        @DisplayName("reports the real producer behind a fetch node")
        void shouldSeeThroughVariables() throws Exception {
            TraceReport report = analyzer.trace(TestWorkflows.storeFetchPair(), id(4));

            InputTrace model = report.inputs().get(0);
            assertThat(model.source()).isEqualTo(new SlotRef(id(1), 0));
            assertThat(model.via()).isEqualTo(new SlotRef(id(3), 0));
            assertThat(model.variableKey()).isEqualTo("m");
        }

        @Test
        @DisplayName("throws NodeNotFoundException for unknown ids")
        void shouldRejectUnknownNode() {
            assertThatThrownBy(() -> analyzer.trace(chain, id(99)))
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("closures")
    class Closures {

        @Test
        @DisplayName("upstream lists nodes in breadth-first depth order")
        void shouldListUpstreamByDepth() throws Exception {
            Closure closure = analyzer.upstream(chain, id(4));

            assertThat(closure.nodes()).containsExactly(id(3), id(2), id(1));
            assertThat(closure.depthOf(id(1))).isEqualTo(3);
            assertThat(closure.edges()).hasSize(3);
        }

        @Test
        @DisplayName("downstream respects the depth bound")
        void shouldStopAtMaxDepth() throws Exception {
            assertThat(analyzer.downstream(chain, id(1), 2, null).nodes())
                    .containsExactly(id(2), id(3));
            assertThat(analyzer.downstream(chain, id(1), 0, null).nodes()).isEmpty();
        }

        @Test
        @DisplayName("input filter restricts the first hop")
        void shouldFilterBySlot() throws Exception {
            assertThat(analyzer.upstream(chain, id(2), GraphAnalyzer.UNBOUNDED, "model").nodes())
                    .containsExactly(id(1));
            assertThat(analyzer.upstream(chain, id(2), GraphAnalyzer.UNBOUNDED, "latent").nodes())
                    .isEmpty();
        }

        @Test
        @DisplayName("crosses variable indirection through the fetch node")
        void shouldFollowVirtualEdges() throws Exception {
            WorkflowDocument doc = TestWorkflows.storeFetchPair();

            assertThat(analyzer.upstream(doc, id(4)).nodes()).containsExactly(id(3), id(1));
            assertThat(analyzer.downstream(doc, id(1)).nodes()).contains(id(3), id(4));
        }

        @Test
        @DisplayName("upstream and downstream are inverse relations")
        void shouldBeInverse() throws Exception {
            for (WorkflowDocument doc : List.of(chain, TestWorkflows.storeFetchPair())) {
                for (Node n : doc.nodes()) {
                    for (Node m : doc.nodes()) {
                        boolean up = analyzer.upstream(doc, n.getId()).contains(m.getId());
                        boolean down = analyzer.downstream(doc, m.getId()).contains(n.getId());
                        assertThat(up).as("%s upstream of %s", m.getId(), n.getId()).isEqualTo(down);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("path and subgraph")
    class Paths {

        @Test
        @DisplayName("finds the shortest path")
        void shouldFindPath() throws Exception {
            assertThat(analyzer.path(chain, id(1), id(4)))
                    .contains(List.of(id(1), id(2), id(3), id(4)));
        }

        @Test
        @DisplayName("path length matches the downstream depth")
        void shouldMatchDownstreamDepth() throws Exception {
            Optional<List<NodeId>> path = analyzer.path(chain, id(2), id(4));

            assertThat(path).isPresent();
            assertThat(path.get()).hasSize(analyzer.downstream(chain, id(2)).depthOf(id(4)) + 1);
        }

        @Test
        @DisplayName("returns empty against edge direction")
        void shouldReturnEmptyWhenUnreachable() throws Exception {
            assertThat(analyzer.path(chain, id(4), id(1))).isEmpty();
            assertThat(analyzer.path(chain, id(3), id(3))).contains(List.of(id(3)));
        }

        @Test
        @DisplayName("subgraph keeps nodes between both ends in topological order")
        void shouldExtractSubgraph() throws Exception {
            Subgraph subgraph = analyzer.subgraph(chain, id(2), id(4));

            assertThat(subgraph.nodes()).containsExactly(id(2), id(3), id(4));
            assertThat(subgraph.edges()).hasSize(2);
            assertThat(analyzer.subgraph(chain, id(4), id(1)).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("classifies roles by type name")
        void shouldClassifyRoles() {
            assertThat(analyzer.roles(chain, List.of(id(1), id(2), id(3), id(4))))
                    .containsEntry(id(1), NodeRole.MODEL_LOADING)
                    .containsEntry(id(2), NodeRole.SAMPLING)
                    .containsEntry(id(3), NodeRole.DECODING)
                    .containsEntry(id(4), NodeRole.OUTPUT);
        }
    }

    @Nested
    @DisplayName("on a cyclic graph")
    class Cycles {

        private WorkflowDocument cyclic;

        @BeforeEach
        void setUp() throws Exception {
            cyclic = TestWorkflows.cyclicGraph();
        }

        @Test
        @DisplayName("upstream terminates and reports each node once")
        void shouldWalkUpstreamThroughCycle() throws Exception {
            Closure closure = analyzer.upstream(cyclic, id(3));

            assertThat(closure.nodes())
                    .doesNotHaveDuplicates()
                    .containsExactlyInAnyOrder(id(1), id(2), id(10), id(11));
            assertThat(closure.depthOf(id(11))).isEqualTo(1);
            assertThat(closure.depthOf(id(10))).isEqualTo(2);
        }

        @Test
        @DisplayName("downstream excludes the origin even when the cycle returns to it")
        void shouldWalkDownstreamThroughCycle() throws Exception {
            Closure closure = analyzer.downstream(cyclic, id(11));

            assertThat(closure.nodes())
                    .doesNotHaveDuplicates()
                    .containsExactlyInAnyOrder(id(10), id(3));
            assertThat(closure.contains(id(11))).isFalse();
        }

        @Test
        @DisplayName("path goes around the cycle once")
        void shouldFindPathOutOfCycle() throws Exception {
            assertThat(analyzer.path(cyclic, id(10), id(3)))
                    .contains(List.of(id(10), id(11), id(3)));
            assertThat(analyzer.path(cyclic, id(3), id(10))).isEmpty();
        }

        @Test
        @DisplayName("subgraph keeps every cycle member once")
        void shouldExtractSubgraphWithCycle() throws Exception {
            Subgraph subgraph = analyzer.subgraph(cyclic, id(10), id(3));

            assertThat(subgraph.nodes())
                    .doesNotHaveDuplicates()
                    .containsExactlyInAnyOrder(id(10), id(11), id(3));
            assertThat(subgraph.edges()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("connectivity")
    class Connectivity {

        @Test
        @DisplayName("lists unconnected inputs, optionally only primary ones")
        void shouldListUnconnectedInputs() {
            assertThat(analyzer.unconnectedInputs(chain, false))
                    .extracting(UnconnectedInput::name)
                    .containsExactly("positive", "negative", "latent_image", "vae");
            assertThat(analyzer.unconnectedInputs(chain, true)).isEmpty();
        }

        @Test
        @DisplayName("lists outputs feeding nothing")
        void shouldListUnconnectedOutputs() {
            assertThat(analyzer.unconnectedOutputs(chain))
                    .extracting(UnconnectedOutput::name)
                    .containsExactly("CLIP", "VAE");
        }
    }

    @Nested
    @DisplayName("reports")
    class Reports {

        @Test
        @DisplayName("info counts nodes, links and types")
        void shouldCountInfo() {
            WorkflowInfo info = analyzer.info(chain);

            assertThat(info.nodeCount()).isEqualTo(4);
            assertThat(info.linkCount()).isEqualTo(3);
            assertThat(info.typeCounts()).containsEntry("KSampler", 1).hasSize(4);
        }

        @Test
        @DisplayName("structure finds entries, exits and the main pipeline")
        void shouldDescribeStructure() {
            WorkflowStructure structure = analyzer.structure(chain);

            assertThat(structure.entryPoints()).containsExactly(id(1));
            assertThat(structure.exitPoints()).containsExactly(id(4));
            assertThat(structure.modelLoaders()).containsExactly(id(1));
            assertThat(structure.primaryOutputs()).containsExactly(id(4));
            assertThat(structure.kind()).isEqualTo("General");
            assertThat(structure.pipelines()).singleElement().satisfies(pipeline -> {
                assertThat(pipeline.path()).containsExactly(id(1), id(2), id(3), id(4));
                assertThat(pipeline.category()).isEqualTo("Latent");
            });
        }

        @Test
        @DisplayName("a consumed store is not an exit and a resolved fetch is not an entry")
        void shouldSkipVariablesInStructure() throws Exception {
            WorkflowStructure structure = analyzer.structure(TestWorkflows.storeFetchPair());

            assertThat(structure.entryPoints()).containsExactly(id(1));
            assertThat(structure.exitPoints()).containsExactly(id(4));
            assertThat(structure.variables()).hasSize(1);
        }
    }
}
