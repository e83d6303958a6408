package io.nodewright.core.graph;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nodewright.core.TestWorkflows;
import io.nodewright.core.exception.IntegrityException;
import io.nodewright.core.exception.NodeNotFoundException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowDocument")
class WorkflowDocumentTest {

    @Nested
    @DisplayName("addLink")
    class AddLink {

        @Test
        @DisplayName("records the link on both slots with the output's type")
        void shouldRecordLinkOnBothEnds() throws Exception {
            WorkflowDocument doc = WorkflowDocument.empty();
            doc.addNode(TestWorkflows.loader(1));
            doc.addNode(TestWorkflows.sampler(2));

            Link link = doc.addLink(id(1), 0, id(2), 0);

            assertThat(link.type()).isEqualTo("MODEL");
            assertThat(doc.node(id(1)).output(0).links()).containsExactly(link.id());
            assertThat(doc.node(id(2)).input(0).link()).isEqualTo(link.id());
            assertThat(doc.lastLinkId()).isEqualTo(link.id());
        }

        @Test
        @DisplayName("rejects a second writer into one input")
        void shouldRejectSecondWriter() throws Exception {
            WorkflowDocument doc = TestWorkflows.linearChain();
            doc.addNode(TestWorkflows.loader(5));

            assertThatThrownBy(() -> doc.addLink(id(5), 0, id(2), 0))
                    .isInstanceOf(IntegrityException.class)
                    .hasMessageContaining("already holds link");
        }

        @Test
        @DisplayName("rejects incompatible types")
        void shouldRejectTypeMismatch() throws Exception {
            WorkflowDocument doc = WorkflowDocument.empty();
            doc.addNode(TestWorkflows.loader(1));
            doc.addNode(TestWorkflows.decoder(2));

            assertThatThrownBy(() -> doc.addLink(id(1), 0, id(2), 0))
                    .isInstanceOf(IntegrityException.class)
                    .hasMessageContaining("type mismatch");
        }

        @Test
        @DisplayName("overwrites an input whose link is missing from the link table")
        void shouldOverwriteBrokenReference() throws Exception {
            Node sampler = TestWorkflows.sampler(2);
            Node broken = sampler.toBuilder().replaceInput(0, sampler.input(0).withLink(99)).build();
            WorkflowDocument doc =
                    WorkflowDocument.of(
                            List.of(TestWorkflows.loader(1), broken), List.of(), List.of(), Map.of(), 2, 0);

            Link link = doc.addLink(id(1), 0, id(2), 0);

            assertThat(doc.node(id(2)).input(0).link()).isEqualTo(link.id());
        }
    }

    @Nested
    @DisplayName("removeNode")
    class RemoveNode {

        @Test
        @DisplayName("removes touching links and clears surviving slots")
        void shouldDetachLinks() throws Exception {
            WorkflowDocument doc = TestWorkflows.linearChain();

            List<Link> removed = doc.removeNode(id(2));

            assertThat(removed).hasSize(2);
            assertThat(doc.links()).hasSize(1);
            assertThat(doc.node(id(1)).output(0).links()).isEmpty();
            assertThat(doc.node(id(3)).input(0).isConnected()).isFalse();
        }

        @Test
        @DisplayName("throws NodeNotFoundException for unknown ids")
        void shouldRejectUnknownNode() throws Exception {
            WorkflowDocument doc = TestWorkflows.linearChain();

            assertThatThrownBy(() -> doc.removeNode(id(42)))
                    .isInstanceOf(NodeNotFoundException.class)
                    .hasMessageContaining("42");
        }
    }

    @Nested
    @DisplayName("ids")
    class Ids {

        @Test
        @DisplayName("nextId is above the counter and every numeric id")
        void shouldAllocateAboveCounter() throws Exception {
            WorkflowDocument doc =
                    WorkflowDocument.of(
                            List.of(TestWorkflows.loader(3)), List.of(), List.of(), Map.of(), 10, 0);

            assertThat(doc.nextId()).isEqualTo(id(11));
        }

        @Test
        @DisplayName("nextId skips ids taken by string ids")
        void shouldSkipStringIds() throws Exception {
            Node named =
                    Node.builder().id(NodeId.ofString("5")).type("Note").build();
            WorkflowDocument doc =
                    WorkflowDocument.of(
                            List.of(TestWorkflows.loader(4), named), List.of(), List.of(), Map.of(), 0, 0);

            assertThat(doc.nextId()).isEqualTo(id(6));
        }

        @Test
        @DisplayName("a digit-only string id is addressable by its number")
        void shouldFindStringIdByNumber() throws Exception {
            Node named = TestWorkflows.node(5, "Note").id(NodeId.ofString("5")).build();
            WorkflowDocument doc =
                    WorkflowDocument.of(List.of(named), List.of(), List.of(), Map.of(), 0, 0);

            assertThat(doc.node(NodeId.parse("5"))).isSameAs(named);
            assertThat(doc.containsNode(id(5))).isTrue();
            assertThat(NodeId.ofString("5")).isEqualTo(id(5)).hasSameHashCodeAs(id(5));
            assertThat(NodeId.ofString("5").compareTo(id(5))).isZero();
        }

        @Test
        @DisplayName("addNode rejects a duplicate id")
        void shouldRejectDuplicateId() throws Exception {
            WorkflowDocument doc = TestWorkflows.linearChain();

            assertThatThrownBy(() -> doc.addNode(TestWorkflows.save(4)))
                    .isInstanceOf(IntegrityException.class)
                    .hasMessageContaining("duplicate node id 4");
        }
    }

    @Test
    @DisplayName("copy is independent of the original")
    void shouldCopyIndependently() throws Exception {
        WorkflowDocument doc = TestWorkflows.linearChain();
        WorkflowDocument copy = doc.copy();

        copy.removeNode(id(4));

        assertThat(doc.nodes()).hasSize(4);
        assertThat(copy.nodes()).hasSize(3);
        assertThat(doc.links()).hasSize(3);
    }

    @Test
    @DisplayName("findNodesByType matches substrings ignoring case")
    void shouldFindByTypeFragment() throws Exception {
        WorkflowDocument doc = TestWorkflows.linearChain();

        assertThat(doc.findNodesByType("vae")).extracting(Node::getId).containsExactly(id(3));
        assertThat(doc.findNodesByType("xyz")).isEmpty();
    }

    @Test
    @DisplayName("displayName omits a title equal to the type")
    void shouldFormatDisplayName() {
        Node titled = TestWorkflows.store(7, "model");
        Node plain = TestWorkflows.save(8);

        assertThat(titled.displayName()).isEqualTo("[7] SetNode \"Set_model\"");
        assertThat(plain.displayName()).isEqualTo("[8] SaveImage");
    }
}
