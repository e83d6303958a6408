package io.nodewright.core.analysis;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;

import io.nodewright.core.TestWorkflows;
import io.nodewright.core.analysis.Violation.Kind;
import io.nodewright.core.graph.Group;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IntegrityVerifier")
class IntegrityVerifierTest {

    private IntegrityVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new IntegrityVerifier();
    }

    @Test
    @DisplayName("a document built through the mutators is clean")
    void shouldAcceptConsistentDocument() throws Exception {
        assertThat(verifier.verify(TestWorkflows.linearChain())).isEmpty();
        assertThat(verifier.verify(TestWorkflows.storeFetchPair())).isEmpty();
    }

    @Test
    @DisplayName("reports links to missing nodes")
    void shouldReportDanglingLink() {
        Node loader = linkedLoader(1, 1);
        WorkflowDocument doc =
                WorkflowDocument.of(
                        List.of(loader),
                        List.of(new Link(1, id(1), 0, id(9), 0, "MODEL")),
                        List.of(),
                        Map.of(),
                        1,
                        1);

        assertThat(verifier.verify(doc))
                .singleElement()
                .satisfies(v -> {
                    assertThat(v.kind()).isEqualTo(Kind.DANGLING_LINK);
                    assertThat(v.linkId()).isEqualTo(1);
                    assertThat(v.message()).contains("target node 9 not found");
                });
    }

    @Test
    @DisplayName("reports a link whose type does not fit its slots")
    void shouldReportTypeMismatch() {
        Node loader = linkedLoader(1, 1);
        Node decoder = TestWorkflows.decoder(2);
        decoder = decoder.toBuilder().replaceInput(0, decoder.input(0).withLink(1)).build();
        WorkflowDocument doc =
                WorkflowDocument.of(
                        List.of(loader, decoder),
                        List.of(new Link(1, id(1), 0, id(2), 0, "MODEL")),
                        List.of(),
                        Map.of(),
                        2,
                        1);

        assertThat(verifier.verify(doc)).extracting(Violation::kind).containsExactly(Kind.TYPE_MISMATCH);
    }

    @Test
    @DisplayName("reports two links into one input")
    void shouldReportMultipleWriters() throws Exception {
        WorkflowDocument chain = TestWorkflows.linearChain();
        List<Link> links = new ArrayList<>(chain.links());
        links.add(new Link(9, id(1), 0, id(2), 0, "MODEL"));
        WorkflowDocument doc =
                WorkflowDocument.of(chain.nodes(), links, List.of(), Map.of(), 4, 9);

        assertThat(verifier.verify(doc)).extracting(Violation::kind).contains(Kind.MULTIPLE_WRITERS);
    }

    @Test
    @DisplayName("reports duplicate ids and orphaned group members")
    void shouldReportDuplicatesAndGroups() throws Exception {
        WorkflowDocument chain = TestWorkflows.linearChain();
        List<Node> nodes = new ArrayList<>(chain.nodes());
        nodes.add(TestWorkflows.save(4));
        Group group = new Group("Outputs", List.of(0.0, 0.0, 100.0, 100.0), List.of(id(4), id(12)), Map.of());
        WorkflowDocument doc = WorkflowDocument.of(nodes, chain.links(), List.of(group), Map.of(), 4, 3);

        assertThat(verifier.verify(doc))
                .extracting(Violation::kind)
                .containsExactlyInAnyOrder(Kind.DUPLICATE_NODE_ID, Kind.ORPHANED_GROUP_REFERENCE);
    }

    @Test
    @DisplayName("reports slots referencing links that do not exist")
    void shouldReportSlotLinkMismatch() {
        Node sampler = TestWorkflows.sampler(2);
        sampler = sampler.toBuilder().replaceInput(0, sampler.input(0).withLink(5)).build();
        WorkflowDocument doc = WorkflowDocument.of(List.of(sampler), List.of(), List.of(), Map.of(), 2, 0);

        assertThat(verifier.verify(doc))
                .singleElement()
                .extracting(Violation::kind)
                .isEqualTo(Kind.SLOT_LINK_MISMATCH);
    }

    private static Node linkedLoader(long id, int linkId) {
        Node loader = TestWorkflows.loader(id);
        return loader.toBuilder().replaceOutput(0, loader.output(0).plusLink(linkId)).build();
    }
}
