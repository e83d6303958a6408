package io.nodewright.core.analysis;

import static io.nodewright.core.TestWorkflows.id;
import static org.assertj.core.api.Assertions.assertThat;

import io.nodewright.core.TestWorkflows;
import io.nodewright.core.analysis.DiffResult.FieldChange;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowDiff")
class WorkflowDiffTest {

    private final WorkflowDiff diff = new WorkflowDiff();

    @Test
    @DisplayName("identical documents have no differences")
    void shouldFindNothing() throws Exception {
        assertThat(diff.diff(TestWorkflows.linearChain(), TestWorkflows.linearChain()).isEmpty())
                .isTrue();
    }

    @Test
    @DisplayName("reports removed nodes, removed links and widget changes")
    void shouldReportChanges() throws Exception {
        WorkflowDocument before = TestWorkflows.linearChain();
        WorkflowDocument after = before.copy();
        after.removeNode(id(4));
        Node sampler = after.node(id(2));
        after.updateNode(sampler.toBuilder().widgets(sampler.getWidgets().with(2, 30)).build());

        DiffResult result = diff.diff(before, after);

        assertThat(result.removed()).extracting(Node::getId).containsExactly(id(4));
        assertThat(result.added()).isEmpty();
        assertThat(result.removedLinks()).containsExactly(new Link.Endpoints(id(3), 0, id(4), 0));
        assertThat(result.modified())
                .singleElement()
                .satisfies(change ->
                        assertThat(change.changes())
                                .containsExactly(new FieldChange("widgets[2]", 20, 30)));
    }

    @Test
    @DisplayName("ignores link ids when endpoints match")
    void shouldIgnoreLinkIds() throws Exception {
        WorkflowDocument before = TestWorkflows.linearChain();
        WorkflowDocument after = before.copy();
        Link link = after.incomingLink(id(4), 0).orElseThrow();
        after.removeLink(link.id());
        after.addLink(id(3), 0, id(4), 0);

        assertThat(diff.diff(before, after).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("reports keyed widget changes by key")
    void shouldReportKeyedChanges() throws Exception {
        WorkflowDocument before = WorkflowDocument.empty();
        before.addNode(
                TestWorkflows.node(1, "CustomNode")
                        .widgets(WidgetValues.keyed(Map.of("mode", "fast")))
                        .build());
        WorkflowDocument after = before.copy();
        Node node = after.node(id(1));
        after.updateNode(node.toBuilder().widgets(node.getWidgets().with("mode", "slow")).build());

        assertThat(diff.diff(before, after).modified().get(0).changes())
                .containsExactly(new FieldChange("widgets.mode", "fast", "slow"));
    }
}
