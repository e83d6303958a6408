package io.nodewright.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowReportCommandsTest extends BaseWorkflowCommandTest {

    @TempDir Path tempDir;

    private Path workflow;

    @BeforeEach
    void setUp() throws Exception {
        workflow = copyFixture("txt2img.json", tempDir);
    }

    @Test
    void shouldPrintCountsAndTypes() throws Exception {
        WorkflowInfoCommand command = prepare(new WorkflowInfoCommand(), workflow);

        int exitCode = command.call();

        String output = outContent.toString();
        assertThat(exitCode).isZero();
        assertThat(output).contains("Nodes: 7");
        assertThat(output).contains("Links: 9");
        assertThat(output).contains("Groups: 1");
        assertThat(output).contains("CLIPTextEncode: 2");
    }

    @Test
    void shouldPrintReportAsJson() throws Exception {
        WorkflowInfoCommand command = prepare(new WorkflowInfoCommand(), workflow);
        injectField(command, "json", true);

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("\"nodeCount\" : 7");
        assertThat(output).doesNotContain("Node types");
    }

    @Test
    void shouldFindNodesByTypeFragment() throws Exception {
        WorkflowQueryCommand command = prepare(new WorkflowQueryCommand(), workflow);
        injectField(command, "type", "clip");

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("[6] CLIPTextEncode \"Positive\"");
        assertThat(output).contains("[7] CLIPTextEncode \"Negative\"");
        assertThat(output).doesNotContain("KSampler");
    }

    @Test
    void shouldReportNoMatches() throws Exception {
        WorkflowQueryCommand command = prepare(new WorkflowQueryCommand(), workflow);
        injectField(command, "type", "ControlNet");

        command.call();

        assertThat(outContent.toString()).contains("No nodes found");
    }

    @Test
    void shouldTraceInputsAndOutputs() throws Exception {
        WorkflowTraceCommand command = prepare(new WorkflowTraceCommand(), workflow);
        injectField(command, "nodeId", "8");

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("[0] samples <- [3] KSampler (slot 0)");
        assertThat(output).contains("[1] vae <- [4] CheckpointLoaderSimple (slot 2)");
        assertThat(output).contains("[0] IMAGE -> [9] SaveImage (slot 0)");
    }

    @Test
    void shouldListUpstreamEdgesWithOriginMarker() throws Exception {
        WorkflowUpstreamCommand command = prepare(new WorkflowUpstreamCommand(), workflow);
        injectField(command, "nodeId", "3");

        command.call();

        String output = outContent.toString();
        assertThat(output)
                .contains("[4] CheckpointLoaderSimple.MODEL --(MODEL)--> [3] KSampler.model <<<");
        assertThat(output)
                .contains("[4] CheckpointLoaderSimple.CLIP --(CLIP)--> [6] CLIPTextEncode.clip");
        assertThat(output).doesNotContain("VAEDecode");
    }

    @Test
    void shouldPrintShortestPath() throws Exception {
        WorkflowPathCommand command = prepare(new WorkflowPathCommand(), workflow);
        injectField(command, "from", "4");
        injectField(command, "to", "9");

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("Path from 4 to 9:");
        assertThat(output).contains("[9] SaveImage");
    }

    @Test
    void shouldReportMissingPath() throws Exception {
        WorkflowPathCommand command = prepare(new WorkflowPathCommand(), workflow);
        injectField(command, "from", "9");
        injectField(command, "to", "4");

        command.call();

        assertThat(outContent.toString()).contains("No path found from 9 to 4");
    }

    @Test
    void shouldShowPositionalWidgetValues() throws Exception {
        WorkflowValuesCommand command = prepare(new WorkflowValuesCommand(), workflow);
        injectField(command, "nodeId", "3");

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("Widget values (positional):");
        assertThat(output).contains("[2] 20");
        assertThat(output).contains("[4] \"euler\"");
    }

    @Test
    void shouldSayWhenNodeHasNoWidgets() throws Exception {
        WorkflowValuesCommand command = prepare(new WorkflowValuesCommand(), workflow);
        injectField(command, "nodeId", "8");

        command.call();

        assertThat(outContent.toString()).contains("No widget values");
    }

    @Test
    void shouldFailOnUnknownNode() throws Exception {
        WorkflowTraceCommand command = prepare(new WorkflowTraceCommand(), workflow);
        injectField(command, "nodeId", "99");

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("[FAIL]").contains("99");
    }

    @Test
    void shouldFailOnUnparseableFile() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"nodes\": [");
        WorkflowInfoCommand command = prepare(new WorkflowInfoCommand(), broken);

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Cannot parse").contains("broken.json");
    }

    @Test
    void shouldListOnlyPrimaryUnconnectedInputs() throws Exception {
        Path variables = copyFixture("variables.json", tempDir);
        WorkflowUnconnectedCommand command = prepare(new WorkflowUnconnectedCommand(), variables);
        injectField(command, "inputs", true);
        injectField(command, "primaryOnly", true);

        command.call();

        String output = outContent.toString();
        assertThat(output).doesNotContain("Unconnected outputs");
        assertThat(output).doesNotContain("positive");
    }

    @Test
    void shouldListUnconnectedOutputs() throws Exception {
        WorkflowUnconnectedCommand command = prepare(new WorkflowUnconnectedCommand(), workflow);
        injectField(command, "outputs", true);

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("No unconnected outputs found.");
        assertThat(output).doesNotContain("inputs");
    }

    @Test
    void shouldPassIntegrityCheck() throws Exception {
        WorkflowVerifyCommand command = prepare(new WorkflowVerifyCommand(), workflow);

        int exitCode = command.call();

        assertThat(exitCode).isZero();
        assertThat(outContent.toString()).contains("[OK] Workflow integrity OK");
    }

    @Test
    void shouldReportDanglingLink() throws Exception {
        Path broken = tempDir.resolve("dangling.json");
        Files.writeString(
                broken,
                String.join(
                        "\n",
                        List.of(
                                "{\"last_node_id\": 1, \"last_link_id\": 5,",
                                " \"nodes\": [{\"id\": 1, \"type\": \"SaveImage\",",
                                "   \"inputs\": [{\"name\": \"images\", \"type\": \"IMAGE\", \"link\": 5}],",
                                "   \"outputs\": []}],",
                                " \"links\": [[5, 42, 0, 1, 0, \"IMAGE\"]]}")));
        WorkflowVerifyCommand command = prepare(new WorkflowVerifyCommand(), broken);

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(outContent.toString()).contains("[FAIL] Found").contains("DANGLING_LINK");
    }

    @Test
    void shouldReportNoDifferencesForSameFile() throws Exception {
        WorkflowDiffCommand command = prepare(new WorkflowDiffCommand(), workflow);
        injectField(command, "otherFile", workflow);

        command.call();

        assertThat(outContent.toString()).contains("No differences");
    }

    @Test
    void shouldLimitDownstreamDepth() throws Exception {
        WorkflowDownstreamCommand command = prepare(new WorkflowDownstreamCommand(), workflow);
        injectField(command, "nodeId", "4");
        injectField(command, "depth", 1);

        command.call();

        String output = outContent.toString();
        assertThat(output)
                .contains("[4] CheckpointLoaderSimple.VAE --(VAE)--> [8] VAEDecode.vae <<<");
        assertThat(output).doesNotContain("SaveImage");
    }

    @Test
    void shouldCountNodesBetweenTwoNodes() throws Exception {
        WorkflowSubgraphCommand command = prepare(new WorkflowSubgraphCommand(), workflow);
        injectField(command, "from", "4");
        injectField(command, "to", "8");

        command.call();

        String output = outContent.toString();
        assertThat(output).contains("Subgraph: [4] -> [8]");
        assertThat(output).contains("Nodes: 5");
        assertThat(output).doesNotContain("[9] SaveImage");
    }

    @Test
    void shouldPrintOneLineSummary() throws Exception {
        WorkflowSummaryCommand command = prepare(new WorkflowSummaryCommand(), workflow);

        command.call();

        String output = outContent.toString();
        assertThat(output).startsWith("Pattern: ");
        assertThat(output).contains("7 nodes, 9 links");
    }
}
