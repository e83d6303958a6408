package io.nodewright.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.serialization.WorkflowJson;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowBatchCommandTest extends BaseWorkflowCommandTest {

    @TempDir Path tempDir;

    private Path workflow;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        workflow = copyFixture("txt2img.json", tempDir);
        output = tempDir.resolve("batched.json");
    }

    private WorkflowBatchCommand command(String script) throws Exception {
        Path scriptFile = tempDir.resolve("edits.txt");
        Files.writeString(scriptFile, script);
        WorkflowBatchCommand command = prepare(new WorkflowBatchCommand(), workflow);
        injectField(command, "scriptFile", scriptFile);
        injectField(command, "output", output);
        return command;
    }

    @Test
    void shouldApplyScriptAndLogEveryDetail() throws Exception {
        WorkflowBatchCommand command =
                command(
                        String.join(
                                "\n",
                                "# second save branch",
                                "copy 9 as $save2 filename_prefix=\"branch\"",
                                "wire 8:IMAGE -> $save2:images",
                                "set 3 steps=35"));

        int exitCode = command.call();

        assertThat(exitCode).isZero();
        assertThat(outContent.toString()).contains("Executed 3 line(s)");
        WorkflowDocument result = WorkflowJson.read(output);
        assertThat(result.node(NodeId.of(10)).getWidgets().get(0)).isEqualTo("branch");
        assertThat(result.node(NodeId.of(3)).getWidgets().get(2)).isEqualTo(35);
        String changelog = Files.readString(tempDir.resolve("batched.changelog"));
        assertThat(changelog).contains("| batch | txt2img.json → batched.json");
    }

    @Test
    void shouldWriteNothingWhenLineFails() throws Exception {
        WorkflowBatchCommand command =
                command(String.join("\n", "set 3 steps=35", "delete 99", "set 3 cfg=6"));

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Line 2: delete 99");
        assertThat(errContent.toString()).contains("Stopped after 1 line(s); nothing written");
        assertThat(output).doesNotExist();
    }

    @Test
    void shouldSimulateOnDryRun() throws Exception {
        WorkflowBatchCommand command = command("set 3 steps=35");
        injectField(command, "dryRun", true);

        int exitCode = command.call();

        assertThat(exitCode).isZero();
        assertThat(outContent.toString())
                .contains("DRY RUN - simulating edits.txt")
                .contains("(No changes made)");
        assertThat(output).doesNotExist();
    }
}
