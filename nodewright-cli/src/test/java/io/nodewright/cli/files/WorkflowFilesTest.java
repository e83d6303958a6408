package io.nodewright.cli.files;

import static org.assertj.core.api.Assertions.assertThat;

import io.nodewright.core.graph.WorkflowDocument;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowFilesTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2026-03-01T08:30:15Z"), ZoneOffset.UTC);

    @TempDir Path tempDir;

    @Test
    void shouldKeepPathThatDoesNotExist() {
        Path path = tempDir.resolve("flow.json");

        assertThat(WorkflowFiles.nextVersion(path)).isEqualTo(path);
    }

    @Test
    void shouldStartVersioningAtTwo() throws Exception {
        Path path = Files.createFile(tempDir.resolve("flow.json"));

        assertThat(WorkflowFiles.nextVersion(path)).isEqualTo(tempDir.resolve("flow_v2.json"));
    }

    @Test
    void shouldIncrementExistingVersion() throws Exception {
        Path path = Files.createFile(tempDir.resolve("flow_v5.json"));

        assertThat(WorkflowFiles.nextVersion(path)).isEqualTo(tempDir.resolve("flow_v6.json"));
    }

    @Test
    void shouldSkipVersionsThatAreTaken() throws Exception {
        Path path = Files.createFile(tempDir.resolve("flow.json"));
        Files.createFile(tempDir.resolve("flow_v2.json"));
        Files.createFile(tempDir.resolve("flow_v3.json"));

        assertThat(WorkflowFiles.nextVersion(path)).isEqualTo(tempDir.resolve("flow_v4.json"));
    }

    @Test
    void shouldShareChangelogAcrossVersions() {
        assertThat(WorkflowFiles.changelogFor(tempDir.resolve("flow_v3.json")))
                .isEqualTo(tempDir.resolve("flow.changelog"));
        assertThat(WorkflowFiles.changelogFor(tempDir.resolve("flow.json")))
                .isEqualTo(tempDir.resolve("flow.changelog"));
    }

    @Test
    void shouldWriteDocumentAndChangelog() throws Exception {
        WorkflowFiles files = new WorkflowFiles(true, CLOCK);
        Path input = tempDir.resolve("in.json");
        Path requested = tempDir.resolve("out/flow.json");

        Path written =
                files.save(
                        WorkflowDocument.empty(), input, requested, "set", List.of("[3] steps"));

        assertThat(written).isEqualTo(requested).exists();
        assertThat(Files.readString(tempDir.resolve("out/flow.changelog")))
                .isEqualTo(
                        "2026-03-01 08:30:15 | set | in.json → flow.json"
                                + System.lineSeparator()
                                + "  [3] steps"
                                + System.lineSeparator()
                                + System.lineSeparator());
    }

    @Test
    void shouldSkipChangelogWhenDisabled() throws Exception {
        WorkflowFiles files = new WorkflowFiles(false, CLOCK);

        files.save(
                WorkflowDocument.empty(),
                tempDir.resolve("in.json"),
                tempDir.resolve("flow.json"),
                "set",
                List.of());

        assertThat(tempDir.resolve("flow.changelog")).doesNotExist();
    }
}
