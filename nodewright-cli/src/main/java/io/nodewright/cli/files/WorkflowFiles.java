package io.nodewright.cli.files;

import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.serialization.WorkflowJson;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Writes edited workflow documents without overwriting earlier results.
///
/// ### Versioning
/// When the requested output file exists, the next free `_vN` name is used:
/// `flow.json` becomes `flow_v2.json`, `flow_v5.json` becomes `flow_v6.json`.
///
/// ### Change log
/// Every write appends an entry to `<stem>.changelog` next to the output,
/// where `<stem>` is the output name without extension and `_vN` suffix:
/// ```
/// 2026-10-18 14:02:11 | delete | flow.json → flow_v2.json
///   deleted node 7
///
/// ```
public final class WorkflowFiles {

    private static final Logger logger = Logger.getLogger(WorkflowFiles.class.getName());

    private static final Pattern VERSIONED = Pattern.compile("(.+)_v(\\d+)$");
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final boolean changelogEnabled;
    private final Clock clock;

    /// @param changelogEnabled whether writes append to the change log
    /// @param clock time source for change log entries, not null
    public WorkflowFiles(boolean changelogEnabled, Clock clock) {
        this.changelogEnabled = changelogEnabled;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Saves an edited document under the next free version of `requested`.
    ///
    /// @param document edited document, not null
    /// @param input file the document was loaded from, not null
    /// @param requested output file named by the user, not null
    /// @param operation operation name for the change log, not null
    /// @param details change log detail lines, not null
    /// @return the file actually written, never null
    /// @throws IOException if the document or the change log cannot be written
    public Path save(
            WorkflowDocument document,
            Path input,
            Path requested,
            String operation,
            List<String> details)
            throws IOException {
        Path target = nextVersion(requested);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        WorkflowJson.write(document, target);
        if (changelogEnabled) {
            appendChangelog(input, target, operation, details);
        }
        logger.info("Saved " + operation + " result to " + target);
        return target;
    }

    /// Returns `path` if it does not exist, otherwise the next free `_vN` sibling.
    ///
    /// @param path requested file, not null
    /// @return a path that does not exist yet, never null
    public static Path nextVersion(Path path) {
        if (!Files.exists(path)) {
            return path;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String suffix = dot > 0 ? name.substring(dot) : "";

        String base = stem;
        int version = 2;
        Matcher matcher = VERSIONED.matcher(stem);
        if (matcher.matches()) {
            base = matcher.group(1);
            version = Integer.parseInt(matcher.group(2)) + 1;
        }
        Path candidate = path.resolveSibling(base + "_v" + version + suffix);
        while (Files.exists(candidate)) {
            version++;
            candidate = path.resolveSibling(base + "_v" + version + suffix);
        }
        return candidate;
    }

    /// Returns the change log that belongs to an output file.
    ///
    /// @param output written output file, not null
    /// @return `<stem>.changelog` in the same directory, never null
    public static Path changelogFor(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Matcher matcher = VERSIONED.matcher(stem);
        if (matcher.matches()) {
            stem = matcher.group(1);
        }
        return output.resolveSibling(stem + ".changelog");
    }

    private void appendChangelog(Path input, Path output, String operation, List<String> details)
            throws IOException {
        StringBuilder entry = new StringBuilder();
        entry.append(LocalDateTime.now(clock).format(TIMESTAMP))
                .append(" | ")
                .append(operation)
                .append(" | ")
                .append(input.getFileName())
                .append(" → ")
                .append(output.getFileName())
                .append(System.lineSeparator());
        for (String detail : details) {
            entry.append("  ").append(detail).append(System.lineSeparator());
        }
        entry.append(System.lineSeparator());
        Files.writeString(
                changelogFor(output),
                entry.toString(),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
    }
}
