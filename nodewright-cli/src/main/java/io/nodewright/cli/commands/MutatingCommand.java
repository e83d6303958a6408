package io.nodewright.cli.commands;

import io.nodewright.cli.files.WorkflowFiles;
import io.nodewright.core.edit.EditResult;
import io.nodewright.core.edit.ValueParser;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.WorkflowDocument;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;

/// Base class for commands that edit a workflow and write the result.
///
/// `-o/--output` is required unless `--dry-run` is given; omitting it is a
/// usage error (exit code 2) reported before the workflow is even loaded.
/// Results are written through {@link WorkflowFiles}, so an existing output
/// is never overwritten and every write is recorded in the change log.
/// `--dry-run` prints what would change and writes nothing.
public abstract class MutatingCommand extends WorkflowCommand {

    @Option(
            names = {"-o", "--output"},
            description = "Output file (an existing file gets the next _vN name)")
    protected Path output;

    @Option(names = "--dry-run", description = "Show what would change without writing")
    protected boolean dryRun;

    @Inject protected WorkflowFiles files;

    private int abortCode = ExitCode.SOFTWARE;

    @Override
    protected final int execute() throws WorkflowGraphException, IOException {
        if (output == null && !dryRun) {
            System.err.println(styles().fail("-o/--output is required"));
            return ExitCode.USAGE;
        }
        WorkflowDocument document = loadWorkflow();
        Mutation mutation = mutate(document);
        if (mutation == null) {
            return abortCode;
        }

        for (String detail : mutation.details()) {
            System.out.println("  " + detail);
        }
        for (String warning : mutation.warnings()) {
            System.out.println(styles().warn(warning));
        }
        if (dryRun) {
            System.out.println(styles().gray("(No changes made)"));
            return ExitCode.OK;
        }

        Path written =
                files.save(
                        mutation.document(),
                        workflowFile,
                        output,
                        mutation.operation(),
                        mutation.details());
        System.out.println(
                styles().ok(mutation.summary() + " " + styles().arrow() + " " + written));
        return ExitCode.OK;
    }

    /// Applies the edit to a freshly loaded document.
    ///
    /// @param document loaded document, not null
    /// @return the edit to report and save, or null if the command already
    /// reported a failure (exit code 1 unless set through {@link #abort})
    /// @throws WorkflowGraphException if the engine rejects the edit
    /// @throws IOException if an auxiliary file cannot be read
    protected abstract Mutation mutate(WorkflowDocument document)
            throws WorkflowGraphException, IOException;

    /// Ends the command without writing anything.
    ///
    /// @param exitCode process exit code to report
    /// @return null, for use as the return value of {@link #mutate}
    protected final Mutation abort(int exitCode) {
        this.abortCode = exitCode;
        return null;
    }

    /// Converts `key=value` pairs into widget overrides, parsing each value
    /// with {@link ValueParser}.
    protected static Map<String, Object> widgetValues(Map<String, String> assignments) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (assignments != null) {
            assignments.forEach((key, text) -> values.put(key, ValueParser.parse(text)));
        }
        return values;
    }

    /// Outcome of one editing command.
    ///
    /// @param document edited document, not null
    /// @param operation operation name for the change log, not null
    /// @param summary one-line result description, not null
    /// @param details per-change lines, printed and logged, not null
    /// @param warnings non-fatal problems, printed only, not null
    protected record Mutation(
            WorkflowDocument document,
            String operation,
            String summary,
            List<String> details,
            List<String> warnings) {

        protected Mutation {
            Objects.requireNonNull(document, "document must not be null");
            details = List.copyOf(details);
            warnings = List.copyOf(warnings);
        }

        static Mutation of(EditResult result, String summary) {
            return new Mutation(
                    result.document(),
                    result.operation(),
                    summary,
                    result.describe(),
                    result.warnings());
        }
    }
}
