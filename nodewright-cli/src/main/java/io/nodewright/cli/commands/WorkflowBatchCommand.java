package io.nodewright.cli.commands;

import io.nodewright.core.batch.BatchFailure;
import io.nodewright.core.batch.BatchResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Runs an edit script against a workflow.
///
/// A failing line stops the run. Nothing is written in that case; the lines
/// that did apply are still reported.
@Command(name = "batch", description = "Run an edit script")
class WorkflowBatchCommand extends MutatingCommand {

    @Parameters(index = "1", paramLabel = "SCRIPT", description = "Script file")
    private Path scriptFile;

    @Override
    protected Mutation mutate(WorkflowDocument document)
            throws WorkflowGraphException, IOException {
        String script = Files.readString(scriptFile, StandardCharsets.UTF_8);
        System.out.println(
                (dryRun ? "DRY RUN - simulating " : "Executing ") + scriptFile.getFileName());
        BatchResult result = engine.getBatchInterpreter().run(document, script, dryRun);

        if (!result.isSuccess()) {
            result.details().forEach(detail -> System.out.println("  " + detail));
            result.warnings().forEach(warning -> System.out.println(styles().warn(warning)));
            BatchFailure failure = result.failureOrNull();
            System.err.println(
                    styles().fail(
                                    "Line "
                                            + failure.lineNumber()
                                            + ": "
                                            + failure.line()
                                            + " "
                                            + styles().arrow()
                                            + " "
                                            + failure.message()));
            System.err.println(
                    "Stopped after " + result.linesExecuted() + " line(s); nothing written");
            return abort(ExitCode.SOFTWARE);
        }
        return new Mutation(
                result.document(),
                "batch",
                "Executed " + result.linesExecuted() + " line(s)",
                result.details(),
                result.warnings());
    }
}
