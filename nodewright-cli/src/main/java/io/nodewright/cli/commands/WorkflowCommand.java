package io.nodewright.cli.commands;

import io.nodewright.cli.ui.AnsiStyles;
import io.nodewright.core.NodewrightEngine;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.exception.WorkflowParseException;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.serialization.WorkflowJson;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Base class for all commands that operate on a workflow document file.
///
/// Owns the {@link #call()} / {@link #execute()} contract and maps failures to
/// exit codes:
///
/// | Exit code | Meaning |
/// |-----------|---------|
/// | `0` | success |
/// | `1` | operation failure (parse error, unknown node, slot error, script error) |
/// | `2` | usage error (e.g. missing `--output` on a mutating command) |
///
/// Failures are printed to `System.err` as ` [FAIL] <message>`; the message
/// names the operation and the offending id, slot or line.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see MutatingCommand
public abstract class WorkflowCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "WORKFLOW", description = "Workflow JSON file")
    protected Path workflowFile;

    @Option(names = "--no-color", description = "Disable colored output")
    private boolean noColor;

    @Inject
    @ConfigProperty(name = "nodewright.color", defaultValue = "true")
    boolean colorEnabled = true;

    @Inject protected NodewrightEngine engine;

    private AnsiStyles styles;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (WorkflowParseException e) {
            System.err.println(
                    styles().fail("Cannot parse " + workflowFile + ": " + e.getMessage()));
            return ExitCode.SOFTWARE;
        } catch (WorkflowGraphException e) {
            System.err.println(styles().fail(e.getMessage()));
            return ExitCode.SOFTWARE;
        } catch (IOException e) {
            System.err.println(styles().fail("I/O error: " + e.getMessage()));
            return ExitCode.SOFTWARE;
        } catch (RuntimeException e) {
            System.err.println(
                    styles().fail(
                            "Unexpected error: "
                                    + (e.getMessage() != null ? e.getMessage() : e.toString())));
            return ExitCode.SOFTWARE;
        }
    }

    /// Runs the command.
    ///
    /// @return process exit code
    /// @throws WorkflowGraphException if the engine rejects the operation
    /// @throws IOException if a file cannot be read or written
    protected abstract int execute() throws WorkflowGraphException, IOException;

    /// Loads the workflow named by the first positional parameter.
    protected WorkflowDocument loadWorkflow() throws WorkflowParseException, IOException {
        return loadWorkflow(workflowFile);
    }

    protected WorkflowDocument loadWorkflow(Path file) throws WorkflowParseException, IOException {
        return WorkflowJson.read(file);
    }

    protected AnsiStyles styles() {
        if (styles == null) {
            styles = AnsiStyles.of(colorEnabled && !noColor);
        }
        return styles;
    }

    /// Formats a node reference: `[id] Type "title"`.
    protected String describe(WorkflowDocument document, NodeId id) {
        return styles().accent(
                document.findNode(id).map(Node::displayName).orElse("[" + id + "] ?"));
    }

    /// Returns the type of a node, `?` when it does not exist.
    protected static String typeOf(WorkflowDocument document, NodeId id) {
        return document.findNode(id).map(Node::getType).orElse("?");
    }
}
