package io.nodewright.cli.commands;

import io.nodewright.core.analysis.DiffResult;
import io.nodewright.core.analysis.DiffResult.FieldChange;
import io.nodewright.core.analysis.DiffResult.NodeChange;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.Link;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Compares two workflow files: added, removed and modified nodes, then link changes.
@Command(name = "diff", description = "Compare two workflow files")
class WorkflowDiffCommand extends ReportCommand {

    @Parameters(index = "1", paramLabel = "OTHER", description = "Workflow to compare against")
    private Path otherFile;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument before = loadWorkflow();
        WorkflowDocument after = loadWorkflow(otherFile);
        DiffResult diff = engine.getAnalyzer().diff(before, after);

        print(
                diff,
                () -> {
                    System.out.println(
                            styles().bold("Comparing: " + workflowFile + " -> " + otherFile));
                    System.out.println();
                    if (diff.isEmpty()) {
                        System.out.println("No differences");
                        return;
                    }
                    if (!diff.added().isEmpty()) {
                        System.out.println("ADDED (" + diff.added().size() + "):");
                        for (Node node : diff.added()) {
                            System.out.println("  + " + node.displayName());
                        }
                    }
                    if (!diff.removed().isEmpty()) {
                        System.out.println("REMOVED (" + diff.removed().size() + "):");
                        for (Node node : diff.removed()) {
                            System.out.println("  - " + node.displayName());
                        }
                    }
                    if (!diff.modified().isEmpty()) {
                        System.out.println("MODIFIED (" + diff.modified().size() + "):");
                        for (NodeChange change : diff.modified()) {
                            System.out.println("  ~ " + change.before().displayName());
                            for (FieldChange field : change.changes()) {
                                System.out.println(styles().gray("      " + field));
                            }
                        }
                    }
                    if (!diff.addedLinks().isEmpty() || !diff.removedLinks().isEmpty()) {
                        System.out.println("LINKS:");
                        for (Link.Endpoints link : diff.addedLinks()) {
                            System.out.println("  + " + link);
                        }
                        for (Link.Endpoints link : diff.removedLinks()) {
                            System.out.println("  - " + link);
                        }
                    }
                });
        return ExitCode.OK;
    }
}
