package io.nodewright.cli.commands;

import io.nodewright.core.analysis.WorkflowInfo;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;

/// Prints node and link counts and the most frequent node types.
///
/// ### Usage
/// ```bash
/// nodewright info <workflow.json> [--json]
/// ```
@Command(name = "info", description = "Show workflow summary counts")
class WorkflowInfoCommand extends ReportCommand {

    private static final int MAX_TYPES = 20;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        WorkflowInfo info = engine.getAnalyzer().info(document);

        print(
                info,
                () -> {
                    System.out.println(styles().bold("Workflow: " + workflowFile));
                    System.out.println("  Nodes: " + info.nodeCount());
                    System.out.println("  Links: " + info.linkCount());
                    System.out.println("  Groups: " + info.groupCount());
                    System.out.println("  Last node ID: " + info.lastNodeId());
                    System.out.println("  Last link ID: " + info.lastLinkId());
                    System.out.println();
                    System.out.println(
                            "Node types (" + info.typeCounts().size() + " unique):");
                    List<Map.Entry<String, Integer>> types =
                            List.copyOf(info.typeCounts().entrySet());
                    types.stream()
                            .limit(MAX_TYPES)
                            .forEach(e -> System.out.println("  " + e.getKey() + ": " + e.getValue()));
                    if (types.size() > MAX_TYPES) {
                        System.out.println(
                                styles().gray("  ... and " + (types.size() - MAX_TYPES) + " more"));
                    }
                });
        return ExitCode.OK;
    }
}
