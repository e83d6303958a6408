package io.nodewright.cli.commands;

import io.nodewright.core.analysis.WorkflowSummary;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;

/// Prints the detected pattern label, headline parameters and main flows.
@Command(name = "summary", description = "Describe the workflow pattern and key parameters")
class WorkflowSummaryCommand extends ReportCommand {

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        WorkflowSummary summary = engine.getAnalyzer().summarize(document);

        print(
                summary,
                () -> {
                    System.out.println(styles().bold("Pattern: " + summary.pattern()));
                    System.out.println(
                            "  " + summary.nodeCount() + " nodes, " + summary.linkCount() + " links");
                    if (!summary.parameters().isEmpty()) {
                        System.out.println();
                        System.out.println("Parameters:");
                        summary.parameters()
                                .forEach((name, value) -> System.out.println("  " + name + ": " + value));
                    }
                    if (!summary.flows().isEmpty()) {
                        System.out.println();
                        System.out.println("Main flows:");
                        for (List<NodeId> flow : summary.flows()) {
                            System.out.println(
                                    "  "
                                            + flow.stream()
                                                    .map(id -> typeOf(document, id))
                                                    .collect(Collectors.joining(" -> ")));
                        }
                    }
                });
        return ExitCode.OK;
    }
}
