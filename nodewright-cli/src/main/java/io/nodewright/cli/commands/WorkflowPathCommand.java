package io.nodewright.cli.commands;

import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Prints the shortest directed path between two nodes.
@Command(name = "path", description = "Find the shortest path between two nodes")
class WorkflowPathCommand extends ReportCommand {

    @Parameters(index = "1", paramLabel = "FROM", description = "Start node id")
    private String from;

    @Parameters(index = "2", paramLabel = "TO", description = "End node id")
    private String to;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        Optional<List<NodeId>> path =
                engine.getAnalyzer().path(document, NodeId.parse(from), NodeId.parse(to));

        print(
                path.orElse(List.of()),
                () -> {
                    if (path.isEmpty()) {
                        System.out.println("No path found from " + from + " to " + to);
                        return;
                    }
                    System.out.println(styles().bold("Path from " + from + " to " + to + ":"));
                    List<NodeId> ids = path.get();
                    for (int i = 0; i < ids.size(); i++) {
                        System.out.println("  ".repeat(i) + describe(document, ids.get(i)));
                    }
                });
        return ExitCode.OK;
    }
}
