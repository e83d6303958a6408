package io.nodewright.cli.commands;

import io.nodewright.core.analysis.NodeRole;
import io.nodewright.core.analysis.Subgraph;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Prints every node lying on some path between two nodes, grouped by role.
@Command(name = "subgraph", description = "Show all nodes between two nodes")
class WorkflowSubgraphCommand extends ReportCommand {

    @Parameters(index = "1", paramLabel = "FROM", description = "Start node id")
    private String from;

    @Parameters(index = "2", paramLabel = "TO", description = "End node id")
    private String to;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        Subgraph subgraph =
                engine.getAnalyzer().subgraph(document, NodeId.parse(from), NodeId.parse(to));

        print(
                subgraph,
                () -> {
                    if (subgraph.isEmpty()) {
                        System.out.println("No path found from " + from + " to " + to);
                        return;
                    }
                    System.out.println(styles().bold("Subgraph: [" + from + "] -> [" + to + "]"));
                    System.out.println("Nodes: " + subgraph.nodes().size());
                    System.out.println(styles().rule());

                    Map<NodeId, NodeRole> roles =
                            engine.getAnalyzer().roles(document, subgraph.nodes());
                    Map<String, List<NodeId>> byRole = new TreeMap<>();
                    roles.forEach(
                            (id, role) ->
                                    byRole.computeIfAbsent(role.label(), k -> new ArrayList<>())
                                            .add(id));
                    byRole.forEach(
                            (role, ids) -> {
                                System.out.println();
                                System.out.println("  " + role + ":");
                                ids.forEach(
                                        id -> System.out.println("    " + describe(document, id)));
                            });
                });
        return ExitCode.OK;
    }
}
