package io.nodewright.cli.commands;

import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;

/// Lists nodes whose type contains a pattern, case-insensitively.
@Command(name = "query", description = "Find nodes by type")
class WorkflowQueryCommand extends ReportCommand {

    @Option(
            names = {"-t", "--type"},
            required = true,
            description = "Type name fragment, case-insensitive")
    private String type;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        List<Node> matches = engine.getAnalyzer().query(document, type);

        print(
                matches,
                () -> {
                    if (matches.isEmpty()) {
                        System.out.println("No nodes found");
                    }
                    matches.forEach(node -> System.out.println(node.displayName()));
                });
        return ExitCode.OK;
    }
}
