package io.nodewright.cli.commands;

import io.nodewright.core.analysis.Closure;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Lists everything that depends on a node.
@Command(name = "downstream", description = "Show all nodes downstream of a node")
class WorkflowDownstreamCommand extends ClosureCommand {

    @Option(
            names = {"-O", "--output-slot"},
            description = "Only follow this output slot (name or index) on the first hop")
    private String outputSlot;

    @Override
    protected String heading() {
        return "Downstream";
    }

    @Override
    protected Closure traverse(WorkflowDocument document, NodeId origin, int maxDepth)
            throws WorkflowGraphException {
        return engine.getAnalyzer().downstream(document, origin, maxDepth, outputSlot);
    }
}
