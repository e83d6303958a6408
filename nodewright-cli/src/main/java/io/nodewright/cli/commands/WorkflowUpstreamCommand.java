package io.nodewright.cli.commands;

import io.nodewright.core.analysis.Closure;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Lists everything a node depends on.
///
/// ### Usage
/// ```bash
/// nodewright upstream <workflow.json> <node> [-i <input>] [-d <depth>] [--json]
/// ```
@Command(name = "upstream", description = "Show all nodes upstream of a node")
class WorkflowUpstreamCommand extends ClosureCommand {

    @Option(
            names = {"-i", "--input"},
            description = "Only follow this input slot (name or index) on the first hop")
    private String input;

    @Override
    protected String heading() {
        return "Upstream";
    }

    @Override
    protected Closure traverse(WorkflowDocument document, NodeId origin, int maxDepth)
            throws WorkflowGraphException {
        return engine.getAnalyzer().upstream(document, origin, maxDepth, input);
    }
}
