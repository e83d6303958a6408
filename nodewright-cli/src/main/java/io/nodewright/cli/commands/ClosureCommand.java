package io.nodewright.cli.commands;

import io.nodewright.core.analysis.Closure;
import io.nodewright.core.analysis.GraphAnalyzer;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.Edge;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Shared listing for `upstream` and `downstream`: one line per traversed
/// edge, with the origin marked `<<<`.
abstract class ClosureCommand extends ReportCommand {

    @Parameters(index = "1", paramLabel = "NODE", description = "Node id")
    private String nodeId;

    @Option(
            names = {"-d", "--depth"},
            description = "Maximum number of hops (default: unlimited)")
    private Integer depth;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        NodeId origin = NodeId.parse(nodeId);
        int maxDepth = depth != null ? depth : GraphAnalyzer.UNBOUNDED;
        Closure closure = traverse(document, origin, maxDepth);

        print(
                closure,
                () -> {
                    System.out.println();
                    System.out.println(
                            styles().bold(heading() + " of " + describe(document, origin) + ":"));
                    System.out.println(styles().rule());
                    for (Edge edge : closure.edges()) {
                        System.out.println(formatEdge(document, edge, origin));
                    }
                    System.out.println();
                    System.out.println(
                            "Total: "
                                    + closure.depths().size()
                                    + " nodes, "
                                    + closure.edges().size()
                                    + " links");
                });
        return ExitCode.OK;
    }

    protected abstract String heading();

    protected abstract Closure traverse(WorkflowDocument document, NodeId origin, int maxDepth)
            throws WorkflowGraphException;

    /// Formats `[src] Type.output --(TYPE)--> [dst] Type.input`.
    private String formatEdge(WorkflowDocument document, Edge edge, NodeId origin) {
        String source = endpoint(document, edge.sourceId(), edge.sourceSlot(), false);
        String target = endpoint(document, edge.targetId(), edge.targetSlot(), true);
        boolean touchesOrigin = edge.sourceId().equals(origin) || edge.targetId().equals(origin);
        String marker = touchesOrigin ? " <<<" : "";
        String via = edge.isVirtual() ? styles().gray(" (variable)") : "";
        return source + " --(" + edge.type() + ")--> " + target + via + marker;
    }

    private String endpoint(WorkflowDocument document, NodeId id, int slot, boolean input) {
        String slotName =
                document.findNode(id)
                        .map(node -> slotName(node, slot, input))
                        .orElse(String.valueOf(slot));
        return styles().accent("[" + id + "] " + typeOf(document, id)) + "." + slotName;
    }

    private static String slotName(Node node, int slot, boolean input) {
        if (input) {
            return slot < node.getInputs().size() ? node.input(slot).name() : String.valueOf(slot);
        }
        return slot < node.getOutputs().size() ? node.output(slot).name() : String.valueOf(slot);
    }
}
