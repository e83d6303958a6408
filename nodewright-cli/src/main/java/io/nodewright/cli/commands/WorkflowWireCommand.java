package io.nodewright.cli.commands;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Connects an output slot to an input slot, or removes every link of a node.
///
/// Slots are given by index or name. An input that is already connected has
/// its old link replaced.
@Command(name = "wire", description = "Connect two slots or disconnect a node")
class WorkflowWireCommand extends MutatingCommand {

    @Parameters(
            index = "1..*",
            arity = "0..4",
            paramLabel = "SRC SRC_SLOT DST DST_SLOT",
            description = "Source node, output slot, target node, input slot")
    private List<String> endpoints;

    @Option(
            names = "--disconnect",
            paramLabel = "NODE",
            description = "Remove every link of this node instead")
    private String disconnect;

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        if (disconnect != null) {
            NodeId id = NodeId.parse(disconnect);
            EditResult result = engine.getEditor().disconnect(document, id);
            return Mutation.of(
                    result,
                    "Disconnected [" + id + "] (" + result.removedLinks().size() + " link(s))");
        }
        if (endpoints == null || endpoints.size() != 4) {
            System.err.println(
                    styles().fail("Expected SRC SRC_SLOT DST DST_SLOT, or --disconnect NODE"));
            return abort(ExitCode.USAGE);
        }
        NodeId source = NodeId.parse(endpoints.get(0));
        NodeId target = NodeId.parse(endpoints.get(2));
        EditResult result =
                engine.getEditor()
                        .wire(document, source, endpoints.get(1), target, endpoints.get(3));
        return Mutation.of(
                result,
                "Wired ["
                        + source
                        + "]."
                        + endpoints.get(1)
                        + " "
                        + styles().arrow()
                        + " ["
                        + target
                        + "]."
                        + endpoints.get(3));
    }
}
