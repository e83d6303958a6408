package io.nodewright.cli.commands;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Copies a node without its links, optionally retitled and with widget overrides.
@Command(name = "copy", description = "Copy a node")
class WorkflowCopyCommand extends MutatingCommand {

    @Parameters(index = "1", paramLabel = "NODE", description = "Node to copy")
    private String nodeId;

    @Option(
            names = {"-t", "--title"},
            description = "Title of the copy")
    private String title;

    @Option(
            names = {"-s", "--set"},
            paramLabel = "KEY=VALUE",
            description = "Widget override by index or name (repeatable)")
    private Map<String, String> assignments;

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        NodeId source = NodeId.parse(nodeId);
        EditResult result =
                engine.getEditor().copy(document, source, title, widgetValues(assignments));
        String copyId = result.createdNode().map(NodeId::toString).orElse("?");
        return Mutation.of(result, "Copied [" + source + "] as [" + copyId + "]");
    }
}
