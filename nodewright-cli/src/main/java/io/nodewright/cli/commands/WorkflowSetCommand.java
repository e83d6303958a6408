package io.nodewright.cli.commands;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Sets widget values on a node. Keys are indexes or widget names; values are
/// parsed as booleans, numbers or strings.
@Command(name = "set", description = "Set widget values on a node")
class WorkflowSetCommand extends MutatingCommand {

    @Parameters(index = "1", paramLabel = "NODE", description = "Node id")
    private String nodeId;

    @Parameters(
            index = "2..*",
            arity = "1..*",
            paramLabel = "KEY=VALUE",
            description = "Values to set")
    private Map<String, String> assignments;

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        NodeId id = NodeId.parse(nodeId);
        EditResult result = engine.getEditor().set(document, id, widgetValues(assignments));
        return Mutation.of(
                result, "Set " + result.changes().size() + " value(s) on [" + id + "]");
    }
}
