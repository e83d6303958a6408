package io.nodewright.cli.commands;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.schema.SlotDeclaration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Creates an unconnected node. Slots default to the known schema of the type.
@Command(name = "create", description = "Create a new node")
class WorkflowCreateCommand extends MutatingCommand {

    @Parameters(index = "1", paramLabel = "TYPE", description = "Node type")
    private String type;

    @Option(
            names = {"-t", "--title"},
            description = "Node title")
    private String title;

    @Option(
            names = {"-i", "--input"},
            paramLabel = "NAME:TYPE",
            description = "Input slot declaration (repeatable)")
    private List<String> inputs = new ArrayList<>();

    @Option(
            names = {"-O", "--output-slot"},
            paramLabel = "NAME:TYPE",
            description = "Output slot declaration (repeatable)")
    private List<String> outputs = new ArrayList<>();

    @Option(
            names = {"-s", "--set"},
            paramLabel = "KEY=VALUE",
            description = "Initial widget value (repeatable)")
    private Map<String, String> assignments;

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        List<SlotDeclaration> inputSlots;
        List<SlotDeclaration> outputSlots;
        try {
            inputSlots = inputs.stream().map(SlotDeclaration::parse).toList();
            outputSlots = outputs.stream().map(SlotDeclaration::parse).toList();
        } catch (IllegalArgumentException e) {
            System.err.println(styles().fail(e.getMessage()));
            return abort(ExitCode.USAGE);
        }
        EditResult result =
                engine.getEditor()
                        .create(
                                document,
                                type,
                                title,
                                inputSlots,
                                outputSlots,
                                widgetValues(assignments));
        String id = result.createdNode().map(NodeId::toString).orElse("?");
        return Mutation.of(result, "Created [" + id + "] " + type);
    }
}
