package io.nodewright.cli.commands;

import io.nodewright.core.edit.DeletePlan;
import io.nodewright.core.edit.EditResult;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Deletes nodes and every link touching them.
///
/// With `--cascade`, nodes that no longer have a surviving source are deleted as well.
@Command(name = "delete", description = "Delete nodes")
class WorkflowDeleteCommand extends MutatingCommand {

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "NODE", description = "Node ids")
    private List<String> nodeIds;

    @Option(
            names = "--cascade",
            description = "Also delete nodes left without a surviving source")
    private boolean cascade;

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        List<NodeId> ids = nodeIds.stream().map(NodeId::parse).toList();
        if (dryRun) {
            printPlan(document, engine.getEditor().planDelete(document, ids, cascade));
        }
        EditResult result = engine.getEditor().delete(document, ids, cascade);
        return Mutation.of(result, "Deleted " + result.deletedNodes().size() + " node(s)");
    }

    private void printPlan(WorkflowDocument document, DeletePlan plan) {
        System.out.println(styles().bold("Would delete " + plan.nodes().size() + " node(s):"));
        for (NodeId id : plan.nodes()) {
            String marker = plan.requested().contains(id) ? "" : styles().gray(" (cascade)");
            System.out.println("  - " + describe(document, id) + marker);
        }
        System.out.println("Would remove " + plan.removedLinks().size() + " link(s)");
        if (!plan.orphanedInputs().isEmpty()) {
            System.out.println("Inputs left unconnected:");
            for (DeletePlan.OrphanedInput orphan : plan.orphanedInputs()) {
                System.out.println(
                        "  ! ["
                                + orphan.nodeId()
                                + "] "
                                + orphan.nodeType()
                                + "."
                                + orphan.name()
                                + " (was fed by ["
                                + orphan.formerSource()
                                + "] "
                                + orphan.formerSourceType()
                                + ")");
            }
        }
        System.out.println();
    }
}
