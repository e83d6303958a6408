package io.nodewright.cli.commands;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.edit.InlinePlan;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.WorkflowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;

/// Replaces resolved SetNode/GetNode pairs with direct links.
@Command(name = "inline", description = "Replace variable nodes with direct links")
class WorkflowInlineCommand extends MutatingCommand {

    @Override
    protected Mutation mutate(WorkflowDocument document) throws WorkflowGraphException {
        InlinePlan plan = engine.getEditor().planInline(document);
        if (plan.isEmpty()) {
            System.out.println("No SetNode/GetNode pairs found");
            plan.warnings().forEach(w -> System.out.println(styles().warn(w)));
            return abort(ExitCode.OK);
        }
        System.out.println("Found " + plan.pairs().size() + " pairs");
        if (dryRun) {
            System.out.println(
                    "Would delete "
                            + plan.nodesToDelete().size()
                            + " nodes, create "
                            + plan.linksToCreate().size()
                            + " links");
            plan.linksToCreate().forEach(link -> System.out.println("  + " + link));
        }
        EditResult result = engine.getEditor().inline(document);
        return Mutation.of(result, "Inlined " + plan.pairs().size() + " pairs");
    }
}
