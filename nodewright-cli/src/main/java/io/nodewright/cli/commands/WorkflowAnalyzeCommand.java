package io.nodewright.cli.commands;

import io.nodewright.core.analysis.Pipeline;
import io.nodewright.core.analysis.WorkflowStructure;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.variable.LoopConstruct;
import io.nodewright.core.variable.VariableBinding;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;

/// Prints the structural overview: primary inputs and outputs, the main
/// pipeline, model loaders, variables and loops.
@Command(name = "analyze", description = "Analyze workflow structure")
class WorkflowAnalyzeCommand extends ReportCommand {

    private static final int MAX_PIPELINE = 10;
    private static final int MAX_LOADERS = 5;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        WorkflowStructure structure = engine.getAnalyzer().structure(document);

        print(structure, () -> printStructure(document, structure));
        return ExitCode.OK;
    }

    private void printStructure(WorkflowDocument document, WorkflowStructure structure) {
        System.out.println(styles().rule());
        System.out.println(styles().bold("WORKFLOW ANALYSIS: " + structure.kind() + " Pipeline"));
        System.out.println(styles().rule());

        section(document, "PRIMARY INPUTS", structure.primaryInputs(), Integer.MAX_VALUE);
        section(document, "PRIMARY OUTPUTS", structure.primaryOutputs(), Integer.MAX_VALUE);

        structure.pipelines().stream()
                .max(Comparator.comparingInt(p -> p.path().size()))
                .map(Pipeline::path)
                .ifPresent(path -> section(document, "MAIN PIPELINE", path, MAX_PIPELINE));

        section(document, "MODEL LOADERS", structure.modelLoaders(), MAX_LOADERS);

        if (!structure.variables().isEmpty()) {
            System.out.println();
            System.out.println(styles().bold("VARIABLES (" + structure.variables().size() + ")"));
            for (VariableBinding binding : structure.variables()) {
                String source =
                        binding.resolvedSource().map(Object::toString).orElse("unresolved");
                System.out.println(
                        "   "
                                + binding.key()
                                + ": "
                                + binding.storeId()
                                + " <- "
                                + source
                                + ", read by "
                                + binding.fetchIds());
            }
        }
        if (!structure.loops().isEmpty()) {
            System.out.println();
            System.out.println(styles().bold("LOOPS (" + structure.loops().size() + ")"));
            for (LoopConstruct loop : structure.loops()) {
                String end = loop.end().map(NodeId::toString).orElse("unclosed");
                String iterations =
                        loop.iterations() != null
                                ? loop.iterations() + " iterations"
                                : "iterations from " + loop.iterationSource();
                System.out.println(
                        "   "
                                + describe(document, loop.startId())
                                + " .. "
                                + end
                                + " ("
                                + loop.body().size()
                                + " nodes, "
                                + iterations
                                + ")");
            }
        }
        structure.warnings().forEach(w -> System.out.println(styles().warn(w)));
    }

    private void section(WorkflowDocument document, String title, List<NodeId> ids, int limit) {
        if (ids.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(styles().bold(title + " (" + ids.size() + ")"));
        ids.stream().limit(limit).forEach(id -> System.out.println("   " + describe(document, id)));
        if (ids.size() > limit) {
            System.out.println(styles().gray("   ... (" + (ids.size() - limit) + " more)"));
        }
    }
}
