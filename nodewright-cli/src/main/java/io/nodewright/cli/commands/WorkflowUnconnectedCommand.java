package io.nodewright.cli.commands;

import io.nodewright.core.analysis.UnconnectedInput;
import io.nodewright.core.analysis.UnconnectedOutput;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;

/// Lists inputs without a link and outputs that feed nothing.
///
/// Without `--inputs` or `--outputs` both are shown. Inputs marked `!` are
/// likely required or reference a missing link; `?` marks optional-looking ones.
@Command(name = "unconnected", description = "Find unconnected inputs and outputs")
class WorkflowUnconnectedCommand extends ReportCommand {

    @Option(names = {"-i", "--inputs"}, description = "Show unconnected inputs")
    private boolean inputs;

    @Option(names = "--outputs", description = "Show unconnected outputs")
    private boolean outputs;

    @Option(names = {"-p", "--primary"}, description = "Only primary (first) inputs")
    private boolean primaryOnly;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        boolean showInputs = inputs || !outputs;
        boolean showOutputs = outputs || !inputs;

        List<UnconnectedInput> orphans =
                showInputs
                        ? engine.getAnalyzer().unconnectedInputs(document, primaryOnly)
                        : List.of();
        List<UnconnectedOutput> dangling =
                showOutputs ? engine.getAnalyzer().unconnectedOutputs(document) : List.of();

        Map<String, Object> report = new LinkedHashMap<>();
        if (showInputs) {
            report.put("inputs", orphans);
        }
        if (showOutputs) {
            report.put("outputs", dangling);
        }
        print(
                report,
                () -> {
                    if (showInputs) {
                        printInputs(orphans);
                    }
                    if (showOutputs) {
                        printOutputs(dangling);
                    }
                });
        return ExitCode.OK;
    }

    private void printInputs(List<UnconnectedInput> orphans) {
        if (orphans.isEmpty()) {
            System.out.println("No unconnected inputs found.");
            return;
        }
        Map<NodeId, List<UnconnectedInput>> byNode = new TreeMap<>();
        orphans.forEach(o -> byNode.computeIfAbsent(o.nodeId(), k -> new ArrayList<>()).add(o));
        System.out.println(
                styles().bold(
                        "Unconnected inputs ("
                                + orphans.size()
                                + " across "
                                + byNode.size()
                                + " nodes):"));
        System.out.println();
        byNode.forEach(
                (id, slots) -> {
                    System.out.println(styles().accent("[" + id + "] " + slots.get(0).nodeType()));
                    for (UnconnectedInput slot : slots) {
                        boolean required = slot.likelyRequired() || slot.brokenLink() != null;
                        String marker = required ? "!" : "?";
                        String broken =
                                slot.brokenLink() != null
                                        ? styles().gray(" (missing link " + slot.brokenLink() + ")")
                                        : "";
                        System.out.println(
                                "  "
                                        + marker
                                        + " ["
                                        + slot.slot()
                                        + "] "
                                        + slot.name()
                                        + ": "
                                        + slot.type()
                                        + broken);
                    }
                    System.out.println();
                });
    }

    private void printOutputs(List<UnconnectedOutput> dangling) {
        if (dangling.isEmpty()) {
            System.out.println("No unconnected outputs found.");
            return;
        }
        Map<NodeId, List<UnconnectedOutput>> byNode = new TreeMap<>();
        dangling.forEach(d -> byNode.computeIfAbsent(d.nodeId(), k -> new ArrayList<>()).add(d));
        System.out.println(
                styles().bold(
                        "Unconnected outputs ("
                                + dangling.size()
                                + " across "
                                + byNode.size()
                                + " nodes):"));
        System.out.println();
        byNode.forEach(
                (id, slots) -> {
                    System.out.println(styles().accent("[" + id + "] " + slots.get(0).nodeType()));
                    for (UnconnectedOutput slot : slots) {
                        System.out.println(
                                "  -> [" + slot.slot() + "] " + slot.name() + ": " + slot.type());
                    }
                    System.out.println();
                });
    }
}
