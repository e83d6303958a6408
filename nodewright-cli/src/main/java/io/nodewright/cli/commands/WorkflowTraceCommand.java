package io.nodewright.cli.commands;

import io.nodewright.core.analysis.TraceReport;
import io.nodewright.core.analysis.TraceReport.InputTrace;
import io.nodewright.core.analysis.TraceReport.OutputTrace;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.SlotRef;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Prints what feeds a node and what it feeds, following variable pairs
/// back to the real producer.
@Command(name = "trace", description = "Trace connections to and from a node")
class WorkflowTraceCommand extends ReportCommand {

    @Parameters(index = "1", paramLabel = "NODE", description = "Node id")
    private String nodeId;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        TraceReport report = engine.getAnalyzer().trace(document, NodeId.parse(nodeId));

        print(report, () -> printTrace(document, report));
        return ExitCode.OK;
    }

    private void printTrace(WorkflowDocument document, TraceReport report) {
        System.out.println(styles().bold(report.node().displayName()));
        System.out.println();
        System.out.println("  INPUTS (what feeds into this node):");
        for (InputTrace input : report.inputs()) {
            String prefix = "    [" + input.slot() + "] " + input.name() + " <- ";
            if (input.source() != null) {
                SlotRef source = input.source();
                String line =
                        prefix
                                + describe(document, source.nodeId())
                                + " (slot "
                                + source.slot()
                                + ")";
                if (input.variableKey() != null) {
                    line += styles().gray(" via '" + input.variableKey() + "' " + input.via());
                }
                System.out.println(line);
            } else if (input.brokenLink() != null) {
                System.out.println(
                        prefix + styles().gray("(missing link " + input.brokenLink() + ")"));
            } else {
                System.out.println(prefix + styles().gray("(unconnected)"));
            }
        }

        System.out.println();
        System.out.println("  OUTPUTS (what this node feeds into):");
        for (OutputTrace out : report.outputs()) {
            String prefix = "    [" + out.slot() + "] " + out.name() + " -> ";
            if (out.targets().isEmpty()) {
                System.out.println(prefix + styles().gray("(unconnected)"));
            }
            for (SlotRef target : out.targets()) {
                System.out.println(
                        prefix
                                + describe(document, target.nodeId())
                                + " (slot "
                                + target.slot()
                                + ")");
            }
        }
    }
}
