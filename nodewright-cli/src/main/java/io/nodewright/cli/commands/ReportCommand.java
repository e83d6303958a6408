package io.nodewright.cli.commands;

import io.nodewright.serialization.WorkflowJson;
import picocli.CommandLine.Option;

/// Base class for read-only commands whose report can also be printed as JSON.
public abstract class ReportCommand extends WorkflowCommand {

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    /// Prints `report` as JSON when `--json` is set, otherwise runs `text`.
    protected void print(Object report, Runnable text) {
        if (json) {
            System.out.println(WorkflowJson.toReportJson(report));
        } else {
            text.run();
        }
    }
}
