package io.nodewright.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the nodewright CLI.
///
/// Read-only analysis:
/// - `info`, `analyze`, `summary` - overview, structure and one-line pattern
/// - `query`, `values`, `trace` - find nodes by type, show widget values and connections
/// - `upstream`, `downstream`, `path`, `subgraph` - dependency traversal
/// - `unconnected`, `verify`, `diff` - dangling slots, integrity, comparison
///
/// Editing (write a new file with `-o`, never overwrite):
/// - `copy`, `create`, `delete`, `wire`, `set`, `inline`
/// - `batch` - run an edit script
///
/// Exit codes: `0` success, `1` failure, `2` usage error.
@TopCommand
@Command(
        name = "nodewright",
        description = "Inspect and edit node-graph workflow files",
        mixinStandardHelpOptions = true,
        subcommands = {
            WorkflowInfoCommand.class,
            WorkflowAnalyzeCommand.class,
            WorkflowSummaryCommand.class,
            WorkflowQueryCommand.class,
            WorkflowValuesCommand.class,
            WorkflowTraceCommand.class,
            WorkflowUpstreamCommand.class,
            WorkflowDownstreamCommand.class,
            WorkflowPathCommand.class,
            WorkflowSubgraphCommand.class,
            WorkflowUnconnectedCommand.class,
            WorkflowVerifyCommand.class,
            WorkflowDiffCommand.class,
            WorkflowCopyCommand.class,
            WorkflowCreateCommand.class,
            WorkflowDeleteCommand.class,
            WorkflowWireCommand.class,
            WorkflowSetCommand.class,
            WorkflowInlineCommand.class,
            WorkflowBatchCommand.class
        })
public class NodewrightCLI {}
