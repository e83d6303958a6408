package io.nodewright.cli.commands;

import io.nodewright.core.analysis.Violation;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;

/// Checks link and slot bookkeeping. Exits with 1 when violations are found.
@Command(name = "verify", description = "Verify workflow integrity")
class WorkflowVerifyCommand extends ReportCommand {

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        List<Violation> violations = engine.getAnalyzer().verify(document);

        print(
                violations,
                () -> {
                    if (violations.isEmpty()) {
                        System.out.println(styles().ok("Workflow integrity OK"));
                        return;
                    }
                    System.out.println(styles().fail("Found " + violations.size() + " issues:"));
                    System.out.println();
                    violations.forEach(v -> System.out.println("  - " + v));
                });
        return violations.isEmpty() ? ExitCode.OK : ExitCode.SOFTWARE;
    }
}
