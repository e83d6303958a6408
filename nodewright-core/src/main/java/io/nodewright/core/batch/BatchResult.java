package io.nodewright.core.batch;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Outcome of a batch run.
///
/// Runs are not transactional. When a line fails, {@link #document()} holds
/// the state after the last successful line and {@link #failure()} names the
/// failing one. A dry run always reports the input document unchanged.
///
/// @param document resulting document, never null
/// @param dryRun whether the run was a dry run
/// @param linesExecuted number of lines that completed
/// @param bindings `$name` bindings at the end of the run
/// @param edits results of the editing lines, in order
/// @param details one human-readable line per effect
/// @param warnings non-fatal problems, prefixed with their line number
/// @param failureOrNull the aborting line, null if every line succeeded
public record BatchResult(
        WorkflowDocument document,
        boolean dryRun,
        int linesExecuted,
        Map<String, NodeId> bindings,
        List<EditResult> edits,
        List<String> details,
        List<String> warnings,
        BatchFailure failureOrNull) {

    public BatchResult {
        Objects.requireNonNull(document, "document must not be null");
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        edits = List.copyOf(edits);
        details = List.copyOf(details);
        warnings = List.copyOf(warnings);
    }

    public Optional<BatchFailure> failure() {
        return Optional.ofNullable(failureOrNull);
    }

    public boolean isSuccess() {
        return failureOrNull == null;
    }
}
