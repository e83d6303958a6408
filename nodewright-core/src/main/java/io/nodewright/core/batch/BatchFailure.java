package io.nodewright.core.batch;

import io.nodewright.core.exception.WorkflowGraphException;
import java.util.Objects;

/// The line that aborted a batch run.
///
/// @param lineNumber 1-based script line
/// @param line the line's text
/// @param cause the error it raised
public record BatchFailure(int lineNumber, String line, WorkflowGraphException cause) {

    public BatchFailure {
        Objects.requireNonNull(cause, "cause must not be null");
    }

    public String message() {
        return cause.getMessage();
    }
}
