package io.nodewright.core.exception;

import java.io.Serial;

/// Thrown when a batch script line is malformed or references an undefined
/// `$name` binding.
public class BatchScriptException extends WorkflowGraphException {

    @Serial private static final long serialVersionUID = -1906345590183927742L;

    private final int lineNumber;

    /// Creates exception for a script line.
    ///
    /// @param lineNumber 1-based line number in the script
    /// @param message description of the problem, not null
    public BatchScriptException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /// @return 1-based line number of the failing line
    public int getLineNumber() {
        return lineNumber;
    }
}
