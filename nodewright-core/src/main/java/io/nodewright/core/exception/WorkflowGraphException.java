package io.nodewright.core.exception;

import java.io.Serial;

/// Base class for every failure raised by the workflow graph engine.
///
/// Subclasses identify the failure kind so callers can decide whether to retry
/// with corrected input:
/// - {@link WorkflowParseException} - malformed input document
/// - {@link NodeNotFoundException} - referenced node is absent
/// - {@link SlotException} - missing slot or type mismatch on wiring
/// - {@link IntegrityException} - operation would break a graph invariant
/// - {@link BatchScriptException} - malformed or failing batch script line
///
/// @implNote Analysis operations never mutate a document, and editing operations
/// work on a copy, so a thrown exception never leaves a document half-edited.
public class WorkflowGraphException extends Exception {

    @Serial private static final long serialVersionUID = 4410627139542238817L;

    /// Creates exception with message.
    ///
    /// @param message description of the failure, not null
    public WorkflowGraphException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failure, not null
    /// @param cause the underlying exception
    public WorkflowGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
