package io.nodewright.core.exception;

import java.io.Serial;

/// Thrown when an operation would leave the graph violating one of its
/// structural invariants. The operation is rejected and the document left unchanged.
public class IntegrityException extends WorkflowGraphException {

    @Serial private static final long serialVersionUID = 2239316651824950367L;

    /// Creates exception with message.
    ///
    /// @param message the violated invariant and offending ids, not null
    public IntegrityException(String message) {
        super(message);
    }
}
