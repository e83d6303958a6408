package io.nodewright.core.exception;

import java.io.Serial;

/// Thrown when a workflow document cannot be parsed.
///
/// Carries the index of the offending node or link record when the failure
/// can be attributed to one. Indexes are zero-based positions in the
/// document's `nodes` / `links` arrays, not node or link identifiers.
public class WorkflowParseException extends WorkflowGraphException {

    @Serial private static final long serialVersionUID = -2750843416659720413L;

    private final Integer nodeIndex;
    private final Integer linkIndex;

    /// Creates a parse failure not attributable to a specific record.
    ///
    /// @param message human-readable reason, not null
    public WorkflowParseException(String message) {
        this(message, null, null, null);
    }

    /// Creates a parse failure not attributable to a specific record.
    ///
    /// @param message human-readable reason, not null
    /// @param cause the underlying parser exception
    public WorkflowParseException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    private WorkflowParseException(
            String message, Integer nodeIndex, Integer linkIndex, Throwable cause) {
        super(message, cause);
        this.nodeIndex = nodeIndex;
        this.linkIndex = linkIndex;
    }

    /// Creates a parse failure for the node record at `index`.
    ///
    /// @param index zero-based position in the `nodes` array
    /// @param reason what is wrong with the record, not null
    /// @return new exception, never null
    public static WorkflowParseException atNode(int index, String reason) {
        return new WorkflowParseException(
                "Malformed node record at index " + index + ": " + reason, index, null, null);
    }

    /// Creates a parse failure for the link record at `index`.
    ///
    /// @param index zero-based position in the `links` array
    /// @param reason what is wrong with the record, not null
    /// @return new exception, never null
    public static WorkflowParseException atLink(int index, String reason) {
        return new WorkflowParseException(
                "Malformed link record at index " + index + ": " + reason, null, index, null);
    }

    /// @return index of the offending node record, or null if not node-specific
    public Integer getNodeIndex() {
        return nodeIndex;
    }

    /// @return index of the offending link record, or null if not link-specific
    public Integer getLinkIndex() {
        return linkIndex;
    }
}
