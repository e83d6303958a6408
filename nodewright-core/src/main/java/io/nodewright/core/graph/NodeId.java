package io.nodewright.core.graph;

import java.util.Objects;

/// Identifier of a node within one workflow document.
///
/// Authoring tools emit integer ids, but some documents use string ids; both
/// are accepted. Numeric ids compare numerically and sort before string ids.
///
/// Identity is textual: the string id `"5"` equals the numeric id `5`, so a
/// node can be addressed and linked by either spelling. The numeric flag only
/// decides how the id is written back.
///
/// @param value textual form of the id, never null or blank
/// @param numeric whether the id was (and will be written back as) an integer
public record NodeId(String value, boolean numeric) implements Comparable<NodeId> {

    public NodeId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
    }

    /// Creates a numeric id.
    ///
    /// @param value integer id
    /// @return new id, never null
    public static NodeId of(long value) {
        return new NodeId(Long.toString(value), true);
    }

    /// Creates a string id.
    ///
    /// @param value textual id, not blank
    /// @return new id, never null
    public static NodeId ofString(String value) {
        return new NodeId(value, false);
    }

    /// Parses a user-supplied id: digits become a numeric id, anything else a string id.
    ///
    /// @param text id as typed, not null
    /// @return parsed id, never null
    public static NodeId parse(String text) {
        String trimmed = text.trim();
        if (trimmed.matches("-?\\d{1,18}")) {
            return of(Long.parseLong(trimmed));
        }
        return ofString(trimmed);
    }

    /// @return the integer value
    /// @throws IllegalStateException if this is a string id
    public long asLong() {
        if (!numeric) {
            throw new IllegalStateException("Node id '" + value + "' is not numeric");
        }
        return Long.parseLong(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NodeId other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(NodeId other) {
        if (value.equals(other.value)) {
            return 0;
        }
        if (numeric && other.numeric) {
            return Long.compare(asLong(), other.asLong());
        }
        if (numeric != other.numeric) {
            return numeric ? -1 : 1;
        }
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
