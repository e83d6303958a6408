package io.nodewright.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Literal parameters of a node that are not carried over a link.
///
/// Authoring tools store widget values either positionally (a JSON array, the
/// common case) or keyed by name (a JSON object, used by some extension
/// packs). The representation is preserved as loaded; {@link #with} edits the
/// same representation.
///
/// @implNote Immutable. Nested lists and maps are copied on construction.
public final class WidgetValues {

    /// Storage shape of a node's widget values.
    public enum Layout {
        /// No `widgets_values` field on the node.
        ABSENT,
        /// Ordered list addressed by index.
        POSITIONAL,
        /// Map addressed by key.
        KEYED
    }

    private static final WidgetValues ABSENT = new WidgetValues(Layout.ABSENT, List.of(), Map.of());

    private final Layout layout;
    private final List<Object> positional;
    private final Map<String, Object> keyed;

    private WidgetValues(Layout layout, List<Object> positional, Map<String, Object> keyed) {
        this.layout = layout;
        this.positional = positional;
        this.keyed = keyed;
    }

    public static WidgetValues absent() {
        return ABSENT;
    }

    public static WidgetValues positional(List<?> values) {
        return new WidgetValues(Layout.POSITIONAL, Attributes.copyOf(values), Map.of());
    }

    public static WidgetValues keyed(Map<String, Object> values) {
        return new WidgetValues(Layout.KEYED, List.of(), Attributes.copyOf(values));
    }

    public Layout layout() {
        return layout;
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keyed.isEmpty();
    }

    /// @return positional values (empty unless layout is POSITIONAL), never null
    public List<Object> asList() {
        return positional;
    }

    /// @return keyed values (empty unless layout is KEYED), never null
    public Map<String, Object> asMap() {
        return keyed;
    }

    /// Returns the value at a positional index.
    ///
    /// @param index zero-based widget index
    /// @return the value, or null if absent or out of range
    public Object get(int index) {
        return index >= 0 && index < positional.size() ? positional.get(index) : null;
    }

    /// Returns the value stored under a key.
    ///
    /// @param key widget name
    /// @return the value, or null if absent
    public Object get(String key) {
        return keyed.get(key);
    }

    /// Returns a copy with the positional value at `index` replaced.
    ///
    /// Absent widget values become positional. The list is padded with nulls
    /// when `index` is past its end.
    ///
    /// @param index zero-based index, not negative
    /// @param value new value, may be null
    /// @return updated values, never null
    /// @throws IllegalStateException if the layout is KEYED
    public WidgetValues with(int index, Object value) {
        if (layout == Layout.KEYED) {
            throw new IllegalStateException("Keyed widget values cannot be addressed by index");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Widget index must not be negative: " + index);
        }
        List<Object> updated = new ArrayList<>(positional);
        while (updated.size() <= index) {
            updated.add(null);
        }
        updated.set(index, value);
        return positional(updated);
    }

    /// Returns a copy with the keyed value for `key` replaced or added.
    ///
    /// Absent widget values become keyed.
    ///
    /// @param key widget name, not null
    /// @param value new value, may be null
    /// @return updated values, never null
    /// @throws IllegalStateException if the layout is POSITIONAL
    public WidgetValues with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (layout == Layout.POSITIONAL) {
            throw new IllegalStateException("Positional widget values cannot be addressed by key");
        }
        Map<String, Object> updated = new LinkedHashMap<>(keyed);
        updated.put(key, value);
        return keyed(updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WidgetValues other)) return false;
        return layout == other.layout
                && positional.equals(other.positional)
                && keyed.equals(other.keyed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layout, positional, keyed);
    }

    @Override
    public String toString() {
        return switch (layout) {
            case ABSENT -> "[]";
            case POSITIONAL -> positional.toString();
            case KEYED -> keyed.toString();
        };
    }
}
