package io.nodewright.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Declared shape of a node type: its input slots, output slots and widgets.
///
/// Consulted when resolving slot names to indexes, when creating nodes of a
/// known type, and when assigning widget values by name on positional widgets.
///
/// @param typeName declared type name, never null
/// @param inputs declared input slots in order, never null
/// @param outputs declared output slots in order, never null
/// @param widgets declared widget names in positional order, never null
/// @param defaults default widget values aligned with `widgets`, never null
public record NodeSchema(
        String typeName,
        List<SlotDeclaration> inputs,
        List<SlotDeclaration> outputs,
        List<String> widgets,
        List<Object> defaults) {

    public NodeSchema {
        Objects.requireNonNull(typeName, "typeName must not be null");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        widgets = widgets != null ? List.copyOf(widgets) : List.of();
        defaults =
                defaults != null
                        ? Collections.unmodifiableList(new ArrayList<>(defaults))
                        : List.of();
    }

    /// Returns the positional index of a named widget.
    ///
    /// @param name widget name, case-insensitive, not null
    /// @return zero-based index, or -1 if the schema declares no such widget
    public int widgetIndex(String name) {
        for (int i = 0; i < widgets.size(); i++) {
            if (widgets.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    public static Builder builder(String typeName) {
        return new Builder(typeName);
    }

    /// Fluent builder for schemas declared in code.
    public static final class Builder {
        private final String typeName;
        private final List<SlotDeclaration> inputs = new ArrayList<>();
        private final List<SlotDeclaration> outputs = new ArrayList<>();
        private final List<String> widgets = new ArrayList<>();
        private final List<Object> defaults = new ArrayList<>();

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        public Builder input(String name, String type) {
            inputs.add(new SlotDeclaration(name, type));
            return this;
        }

        public Builder output(String name, String type) {
            outputs.add(new SlotDeclaration(name, type));
            return this;
        }

        /// Declares the next positional widget and its default value.
        public Builder widget(String name, Object defaultValue) {
            widgets.add(name);
            defaults.add(defaultValue);
            return this;
        }

        public NodeSchema build() {
            return new NodeSchema(typeName, inputs, outputs, widgets, defaults);
        }
    }
}
