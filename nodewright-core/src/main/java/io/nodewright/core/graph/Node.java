package io.nodewright.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A unit of computation in a workflow graph.
///
/// A node has a declared type name, ordered input and output slots, and widget
/// values. Every other serialized field (position, size, flags, order, mode,
/// properties, colours) is kept in {@link #getAttributes()} so that a
/// load/save round trip is lossless.
///
/// ### Link bookkeeping
/// Slots carry the ids of the links attached to them, mirroring the
/// document's link table. {@link WorkflowDocument} keeps both sides in sync;
/// nodes themselves never validate against the link table.
///
/// @implNote Immutable. Edits produce a new node via {@link #toBuilder()}.
/// @see WorkflowDocument
public final class Node {

    private final NodeId id;
    private final String type;
    private final String title;
    private final List<InputSlot> inputs;
    private final List<OutputSlot> outputs;
    private final WidgetValues widgets;
    private final Map<String, Object> attributes;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.type = Objects.requireNonNull(builder.type, "Node type required");
        this.title = builder.title;
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.widgets = builder.widgets != null ? builder.widgets : WidgetValues.absent();
        this.attributes = Attributes.copyOf(builder.attributes);
    }

    /// @return node identifier, never null
    public NodeId getId() {
        return id;
    }

    /// @return declared type name (e.g. `KSampler`), never null
    public String getType() {
        return type;
    }

    /// @return user-assigned title, or null when the node shows its type name
    public String getTitle() {
        return title;
    }

    /// @return unmodifiable ordered input slots, never null
    public List<InputSlot> getInputs() {
        return inputs;
    }

    /// @return unmodifiable ordered output slots, never null
    public List<OutputSlot> getOutputs() {
        return outputs;
    }

    /// @return widget values, never null (may be {@link WidgetValues.Layout#ABSENT})
    public WidgetValues getWidgets() {
        return widgets;
    }

    /// @return unmodifiable map of remaining serialized fields, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns the input slot at `index`.
    ///
    /// @param index zero-based slot index
    /// @return the slot, or null if out of range
    public InputSlot input(int index) {
        return index >= 0 && index < inputs.size() ? inputs.get(index) : null;
    }

    /// Returns the output slot at `index`.
    ///
    /// @param index zero-based slot index
    /// @return the slot, or null if out of range
    public OutputSlot output(int index) {
        return index >= 0 && index < outputs.size() ? outputs.get(index) : null;
    }

    /// Formats the node for display as `[id] Type "title"`. The title is
    /// omitted when unset or equal to the type.
    ///
    /// @return display string, never null
    public String displayName() {
        if (title != null && !title.isEmpty() && !title.equals(type)) {
            return "[" + id + "] " + type + " \"" + title + "\"";
        }
        return "[" + id + "] " + type;
    }

    /// @return builder initialised with this node's state, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .title(title)
                .inputs(inputs)
                .outputs(outputs)
                .widgets(widgets)
                .attributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link Node}. Required fields: `id`, `type`.
    public static final class Builder {
        private NodeId id;
        private String type;
        private String title;
        private List<InputSlot> inputs = new ArrayList<>();
        private List<OutputSlot> outputs = new ArrayList<>();
        private WidgetValues widgets;
        private Map<String, Object> attributes = Map.of();

        private Builder() {}

        public Builder id(NodeId id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder inputs(List<InputSlot> inputs) {
            this.inputs = new ArrayList<>(inputs);
            return this;
        }

        public Builder input(InputSlot input) {
            this.inputs.add(input);
            return this;
        }

        public Builder outputs(List<OutputSlot> outputs) {
            this.outputs = new ArrayList<>(outputs);
            return this;
        }

        public Builder output(OutputSlot output) {
            this.outputs.add(output);
            return this;
        }

        /// Replaces the input slot at `index`.
        public Builder replaceInput(int index, InputSlot input) {
            this.inputs.set(index, input);
            return this;
        }

        /// Replaces the output slot at `index`.
        public Builder replaceOutput(int index, OutputSlot output) {
            this.outputs.set(index, output);
            return this;
        }

        public Builder widgets(WidgetValues widgets) {
            this.widgets = widgets;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes != null ? attributes : Map.of();
            return this;
        }

        /// @return new node, never null
        /// @throws NullPointerException if id or type is null
        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node node)) return false;
        return id.equals(node.id)
                && type.equals(node.type)
                && Objects.equals(title, node.title)
                && inputs.equals(node.inputs)
                && outputs.equals(node.outputs)
                && widgets.equals(node.widgets)
                && attributes.equals(node.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, title, inputs, outputs, widgets);
    }

    @Override
    public String toString() {
        return "Node{id=" + id + ", type='" + type + "'}";
    }
}
