package io.nodewright.core.schema;

import io.nodewright.core.exception.SlotException;
import io.nodewright.core.graph.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Resolves textual slot references to slot indexes on a concrete node.
///
/// A reference is tried, in order, as a numeric index, as a slot name, as a
/// slot type tag, and finally as a slot name declared by the node type's
/// schema. Name and type matching ignore case.
public final class SlotResolver {

    private final NodeSchemaRegistry registry;

    public SlotResolver(NodeSchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// @throws SlotException if the reference matches no input slot
    public int resolveInput(Node node, String spec) throws SlotException {
        List<String[]> slots = new ArrayList<>();
        node.getInputs().forEach(slot -> slots.add(new String[] {slot.name(), slot.type()}));
        List<SlotDeclaration> declared =
                registry.get(node.getType()).map(NodeSchema::inputs).orElse(List.of());
        return resolve(node, spec, slots, declared, "input");
    }

    /// @throws SlotException if the reference matches no output slot
    public int resolveOutput(Node node, String spec) throws SlotException {
        List<String[]> slots = new ArrayList<>();
        node.getOutputs().forEach(slot -> slots.add(new String[] {slot.name(), slot.type()}));
        List<SlotDeclaration> declared =
                registry.get(node.getType()).map(NodeSchema::outputs).orElse(List.of());
        return resolve(node, spec, slots, declared, "output");
    }

    private static int resolve(
            Node node,
            String spec,
            List<String[]> slots,
            List<SlotDeclaration> declared,
            String direction)
            throws SlotException {
        Objects.requireNonNull(spec, "spec must not be null");
        String trimmed = spec.trim();
        if (isInteger(trimmed)) {
            long index = parseIndex(trimmed);
            if (index >= 0 && index < slots.size()) {
                return (int) index;
            }
            throw new SlotException(
                    node.getId(),
                    spec,
                    direction
                            + " slot "
                            + trimmed
                            + " out of range on "
                            + node.displayName()
                            + " (available: "
                            + describe(slots)
                            + ")");
        }
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i)[0].equalsIgnoreCase(trimmed)) {
                return i;
            }
        }
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i)[1].equalsIgnoreCase(trimmed)) {
                return i;
            }
        }
        for (int i = 0; i < declared.size() && i < slots.size(); i++) {
            if (declared.get(i).name().equalsIgnoreCase(trimmed)) {
                return i;
            }
        }
        throw new SlotException(
                node.getId(),
                spec,
                direction
                        + " slot '"
                        + spec
                        + "' not found on "
                        + node.displayName()
                        + " (available: "
                        + describe(slots)
                        + ")");
    }

    /// Saturates on overflow so an oversized index reports as out of range.
    private static long parseIndex(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return digits.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private static boolean isInteger(String text) {
        if (text.isEmpty()) {
            return false;
        }
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String describe(List<String[]> slots) {
        if (slots.isEmpty()) {
            return "none";
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            parts.add(i + ":" + slots.get(i)[0]);
        }
        return String.join(", ", parts);
    }
}
