package io.nodewright.core.schema;

import java.util.Objects;

/// Declared name and type tag of one slot in a node type's schema.
///
/// @param name slot name, never null
/// @param type type tag, never null
public record SlotDeclaration(String name, String type) {

    public SlotDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /// Parses a `name:TYPE` declaration. A missing type becomes the wildcard `*`.
    ///
    /// @param spec declaration text, not null
    /// @return parsed declaration, never null
    /// @throws IllegalArgumentException if the name part is blank
    public static SlotDeclaration parse(String spec) {
        int colon = spec.indexOf(':');
        String name = colon >= 0 ? spec.substring(0, colon).trim() : spec.trim();
        String type = colon >= 0 ? spec.substring(colon + 1).trim() : "*";
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Slot declaration '" + spec + "' has no name");
        }
        return new SlotDeclaration(name, type.isEmpty() ? "*" : type);
    }
}
