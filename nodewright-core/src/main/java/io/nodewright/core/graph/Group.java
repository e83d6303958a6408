package io.nodewright.core.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Named rectangular region of the canvas. Purely cosmetic: read by
/// verification and diff, never altered by the engine.
///
/// @param title group title, never null (may be empty)
/// @param bounding `[x, y, width, height]`, never null (may be empty)
/// @param nodeIds nodes the group explicitly references, never null
/// @param attributes remaining serialized fields, preserved verbatim
public record Group(
        String title, List<Double> bounding, List<NodeId> nodeIds, Map<String, Object> attributes) {

    public Group {
        Objects.requireNonNull(title, "title must not be null");
        bounding = bounding != null ? List.copyOf(bounding) : List.of();
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
        attributes = Attributes.copyOf(attributes);
    }
}
