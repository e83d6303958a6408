package io.nodewright.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deep-copy helpers for loosely-typed JSON-like values (maps, lists, scalars).
///
/// Unlike `Map.copyOf` / `List.copyOf`, these keep null entries, which are
/// common in widget values.
final class Attributes {

    private Attributes() {}

    static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    static List<Object> copyOf(List<?> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<Object> copy = new ArrayList<>(source.size());
        for (Object value : source) {
            copy.add(copyValue(value));
        }
        return Collections.unmodifiableList(copy);
    }

    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyOf((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            return copyOf(list);
        }
        return value;
    }
}
