package io.nodewright.core.graph;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/// Compatibility rules for slot and link type tags.
///
/// Tags compare case-insensitively. `*` (or an empty tag) matches anything,
/// and a comma-separated tag such as `INT,FLOAT` matches any of its members.
public final class TypeTags {

    public static final String WILDCARD = "*";

    private TypeTags() {}

    /// Tests whether a value of type `source` may flow into a slot of type `target`.
    ///
    /// @param source type tag of the producing output slot, may be null
    /// @param target type tag of the consuming input slot, may be null
    /// @return true when the tags are compatible
    public static boolean compatible(String source, String target) {
        if (isWildcard(source) || isWildcard(target)) {
            return true;
        }
        Set<String> sourceTags = members(source);
        for (String tag : members(target)) {
            if (sourceTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWildcard(String tag) {
        return tag == null || tag.isBlank() || WILDCARD.equals(tag.trim());
    }

    private static Set<String> members(String tag) {
        return Arrays.stream(tag.split(","))
                .map(part -> part.trim().toUpperCase(Locale.ROOT))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.toSet());
    }
}
