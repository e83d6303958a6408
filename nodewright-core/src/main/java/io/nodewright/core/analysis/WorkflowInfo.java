package io.nodewright.core.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Basic document statistics.
///
/// @param nodeCount number of nodes
/// @param linkCount number of links
/// @param groupCount number of groups
/// @param lastNodeId the document's node id counter
/// @param lastLinkId the document's link id counter
/// @param typeCounts node count per type, most frequent first
public record WorkflowInfo(
        int nodeCount,
        int linkCount,
        int groupCount,
        long lastNodeId,
        int lastLinkId,
        Map<String, Integer> typeCounts) {

    public WorkflowInfo {
        typeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(typeCounts));
    }
}
