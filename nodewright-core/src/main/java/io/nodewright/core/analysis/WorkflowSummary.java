package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Pattern label, headline parameters and stats of a document.
///
/// @param pattern space-separated label, e.g. `SDXL txt2img +LoRA`
/// @param parameters headline parameter name to value, in rule order
/// @param flows main flows from entry to exit nodes, at most five
/// @param nodeCount number of nodes
/// @param linkCount number of links
public record WorkflowSummary(
        String pattern,
        Map<String, Object> parameters,
        List<List<NodeId>> flows,
        int nodeCount,
        int linkCount) {

    public WorkflowSummary {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        flows = flows.stream().map(List::copyOf).toList();
    }
}
