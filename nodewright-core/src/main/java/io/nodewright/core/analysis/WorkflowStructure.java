package io.nodewright.core.analysis;

import io.nodewright.core.graph.NodeId;
import io.nodewright.core.variable.LoopConstruct;
import io.nodewright.core.variable.VariableBinding;
import java.util.List;

/// Structural overview of a document.
///
/// @param entryPoints nodes with no connected input, visual nodes and resolved fetch nodes excluded
/// @param exitPoints nodes with no connected output, visual nodes and consumed stores excluded
/// @param primaryInputs entry points loading images or video
/// @param modelLoaders entry points loading models, VAEs or LoRAs
/// @param primaryOutputs exit points saving or combining results
/// @param kind `Video` or `General`
/// @param pipelines main chain per exit point
/// @param variables store/fetch bindings
/// @param loops loop constructs
/// @param warnings variable resolution warnings
public record WorkflowStructure(
        List<NodeId> entryPoints,
        List<NodeId> exitPoints,
        List<NodeId> primaryInputs,
        List<NodeId> modelLoaders,
        List<NodeId> primaryOutputs,
        String kind,
        List<Pipeline> pipelines,
        List<VariableBinding> variables,
        List<LoopConstruct> loops,
        List<String> warnings) {

    public WorkflowStructure {
        entryPoints = List.copyOf(entryPoints);
        exitPoints = List.copyOf(exitPoints);
        primaryInputs = List.copyOf(primaryInputs);
        modelLoaders = List.copyOf(modelLoaders);
        primaryOutputs = List.copyOf(primaryOutputs);
        pipelines = List.copyOf(pipelines);
        variables = List.copyOf(variables);
        loops = List.copyOf(loops);
        warnings = List.copyOf(warnings);
    }
}
