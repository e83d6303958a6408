package io.nodewright.core.analysis;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/// Functional role of a node, used to group nodes in subgraph listings.
///
/// Classification looks at the type name first and falls back to the data
/// types flowing in and out of the node.
public enum NodeRole {
    INPUT("INPUT"),
    OUTPUT("OUTPUT"),
    UPSCALING("UPSCALING"),
    ENHANCEMENT("ENHANCEMENT"),
    ENCODING("ENCODING"),
    DECODING("DECODING"),
    SAMPLING("SAMPLING"),
    MATH_LOGIC("MATH/LOGIC"),
    ROUTING("ROUTING"),
    VARIABLES("VARIABLES"),
    CONTROL_FLOW("CONTROL_FLOW"),
    CONFIGURATION("CONFIGURATION"),
    DATA_HANDLING("DATA_HANDLING"),
    MODEL_LOADING("MODEL_LOADING"),
    LATENT_PROCESSING("LATENT_PROCESSING"),
    IMAGE_PROCESSING("IMAGE_PROCESSING"),
    PROCESSING("PROCESSING");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Classifies a node.
    ///
    /// @param type node type name, not null
    /// @param inTypes type tags of edges entering the node, not null
    /// @param outTypes type tags of edges leaving the node, not null
    /// @return the role, never null
    public static NodeRole classify(
            String type, Collection<String> inTypes, Collection<String> outTypes) {
        String t = type.toLowerCase(Locale.ROOT);
        if (t.contains("load") && (t.contains("video") || t.contains("image"))) return INPUT;
        if (t.contains("save") || t.contains("combine") || t.contains("output")) return OUTPUT;
        if (t.contains("upscale") || t.contains("resize")) return UPSCALING;
        if (t.contains("sharpen") || t.contains("blur") || t.contains("enhance")) {
            return ENHANCEMENT;
        }
        if (t.contains("encode")) return ENCODING;
        if (t.contains("decode")) return DECODING;
        if (t.contains("sample")) return SAMPLING;
        if (t.contains("math") || t.contains("expression") || t.contains("calc")) return MATH_LOGIC;
        if (t.contains("switch") || t.contains("select") || t.contains("mux")) return ROUTING;
        if (t.contains("getnode") || t.contains("setnode")) return VARIABLES;
        if (t.contains("loop")) return CONTROL_FLOW;
        if (t.contains("context") || t.contains("options") || t.contains("config")) {
            return CONFIGURATION;
        }
        if (t.contains("get") && t.contains("size")) return DATA_HANDLING;
        if (t.contains("load")) return MODEL_LOADING;

        Set<String> in = upper(inTypes);
        Set<String> out = upper(outTypes);
        if (in.contains("LATENT") || out.contains("LATENT")) return LATENT_PROCESSING;
        if (in.contains("IMAGE") && out.contains("IMAGE")) return IMAGE_PROCESSING;
        if (out.contains("MODEL") || out.contains("VAE") || out.contains("CLIP")) {
            return MODEL_LOADING;
        }
        return PROCESSING;
    }

    private static Set<String> upper(Collection<String> types) {
        return types.stream()
                .filter(s -> s != null && !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
