package io.nodewright.core;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Configuration of the naming conventions the graph engine recognizes.
///
/// Variable store/fetch nodes, loop constructs and visual-only nodes are
/// identified by type name only. The conventions come from third-party node
/// packs and keep evolving, so they are held here as data rather than spread
/// through the analysis and editing code.
///
/// ### Default Values
/// - store/fetch types: `SetNode` / `GetNode`, title prefixes `Set_` / `Get_`
/// - loop start markers: `loopstart`, `forstart`, `whilestart` (end: `loopend`,
///   `forend`, `whileend`), matched as lower-case substrings of the type name
/// - iteration input markers: `total`, `iteration`, `count`
/// - copy offset: `(50, 50)`
///
/// @implNote Immutable once built. Use {@link #builder()} to override defaults.
///
/// @see NodewrightFactory#createEngine(GraphEngineConfig)
public final class GraphEngineConfig {

    private final String storeType;
    private final String fetchType;
    private final String storeTitlePrefix;
    private final String fetchTitlePrefix;
    private final List<String> loopStartMarkers;
    private final List<String> loopEndMarkers;
    private final List<String> iterationInputMarkers;
    private final Set<String> visualTypes;
    private final Set<String> terminalTypes;
    private final Set<String> optionalHeavyTypes;
    private final double copyOffsetX;
    private final double copyOffsetY;

    private GraphEngineConfig(Builder builder) {
        this.storeType = builder.storeType;
        this.fetchType = builder.fetchType;
        this.storeTitlePrefix = builder.storeTitlePrefix;
        this.fetchTitlePrefix = builder.fetchTitlePrefix;
        this.loopStartMarkers = List.copyOf(builder.loopStartMarkers);
        this.loopEndMarkers = List.copyOf(builder.loopEndMarkers);
        this.iterationInputMarkers = List.copyOf(builder.iterationInputMarkers);
        this.visualTypes = Set.copyOf(builder.visualTypes);
        this.terminalTypes = Set.copyOf(builder.terminalTypes);
        this.optionalHeavyTypes = Set.copyOf(builder.optionalHeavyTypes);
        this.copyOffsetX = builder.copyOffsetX;
        this.copyOffsetY = builder.copyOffsetY;
    }

    /// @return configuration with every default applied, never null
    public static GraphEngineConfig defaults() {
        return builder().build();
    }

    public String getStoreType() {
        return storeType;
    }

    public String getFetchType() {
        return fetchType;
    }

    public String getStoreTitlePrefix() {
        return storeTitlePrefix;
    }

    public String getFetchTitlePrefix() {
        return fetchTitlePrefix;
    }

    /// Returns the node types that never take part in data flow (notes, labels).
    ///
    /// Any type whose name contains `label` is treated as visual as well.
    ///
    /// @return unmodifiable set, never null
    public Set<String> getVisualTypes() {
        return visualTypes;
    }

    /// @return node types whose unconnected outputs are expected, never null
    public Set<String> getTerminalTypes() {
        return terminalTypes;
    }

    /// @return node types with many optional inputs, never null
    public Set<String> getOptionalHeavyTypes() {
        return optionalHeavyTypes;
    }

    public double getCopyOffsetX() {
        return copyOffsetX;
    }

    public double getCopyOffsetY() {
        return copyOffsetY;
    }

    public boolean isStore(String type) {
        return storeType.equals(type);
    }

    public boolean isFetch(String type) {
        return fetchType.equals(type);
    }

    public boolean isLoopStart(String type) {
        return containsAny(type, loopStartMarkers);
    }

    public boolean isLoopEnd(String type) {
        return containsAny(type, loopEndMarkers);
    }

    /// @return true if an input with this name carries a loop's iteration count
    public boolean isIterationInput(String inputName) {
        return containsAny(inputName, iterationInputMarkers);
    }

    public boolean isVisual(String type) {
        return visualTypes.contains(type) || type.toLowerCase(Locale.ROOT).contains("label");
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /// Creates a new builder initialized with the defaults.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GraphEngineConfig}.
    public static final class Builder {
        private String storeType = "SetNode";
        private String fetchType = "GetNode";
        private String storeTitlePrefix = "Set_";
        private String fetchTitlePrefix = "Get_";
        private List<String> loopStartMarkers = List.of("loopstart", "forstart", "whilestart");
        private List<String> loopEndMarkers = List.of("loopend", "forend", "whileend");
        private List<String> iterationInputMarkers = List.of("total", "iteration", "count");
        private Set<String> visualTypes =
                Set.of("Note", "MarkdownNote", "Label (rgthree)", "PrimitiveNode");
        private Set<String> terminalTypes =
                Set.of(
                        "VHS_VideoCombine",
                        "SaveImage",
                        "PreviewImage",
                        "SetNode",
                        "Display Any (rgthree)",
                        "Display Int (rgthree)",
                        "DisplayAny",
                        "Note",
                        "Label (rgthree)",
                        "Reroute");
        private Set<String> optionalHeavyTypes =
                Set.of(
                        "WanVideoSampler",
                        "WanVideoModelLoader",
                        "WanVideoVACEEncode",
                        "VHS_LoadVideo",
                        "WanVideoEncode",
                        "WanVideoLoraSelect");
        private double copyOffsetX = 50;
        private double copyOffsetY = 50;

        private Builder() {}

        /// Sets the type names of variable store and fetch nodes.
        ///
        /// @param storeType store node type, not null
        /// @param fetchType fetch node type, not null
        /// @return this builder for chaining, never null
        public Builder variableTypes(String storeType, String fetchType) {
            this.storeType = storeType;
            this.fetchType = fetchType;
            return this;
        }

        /// Sets the title prefixes used to derive a variable key when the
        /// widget value is missing.
        public Builder variableTitlePrefixes(String storePrefix, String fetchPrefix) {
            this.storeTitlePrefix = storePrefix;
            this.fetchTitlePrefix = fetchPrefix;
            return this;
        }

        /// Sets the lower-case type name fragments that mark loop start and end nodes.
        public Builder loopMarkers(List<String> startMarkers, List<String> endMarkers) {
            this.loopStartMarkers = lowerCase(startMarkers);
            this.loopEndMarkers = lowerCase(endMarkers);
            return this;
        }

        public Builder iterationInputMarkers(List<String> markers) {
            this.iterationInputMarkers = lowerCase(markers);
            return this;
        }

        public Builder visualTypes(Set<String> visualTypes) {
            this.visualTypes = visualTypes;
            return this;
        }

        public Builder terminalTypes(Set<String> terminalTypes) {
            this.terminalTypes = terminalTypes;
            return this;
        }

        public Builder optionalHeavyTypes(Set<String> optionalHeavyTypes) {
            this.optionalHeavyTypes = optionalHeavyTypes;
            return this;
        }

        /// Sets the position offset applied to copied nodes.
        ///
        /// @param x horizontal offset
        /// @param y vertical offset
        /// @return this builder for chaining, never null
        public Builder copyOffset(double x, double y) {
            this.copyOffsetX = x;
            this.copyOffsetY = y;
            return this;
        }

        public GraphEngineConfig build() {
            return new GraphEngineConfig(this);
        }

        private static List<String> lowerCase(List<String> markers) {
            return markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
        }
    }
}
