package io.nodewright.core.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Fingerprint table for workflow pattern detection and headline parameter
/// extraction.
///
/// Node type conventions change as third-party packs evolve, so the rules are
/// data: start from {@link #defaults()} and add rules with {@link #toBuilder()}.
/// All fragments are lower-case substrings matched against lower-case type names.
///
/// @param families model family rules, first match wins
/// @param modes generation mode rules, first match wins
/// @param modifiers modifier rules, every match is reported
/// @param parameters headline parameter rules, applied in order
/// @param flowPriority link types preferred when tracing main flows
/// @param fallbackLabel label used when no rule matches
/// @param maxValueLength longer string parameters are truncated
public record PatternRules(
        List<FragmentRule> families,
        List<ModeRule> modes,
        List<FragmentRule> modifiers,
        List<ParameterRule> parameters,
        List<String> flowPriority,
        String fallbackLabel,
        int maxValueLength) {

    public PatternRules {
        families = List.copyOf(families);
        modes = List.copyOf(modes);
        modifiers = List.copyOf(modifiers);
        parameters = List.copyOf(parameters);
        flowPriority = List.copyOf(flowPriority);
        Objects.requireNonNull(fallbackLabel, "fallbackLabel must not be null");
    }

    /// Label emitted when any of `fragments` occurs in any type name.
    public record FragmentRule(String label, List<String> fragments) {

        public FragmentRule {
            Objects.requireNonNull(label, "label must not be null");
            fragments = lowerCase(fragments);
        }

        public static FragmentRule of(String label, String... fragments) {
            return new FragmentRule(label, List.of(fragments));
        }

        boolean matches(List<String> types) {
            return anyContains(types, fragments);
        }
    }

    /// Generation mode label emitted when a `trigger` fragment is present and,
    /// unless `also` is empty, an `also` fragment is present too.
    public record ModeRule(String label, List<String> trigger, List<String> also) {

        public ModeRule {
            Objects.requireNonNull(label, "label must not be null");
            trigger = lowerCase(trigger);
            also = lowerCase(also);
        }

        boolean matches(List<String> types) {
            return anyContains(types, trigger) && (also.isEmpty() || anyContains(types, also));
        }
    }

    /// Headline parameter read from a widget of an exact node type.
    ///
    /// @param nodeType exact type name
    /// @param widgetIndex index for positional widgets
    /// @param widgetKey key for keyed widgets
    /// @param name reported parameter name
    public record ParameterRule(String nodeType, int widgetIndex, String widgetKey, String name) {

        public ParameterRule {
            Objects.requireNonNull(nodeType, "nodeType must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    private static List<String> lowerCase(List<String> fragments) {
        return fragments.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
    }

    private static boolean anyContains(List<String> types, List<String> fragments) {
        for (String type : types) {
            for (String fragment : fragments) {
                if (type.contains(fragment)) {
                    return true;
                }
            }
        }
        return false;
    }

    /// Returns the built-in rules for image and video diffusion workflows.
    ///
    /// @return default rules, never null
    public static PatternRules defaults() {
        List<ParameterRule> parameters = new ArrayList<>();
        parameters.add(new ParameterRule("KSampler", 0, "seed", "seed"));
        parameters.add(new ParameterRule("KSampler", 2, "steps", "steps"));
        parameters.add(new ParameterRule("KSampler", 3, "cfg", "cfg"));
        parameters.add(new ParameterRule("KSampler", 4, "sampler_name", "sampler"));
        parameters.add(new ParameterRule("KSampler", 5, "scheduler", "scheduler"));
        parameters.add(new ParameterRule("KSamplerAdvanced", 2, "steps", "steps"));
        parameters.add(new ParameterRule("KSamplerAdvanced", 3, "cfg", "cfg"));
        parameters.add(new ParameterRule("KSamplerAdvanced", 4, "sampler_name", "sampler"));
        parameters.add(new ParameterRule("KSamplerAdvanced", 5, "scheduler", "scheduler"));
        parameters.add(new ParameterRule("CheckpointLoaderSimple", 0, "ckpt_name", "model"));
        parameters.add(new ParameterRule("LoraLoader", 0, "lora_name", "lora"));
        parameters.add(new ParameterRule("LoraLoader", 1, "strength_model", "strength"));
        parameters.add(new ParameterRule("EmptyLatentImage", 0, "width", "width"));
        parameters.add(new ParameterRule("EmptyLatentImage", 1, "height", "height"));
        parameters.add(new ParameterRule("EmptyLatentImage", 2, "batch_size", "batch"));
        parameters.add(new ParameterRule("CLIPTextEncode", 0, "text", "prompt"));

        return new PatternRules(
                List.of(
                        FragmentRule.of("Flux", "flux"),
                        FragmentRule.of("WAN", "wan"),
                        FragmentRule.of("LTX", "ltx"),
                        FragmentRule.of("AnimateDiff", "animatediff"),
                        FragmentRule.of("SDXL", "sdxl", "xl"),
                        FragmentRule.of("SD1.5", "sd15", "sd1.5")),
                List.of(
                        new ModeRule(
                                "v2v",
                                List.of("loadvideo", "vhs_load"),
                                List.of("ksampler", "sampler")),
                        new ModeRule("video-processing", List.of("loadvideo", "vhs_load"), List.of()),
                        new ModeRule("img2img", List.of("loadimage"), List.of("vaeencode")),
                        new ModeRule("style-transfer", List.of("loadimage"), List.of("ipadapter")),
                        new ModeRule("i2v", List.of("loadimage"), List.of()),
                        new ModeRule("txt2img", List.of("emptylatent"), List.of())),
                List.of(
                        FragmentRule.of("+ControlNet", "controlnet"),
                        FragmentRule.of("+LoRA", "lora"),
                        FragmentRule.of("+IPAdapter", "ipadapter"),
                        FragmentRule.of("+Upscale", "upscale"),
                        FragmentRule.of("+Inpaint", "inpaint"),
                        FragmentRule.of("+Face", "face", "reactor")),
                parameters,
                List.of("MODEL", "LATENT", "IMAGE", "CONDITIONING"),
                "Custom",
                50);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /// Builder that extends an existing rule table.
    public static final class Builder {
        private final List<FragmentRule> families;
        private final List<ModeRule> modes;
        private final List<FragmentRule> modifiers;
        private final List<ParameterRule> parameters;
        private List<String> flowPriority;
        private String fallbackLabel;
        private int maxValueLength;

        private Builder(PatternRules base) {
            this.families = new ArrayList<>(base.families);
            this.modes = new ArrayList<>(base.modes);
            this.modifiers = new ArrayList<>(base.modifiers);
            this.parameters = new ArrayList<>(base.parameters);
            this.flowPriority = base.flowPriority;
            this.fallbackLabel = base.fallbackLabel;
            this.maxValueLength = base.maxValueLength;
        }

        /// Adds a model family rule checked before the existing ones.
        public Builder family(FragmentRule rule) {
            families.add(0, rule);
            return this;
        }

        /// Adds a mode rule checked before the existing ones.
        public Builder mode(ModeRule rule) {
            modes.add(0, rule);
            return this;
        }

        public Builder modifier(FragmentRule rule) {
            modifiers.add(rule);
            return this;
        }

        public Builder parameter(ParameterRule rule) {
            parameters.add(rule);
            return this;
        }

        public Builder flowPriority(List<String> flowPriority) {
            this.flowPriority = flowPriority;
            return this;
        }

        public Builder fallbackLabel(String fallbackLabel) {
            this.fallbackLabel = fallbackLabel;
            return this;
        }

        public Builder maxValueLength(int maxValueLength) {
            this.maxValueLength = maxValueLength;
            return this;
        }

        public PatternRules build() {
            return new PatternRules(
                    families,
                    modes,
                    modifiers,
                    parameters,
                    flowPriority,
                    fallbackLabel,
                    maxValueLength);
        }
    }
}
