package io.nodewright.core.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link NodeSchemaRegistry}.
///
/// Lookups are exact on the type name. {@link #withDefaults()} ships schemas
/// for the common built-in node types plus the store/fetch and loop markers.
///
/// ### Usage
/// {@snippet :
/// NodeSchemaRegistry registry = InMemoryNodeSchemaRegistry.withDefaults();
/// registry.register(NodeSchema.builder("MyNode").input("image", "IMAGE").build());
/// }
///
/// @implNote Thread-safe. Backed by a ConcurrentHashMap.
public final class InMemoryNodeSchemaRegistry implements NodeSchemaRegistry {

    private final Map<String, NodeSchema> schemas = new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public InMemoryNodeSchemaRegistry() {}

    /// Creates a registry with initial schemas.
    ///
    /// @param initialSchemas schemas to register, not null
    public InMemoryNodeSchemaRegistry(List<NodeSchema> initialSchemas) {
        Objects.requireNonNull(initialSchemas, "initialSchemas must not be null");
        initialSchemas.forEach(this::register);
    }

    /// Creates a registry pre-populated with the built-in schemas.
    ///
    /// @return new registry, never null
    public static InMemoryNodeSchemaRegistry withDefaults() {
        return new InMemoryNodeSchemaRegistry(defaultSchemas());
    }

    @Override
    public void register(NodeSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        schemas.put(schema.typeName(), schema);
    }

    @Override
    public Optional<NodeSchema> get(String typeName) {
        Objects.requireNonNull(typeName, "typeName must not be null");
        return Optional.ofNullable(schemas.get(typeName));
    }

    @Override
    public List<NodeSchema> all() {
        return List.copyOf(schemas.values());
    }

    @Override
    public boolean contains(String typeName) {
        Objects.requireNonNull(typeName, "typeName must not be null");
        return schemas.containsKey(typeName);
    }

    static List<NodeSchema> defaultSchemas() {
        return List.of(
                NodeSchema.builder("CheckpointLoaderSimple")
                        .output("MODEL", "MODEL")
                        .output("CLIP", "CLIP")
                        .output("VAE", "VAE")
                        .widget("ckpt_name", "")
                        .build(),
                NodeSchema.builder("VAELoader")
                        .output("VAE", "VAE")
                        .widget("vae_name", "")
                        .build(),
                NodeSchema.builder("LoraLoader")
                        .input("model", "MODEL")
                        .input("clip", "CLIP")
                        .output("MODEL", "MODEL")
                        .output("CLIP", "CLIP")
                        .widget("lora_name", "")
                        .widget("strength_model", 1.0)
                        .widget("strength_clip", 1.0)
                        .build(),
                NodeSchema.builder("CLIPTextEncode")
                        .input("clip", "CLIP")
                        .output("CONDITIONING", "CONDITIONING")
                        .widget("text", "")
                        .build(),
                NodeSchema.builder("EmptyLatentImage")
                        .output("LATENT", "LATENT")
                        .widget("width", 512)
                        .widget("height", 512)
                        .widget("batch_size", 1)
                        .build(),
                NodeSchema.builder("KSampler")
                        .input("model", "MODEL")
                        .input("positive", "CONDITIONING")
                        .input("negative", "CONDITIONING")
                        .input("latent_image", "LATENT")
                        .output("LATENT", "LATENT")
                        .widget("seed", 0)
                        .widget("control_after_generate", "randomize")
                        .widget("steps", 20)
                        .widget("cfg", 8.0)
                        .widget("sampler_name", "euler")
                        .widget("scheduler", "normal")
                        .widget("denoise", 1.0)
                        .build(),
                NodeSchema.builder("VAEDecode")
                        .input("samples", "LATENT")
                        .input("vae", "VAE")
                        .output("IMAGE", "IMAGE")
                        .build(),
                NodeSchema.builder("VAEEncode")
                        .input("pixels", "IMAGE")
                        .input("vae", "VAE")
                        .output("LATENT", "LATENT")
                        .build(),
                NodeSchema.builder("LoadImage")
                        .output("IMAGE", "IMAGE")
                        .output("MASK", "MASK")
                        .widget("image", "")
                        .widget("upload", "image")
                        .build(),
                NodeSchema.builder("SaveImage")
                        .input("images", "IMAGE")
                        .widget("filename_prefix", "ComfyUI")
                        .build(),
                NodeSchema.builder("PreviewImage").input("images", "IMAGE").build(),
                NodeSchema.builder("UpscaleModelLoader")
                        .output("UPSCALE_MODEL", "UPSCALE_MODEL")
                        .widget("model_name", "")
                        .build(),
                NodeSchema.builder("ImageUpscaleWithModel")
                        .input("upscale_model", "UPSCALE_MODEL")
                        .input("image", "IMAGE")
                        .output("IMAGE", "IMAGE")
                        .build(),
                NodeSchema.builder("SetNode")
                        .input("value", "*")
                        .output("*", "*")
                        .widget("key", "")
                        .build(),
                NodeSchema.builder("GetNode").output("value", "*").widget("key", "").build(),
                NodeSchema.builder("PrimitiveNode").output("connect to widget input", "*").build(),
                NodeSchema.builder("easy forLoopStart")
                        .input("initial_value1", "*")
                        .input("total", "INT")
                        .output("flow", "FLOW_CONTROL")
                        .output("index", "INT")
                        .output("value1", "*")
                        .widget("total", 1)
                        .build(),
                NodeSchema.builder("easy forLoopEnd")
                        .input("flow", "FLOW_CONTROL")
                        .input("initial_value1", "*")
                        .output("value1", "*")
                        .build());
    }
}
