package io.nodewright.core;

import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.OutputSlot;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Documents built in code for tests.
public final class TestWorkflows {

    private TestWorkflows() {}

    public static NodeId id(long value) {
        return NodeId.of(value);
    }

    /// `1: Loader -> 2: Sampler -> 3: Decoder -> 4: Save`.
    public static WorkflowDocument linearChain() throws WorkflowGraphException {
        WorkflowDocument doc = WorkflowDocument.empty();
        doc.addNode(loader(1));
        doc.addNode(sampler(2));
        doc.addNode(decoder(3));
        doc.addNode(save(4));
        doc.addLink(id(1), 0, id(2), 0);
        doc.addLink(id(2), 0, id(3), 0);
        doc.addLink(id(3), 0, id(4), 0);
        return doc;
    }

    /// Loader 1 feeds store 2 under key "m"; fetch 3 of "m" feeds sampler 4.
    public static WorkflowDocument storeFetchPair() throws WorkflowGraphException {
        WorkflowDocument doc = WorkflowDocument.empty();
        doc.addNode(loader(1));
        doc.addNode(store(2, "m"));
        doc.addNode(fetch(3, "m"));
        doc.addNode(sampler(4));
        doc.addLink(id(1), 0, id(2), 0);
        doc.addLink(id(3), 0, id(4), 0);
        return doc;
    }

    /// Relays `1 -> 2 -> 3` plus a rootless cycle `10 <-> 11` that also feeds 3.
    public static WorkflowDocument cyclicGraph() throws WorkflowGraphException {
        WorkflowDocument doc = WorkflowDocument.empty();
        for (long id : new long[] {1, 2, 3, 10, 11}) {
            doc.addNode(relay(id));
        }
        doc.addLink(id(1), 0, id(2), 0);
        doc.addLink(id(2), 0, id(3), 0);
        doc.addLink(id(10), 0, id(11), 0);
        doc.addLink(id(11), 0, id(10), 0);
        doc.addLink(id(11), 0, id(3), 1);
        return doc;
    }

    public static Node relay(long id) {
        return node(id, "Relay")
                .input(InputSlot.unconnected("a", "*"))
                .input(InputSlot.unconnected("b", "*"))
                .output(OutputSlot.unconnected("out", "*"))
                .build();
    }

    public static Node loader(long id) {
        return node(id, "CheckpointLoaderSimple")
                .output(OutputSlot.unconnected("MODEL", "MODEL"))
                .output(OutputSlot.unconnected("CLIP", "CLIP"))
                .output(OutputSlot.unconnected("VAE", "VAE"))
                .widgets(WidgetValues.positional(List.of("sd_xl_base_1.0.safetensors")))
                .build();
    }

    public static Node sampler(long id) {
        List<Object> widgets = new ArrayList<>();
        widgets.add(42);
        widgets.add("fixed");
        widgets.add(20);
        widgets.add(7.0);
        widgets.add("euler");
        widgets.add("normal");
        widgets.add(1.0);
        return node(id, "KSampler")
                .input(InputSlot.unconnected("model", "MODEL"))
                .input(InputSlot.unconnected("positive", "CONDITIONING"))
                .input(InputSlot.unconnected("negative", "CONDITIONING"))
                .input(InputSlot.unconnected("latent_image", "LATENT"))
                .output(OutputSlot.unconnected("LATENT", "LATENT"))
                .widgets(WidgetValues.positional(widgets))
                .build();
    }

    public static Node decoder(long id) {
        return node(id, "VAEDecode")
                .input(InputSlot.unconnected("samples", "LATENT"))
                .input(InputSlot.unconnected("vae", "VAE"))
                .output(OutputSlot.unconnected("IMAGE", "IMAGE"))
                .build();
    }

    public static Node save(long id) {
        return node(id, "SaveImage")
                .input(InputSlot.unconnected("images", "IMAGE"))
                .widgets(WidgetValues.positional(List.of("ComfyUI")))
                .build();
    }

    public static Node store(long id, String key) {
        return node(id, "SetNode")
                .title("Set_" + key)
                .input(InputSlot.unconnected("value", "*"))
                .output(OutputSlot.unconnected("*", "*"))
                .widgets(WidgetValues.positional(List.of(key)))
                .build();
    }

    public static Node fetch(long id, String key) {
        return node(id, "GetNode")
                .title("Get_" + key)
                .output(OutputSlot.unconnected("value", "*"))
                .widgets(WidgetValues.positional(List.of(key)))
                .build();
    }

    public static Node.Builder node(long id, String type) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("pos", List.of((int) (10 * id), (int) (20 * id)));
        attributes.put("size", List.of(200, 100));
        return Node.builder().id(id(id)).type(type).attributes(attributes);
    }
}
