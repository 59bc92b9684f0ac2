package com.smartgallery.app.graph;

import java.util.Map;

/**
 * Positional widget layout for node types whose linked-variant documents carry no
 * {@code widget_idx_map} entry. Finite and versioned: extend by adding a type, never by guessing.
 */
public final class WidgetPositions {

    public static final int VERSION = 1;

    private static final Map<String, Integer> KSAMPLER = Map.of(
            "seed", 0,
            "control_after_generate", 1,
            "steps", 2,
            "cfg", 3,
            "sampler_name", 4,
            "scheduler", 5,
            "denoise", 6
    );

    private static final Map<String, Integer> EMPTY_LATENT = Map.of("width", 0, "height", 1, "batch_size", 2);

    private static final Map<String, Map<String, Integer>> TABLE = Map.of(
            "KSampler", KSAMPLER,
            "KSamplerAdvanced", KSAMPLER,
            "CLIPTextEncode", Map.of("text", 0),
            "CheckpointLoaderSimple", Map.of("ckpt_name", 0),
            "EmptyLatentImage", EMPTY_LATENT,
            "EmptySD3LatentImage", EMPTY_LATENT,
            "DualCLIPLoader", Map.of("clip_name1", 0, "clip_name2", 1, "type", 2),
            "UNETLoader", Map.of("unet_name", 0)
    );

    private WidgetPositions() {}

    /** Index of the parameter in the node's widget array, or -1 when the type or parameter is unknown. */
    public static int indexOf(String nodeType, String paramName) {
        if (nodeType == null || paramName == null) return -1;
        Map<String, Integer> positions = TABLE.get(nodeType);
        if (positions == null) return -1;
        Integer idx = positions.get(paramName);
        return idx == null ? -1 : idx;
    }
}
