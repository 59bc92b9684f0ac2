package com.smartgallery.app.graph;

import java.util.Set;

/** Node class names the extractor knows about. */
public final class NodeTypes {

    /** Nodes that actually sample. Selector helpers such as KSamplerSelect are not in here. */
    public static final Set<String> SAMPLERS = Set.of(
            "KSampler",
            "KSamplerAdvanced",
            "SamplerCustom",
            "SamplerCustomAdvanced",
            "KSamplerEfficient",
            "DetailerForEach",
            "SamplerDPMPP_2M_SDE",
            "WanVideoSampler",
            "UltimateSDUpscale"
    );

    public static final Set<String> MODEL_LOADERS = Set.of(
            "CheckpointLoaderSimple",
            "CheckpointLoader",
            "Load Checkpoint",
            "UNETLoader",
            "Load Diffusion Model",
            "UnetLoaderGGUF",
            "DualCLIPLoader"
    );

    public static final Set<String> PROMPT_ENCODERS = Set.of(
            "CLIPTextEncode",
            "CLIP Text Encode (Prompt)",
            "TextEncodeQwenImageEditPlus",
            "CLIPTextEncodeSDXL",
            "CLIPTextEncodeSDXLRefiner"
    );

    public static final Set<String> SCHEDULERS = Set.of(
            "BasicScheduler",
            "KarrasScheduler",
            "ExponentialScheduler",
            "SgmUniformScheduler"
    );

    public static final Set<String> SAMPLER_SELECTORS = Set.of("KSamplerSelect");

    public static final Set<String> LATENT_SIZE_PROVIDERS = Set.of(
            "EmptyLatentImage",
            "EmptySD3LatentImage",
            "WanImageToVideo"
    );

    public static final String PRIMITIVE_PREFIX = "Primitive";

    private NodeTypes() {}

    public static boolean isPrimitive(String type) {
        return type != null && type.startsWith(PRIMITIVE_PREFIX);
    }
}
