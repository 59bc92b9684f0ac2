package com.smartgallery.app.metadata;

/**
 * Generation parameters of one sampling node. {@code samplerIndex} is the 0-based position of
 * the sampler within its file and is unique per file.
 */
public record SamplerRecord(
        int samplerIndex,
        String modelName,
        String samplerName,
        String scheduler,
        String positivePrompt,
        String negativePrompt,
        Integer width,
        Integer height,
        Double cfg,
        Integer steps
) {

    public SamplerRecord withIndex(int index) {
        return new SamplerRecord(index, modelName, samplerName, scheduler, positivePrompt, negativePrompt,
                width, height, cfg, steps);
    }
}
