package com.smartgallery.app.metadata;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartgallery.app.analyze.PixelSize;
import com.smartgallery.app.graph.GraphDocument;
import com.smartgallery.app.graph.GraphTracer;
import com.smartgallery.app.graph.NodeTypes;

/**
 * Builds one {@link SamplerRecord} per sampling node. Every field is resolved on its own so a
 * failure in one never costs the others.
 */
public final class SamplerExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SamplerExtractor.class);

    private static final Set<String> PIXEL_FALLBACK_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");
    private static final List<String> MODEL_NAME_PARAMS = List.of("ckpt_name", "unet_name", "model_name", "clip_name1");

    private static final Comparator<String> BY_NUMERIC_ID = Comparator
            .comparing((String id) -> !StringUtils.isNumeric(id))
            .thenComparing(id -> StringUtils.isNumeric(id) ? Long.parseLong(id) : 0L)
            .thenComparing(Function.identity());

    private final Function<Path, Optional<PixelSize>> pixelSizeReader;

    public SamplerExtractor() {
        this(PixelSize::read);
    }

    public SamplerExtractor(Function<Path, Optional<PixelSize>> pixelSizeReader) {
        this.pixelSizeReader = pixelSizeReader;
    }

    public List<SamplerRecord> extractAll(GraphDocument document) {
        return extractAll(document, null);
    }

    /**
     * @param sourceFile media file the document came from, used only to read pixel size when the
     *                   graph does not state it; may be null
     */
    public List<SamplerRecord> extractAll(GraphDocument document, Path sourceFile) {
        GraphTracer tracer = new GraphTracer(document);
        List<String> samplerIds = new ArrayList<>();
        for (String id : document.nodeIds()) {
            if (NodeTypes.SAMPLERS.contains(document.nodeType(id))) {
                samplerIds.add(id);
            }
        }
        samplerIds.sort(BY_NUMERIC_ID);

        List<SamplerRecord> out = new ArrayList<>(samplerIds.size());
        for (String id : samplerIds) {
            try {
                out.add(extractOne(tracer, id, sourceFile).withIndex(out.size()));
            } catch (RuntimeException e) {
                logger.warn("Dropping sampler node {}: {}", id, e.toString());
            }
        }
        return out;
    }

    private SamplerRecord extractOne(GraphTracer tracer, String samplerId, Path sourceFile) {
        String samplerName = field("sampler_name", () -> samplerName(tracer, samplerId));
        String scheduler = field("scheduler", () -> scheduler(tracer, samplerId));
        String model = field("model", () -> modelName(tracer, samplerId));
        String positive = field("positive", () -> prompt(tracer, samplerId, "positive"));
        String negative = field("negative", () -> prompt(tracer, samplerId, "negative"));
        JsonNode[] size = field("dimensions", () -> dimensions(tracer, samplerId));
        JsonNode cfg = field("cfg", () -> tracer.value(samplerId, "cfg"));
        JsonNode steps = field("steps", () -> steps(tracer, samplerId));

        Integer width = size == null ? null : toInt(size[0]);
        Integer height = size == null ? null : toInt(size[1]);
        if ((width == null || height == null) && sourceFile != null && usesPixelFallback(sourceFile)) {
            Optional<PixelSize> px = field("pixel size", () -> pixelSizeReader.apply(sourceFile));
            if (px != null && px.isPresent()) {
                width = px.get().width();
                height = px.get().height();
            }
        }

        return new SamplerRecord(0, model, samplerName, scheduler, positive, negative,
                width, height, toDouble(cfg), toInt(steps));
    }

    private static String samplerName(GraphTracer tracer, String samplerId) {
        String direct = asText(tracer.value(samplerId, "sampler_name"));
        if (direct != null) return direct;
        String selector = tracer.trace(samplerId, "sampler", NodeTypes.SAMPLER_SELECTORS);
        return asText(tracer.value(selector, "sampler_name"));
    }

    private static String scheduler(GraphTracer tracer, String samplerId) {
        String direct = asText(tracer.value(samplerId, "scheduler"));
        if (direct != null) return direct;
        String source = tracer.trace(samplerId, "sigmas", NodeTypes.SCHEDULERS);
        return asText(tracer.value(source, "scheduler"));
    }

    private static JsonNode steps(GraphTracer tracer, String samplerId) {
        JsonNode direct = tracer.value(samplerId, "steps");
        if (direct != null) return direct;
        String source = tracer.trace(samplerId, "sigmas", NodeTypes.SCHEDULERS);
        return tracer.value(source, "steps");
    }

    private static String modelName(GraphTracer tracer, String samplerId) {
        String loader = tracer.trace(samplerId, "model", NodeTypes.MODEL_LOADERS);
        if (loader == null) return null;
        for (String param : MODEL_NAME_PARAMS) {
            String name = tracer.text(loader, param);
            if (StringUtils.isNotEmpty(name)) {
                // handles both separators regardless of the host OS
                return FilenameUtils.getBaseName(name);
            }
        }
        return null;
    }

    private static String prompt(GraphTracer tracer, String samplerId, String input) {
        String encoder = tracer.trace(samplerId, input, NodeTypes.PROMPT_ENCODERS);
        String text = tracer.text(encoder, "text");
        if (StringUtils.isBlank(text)) {
            // SDXL encoders keep the main prompt in text_g
            text = tracer.text(encoder, "text_g");
        }
        return StringUtils.isBlank(text) ? null : text;
    }

    private static JsonNode[] dimensions(GraphTracer tracer, String samplerId) {
        String latent = tracer.trace(samplerId, "latent_image");
        if (latent == null) return null;
        if (!NodeTypes.LATENT_SIZE_PROVIDERS.contains(tracer.document().nodeType(latent))) return null;
        return new JsonNode[] { tracer.value(latent, "width"), tracer.value(latent, "height") };
    }

    private static boolean usesPixelFallback(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        return PIXEL_FALLBACK_EXTENSIONS.contains(ext);
    }

    private static <T> T field(String name, Supplier<T> resolver) {
        try {
            return resolver.get();
        } catch (RuntimeException e) {
            logger.debug("Could not resolve {}: {}", name, e.toString());
            return null;
        }
    }

    private static String asText(JsonNode v) {
        return v != null && v.isTextual() ? v.asText() : null;
    }

    static Double toDouble(JsonNode v) {
        if (v == null) return null;
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual()) {
            try {
                return Double.valueOf(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Integer toInt(JsonNode v) {
        if (v == null) return null;
        if (v.isNumber()) return (int) v.asDouble();
        if (v.isTextual()) {
            try {
                return Integer.valueOf(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
