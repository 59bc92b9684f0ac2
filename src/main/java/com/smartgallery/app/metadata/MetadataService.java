package com.smartgallery.app.metadata;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.smartgallery.app.graph.GraphDocument;
import com.smartgallery.app.graph.UnrecognizedFormatException;

/**
 * Entry point of metadata extraction: raw embedded bytes in, sampler records out.
 * Never throws; anything unreadable yields an empty list.
 */
public final class MetadataService {

    private static final Logger logger = LoggerFactory.getLogger(MetadataService.class);

    public record Detection(JsonNode payload, String format) {}

    private final SamplerExtractor extractor;
    private final DebugSink debug;

    public MetadataService() {
        this(new SamplerExtractor(), DebugSink.NONE);
    }

    public MetadataService(SamplerExtractor extractor, DebugSink debug) {
        this.extractor = extractor;
        this.debug = debug == null ? DebugSink.NONE : debug;
    }

    public DebugSink debugSink() {
        return debug;
    }

    public List<SamplerRecord> extract(byte[] raw) {
        return extract(raw, null);
    }

    public List<SamplerRecord> extract(byte[] raw, Path sourceFile) {
        if (raw == null || raw.length == 0) return List.of();
        return extract(new String(raw, StandardCharsets.UTF_8), sourceFile);
    }

    public List<SamplerRecord> extract(String json, Path sourceFile) {
        if (StringUtils.isBlank(json)) return List.of();
        try {
            if (debug.enabled()) debug.stage(sourceFile, "01_raw", json, "string");

            JsonNode root;
            try {
                root = JsonSupport.MAPPER.readTree(json);
            } catch (JsonProcessingException e) {
                logger.debug("Embedded metadata is not JSON ({}): {}", sourceFile, e.getOriginalMessage());
                return List.of();
            }
            if (debug.enabled()) debug.stage(sourceFile, "02_parsed", root, "json");

            Optional<Detection> detection = detect(root);
            if (detection.isEmpty()) {
                if (debug.enabled()) debug.stage(sourceFile, "03_format_detection", Map.of("format", "unknown"), "unknown");
                return List.of();
            }
            Detection d = detection.get();
            if (debug.enabled()) {
                debug.stage(sourceFile, "03_format_detection", Map.of("format", d.format()), d.format());
                debug.stage(sourceFile, "04_parser_input", d.payload(), d.format());
            }

            GraphDocument document = GraphDocument.of(d.payload());
            List<SamplerRecord> records = extractor.extractAll(document, sourceFile);

            if (debug.enabled()) debug.stage(sourceFile, "05_parser_output", records, d.format());
            return records;
        } catch (UnrecognizedFormatException e) {
            logger.debug("Unrecognized graph in {}: {}", sourceFile, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            logger.warn("Metadata extraction failed for {}: {}", sourceFile, e.toString());
            return List.of();
        }
    }

    /**
     * Locates the graph payload: a nested {@code prompt}/{@code Prompt} object, then a linked
     * document (preferring its {@code extra.prompt} alternate), then a bare node-id map.
     */
    public static Optional<Detection> detect(JsonNode root) {
        if (root == null || !root.isObject()) return Optional.empty();

        for (String key : List.of("prompt", "Prompt")) {
            JsonNode nested = asObject(root.get(key));
            if (nested != null) {
                return Optional.of(new Detection(nested, "nested_prompt"));
            }
        }

        JsonNode nodes = root.get("nodes");
        if (nodes != null && nodes.isArray()) {
            JsonNode extraPrompt = asObject(root.path("extra").get("prompt"));
            if (extraPrompt != null) {
                return Optional.of(new Detection(extraPrompt, "linked_extra_prompt"));
            }
            return Optional.of(new Detection(root, "linked"));
        }

        if (looksLikeNodeMap(root)) {
            return Optional.of(new Detection(root, "inline"));
        }
        return Optional.empty();
    }

    private static boolean looksLikeNodeMap(JsonNode root) {
        int checked = 0;
        for (JsonNode v : root) {
            if (checked == 3) break;
            if (!v.isObject() || !v.has("class_type")) return false;
            checked++;
        }
        return checked > 0;
    }

    // A nested payload may arrive as an object or as JSON text
    private static JsonNode asObject(JsonNode v) {
        if (v == null) return null;
        if (v.isObject()) return v;
        if (v.isTextual() && v.asText().trim().startsWith("{")) {
            try {
                JsonNode parsed = JsonSupport.MAPPER.readTree(v.asText());
                return parsed.isObject() ? parsed : null;
            } catch (JsonProcessingException e) {
                return null;
            }
        }
        return null;
    }
}
