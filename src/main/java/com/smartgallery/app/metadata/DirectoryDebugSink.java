package com.smartgallery.app.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Writes each stage as {@code <dir>/<file basename>/<stage>_<format>.json} plus a
 * {@code <stage>_summary.txt} describing the payload shape.
 */
public final class DirectoryDebugSink implements DebugSink {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryDebugSink.class);

    private static final int PREVIEW_CHARS = 200;

    private final Path root;

    public DirectoryDebugSink(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void stage(Path sourceFile, String stage, Object data, String formatInfo) {
        String base = sourceFile == null ? "_unknown" : FilenameUtils.getBaseName(sourceFile.getFileName().toString());
        Path dir = root.resolve(base);
        String fileName = StringUtils.isBlank(formatInfo) ? stage + ".json" : stage + "_" + formatInfo + ".json";
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(fileName), render(data), StandardCharsets.UTF_8);
            Files.writeString(dir.resolve(stage + "_summary.txt"), summarize(stage, data, formatInfo), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Could not write debug stage {} for {}: {}", stage, sourceFile, e.toString());
        }
    }

    private static String render(Object data) throws JsonProcessingException {
        if (data instanceof String s) {
            try {
                JsonNode parsed = JsonSupport.MAPPER.readTree(s);
                return JsonSupport.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
            } catch (JsonProcessingException notJson) {
                return s;
            }
        }
        return JsonSupport.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(data);
    }

    private static String summarize(String stage, Object data, String formatInfo) {
        StringBuilder sb = new StringBuilder();
        sb.append("Stage: ").append(stage).append('\n');
        sb.append("Format: ").append(Objects.toString(formatInfo, "")).append('\n');
        sb.append("Data type: ").append(data == null ? "null" : data.getClass().getSimpleName()).append('\n');
        if (data instanceof JsonNode node && node.isObject()) {
            sb.append("Total keys: ").append(node.size()).append('\n');
            sb.append("\nSample entries:\n");
            Iterator<String> names = node.fieldNames();
            for (int i = 0; i < 3 && names.hasNext(); i++) {
                String k = names.next();
                sb.append("  ").append(k).append(": ").append(node.get(k).getNodeType()).append('\n');
            }
        } else if (data instanceof JsonNode node && node.isArray()) {
            sb.append("Length: ").append(node.size()).append('\n');
        } else if (data instanceof java.util.Collection<?> c) {
            sb.append("Length: ").append(c.size()).append('\n');
        } else if (data instanceof String s) {
            sb.append("Length: ").append(s.length()).append(" chars\n");
            sb.append("Preview: ").append(StringUtils.left(s, PREVIEW_CHARS)).append("...\n");
        }
        return sb.toString();
    }
}
