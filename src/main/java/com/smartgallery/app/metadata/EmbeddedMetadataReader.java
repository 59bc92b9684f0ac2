package com.smartgallery.app.metadata;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.InflaterInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Default payload reader. PNG text chunks are checked first ({@code workflow}, {@code Workflow},
 * {@code prompt}, {@code Prompt}); any other container, or a PNG without such a chunk, is scanned
 * for the first balanced JSON object carrying a graph.
 */
public final class EmbeddedMetadataReader implements RawMetadataSource {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddedMetadataReader.class);

    private static final byte[] PNG_SIGNATURE = {(byte) 137, 80, 78, 71, 13, 10, 26, 10};
    private static final List<String> PAYLOAD_KEYS = List.of("workflow", "Workflow", "prompt", "Prompt");

    static final long DEFAULT_MAX_SCAN_BYTES = 64L * 1024 * 1024;
    private static final int MAX_SCAN_CANDIDATES = 64;

    private final long maxScanBytes;

    public EmbeddedMetadataReader() {
        this(DEFAULT_MAX_SCAN_BYTES);
    }

    public EmbeddedMetadataReader(long maxScanBytes) {
        this.maxScanBytes = maxScanBytes;
    }

    @Override
    public byte[] read(Path file) throws IOException {
        byte[] head;
        long size = Files.size(file);
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes((int) Math.min(size, maxScanBytes));
        }

        if (isPng(head)) {
            Map<String, String> texts = readPngTexts(head);
            for (String key : PAYLOAD_KEYS) {
                String candidate = texts.get(key);
                String valid = candidate == null ? null : validate(candidate);
                if (valid != null) return valid.getBytes(StandardCharsets.UTF_8);
            }
        }

        String scanned = scanForJson(head);
        return scanned == null ? null : scanned.getBytes(StandardCharsets.UTF_8);
    }

    static boolean isPng(byte[] data) {
        return data.length >= PNG_SIGNATURE.length
                && Arrays.equals(Arrays.copyOf(data, PNG_SIGNATURE.length), PNG_SIGNATURE);
    }

    /** Keyword to text for every tEXt, zTXt and iTXt chunk. */
    static Map<String, String> readPngTexts(byte[] png) {
        Map<String, String> out = new HashMap<>();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(png))) {
            in.skipNBytes(PNG_SIGNATURE.length);
            while (true) {
                int length = in.readInt();
                byte[] type = in.readNBytes(4);
                if (length < 0 || type.length < 4) break;
                String chunk = new String(type, StandardCharsets.US_ASCII);
                if ("IEND".equals(chunk)) break;
                byte[] data = in.readNBytes(length);
                in.skipNBytes(4); // CRC
                if (data.length < length) break;
                switch (chunk) {
                    case "tEXt" -> putText(out, data);
                    case "zTXt" -> putCompressedText(out, data);
                    case "iTXt" -> putInternationalText(out, data);
                    default -> { }
                }
            }
        } catch (EOFException truncated) {
            logger.debug("PNG ended before IEND after {} text chunks", out.size());
        } catch (IOException e) {
            logger.debug("Could not read PNG text chunks: {}", e.toString());
        }
        return out;
    }

    private static void putText(Map<String, String> out, byte[] data) {
        int nul = indexOf(data, 0);
        if (nul <= 0) return;
        out.putIfAbsent(new String(data, 0, nul, StandardCharsets.ISO_8859_1),
                new String(data, nul + 1, data.length - nul - 1, StandardCharsets.ISO_8859_1));
    }

    private static void putCompressedText(Map<String, String> out, byte[] data) throws IOException {
        int nul = indexOf(data, 0);
        if (nul <= 0 || nul + 2 > data.length) return;
        byte[] inflated = inflate(Arrays.copyOfRange(data, nul + 2, data.length));
        out.putIfAbsent(new String(data, 0, nul, StandardCharsets.ISO_8859_1),
                new String(inflated, StandardCharsets.ISO_8859_1));
    }

    // keyword\0 flag method language\0 translated\0 text
    private static void putInternationalText(Map<String, String> out, byte[] data) throws IOException {
        int nul = indexOf(data, 0);
        if (nul <= 0 || nul + 3 > data.length) return;
        boolean compressed = data[nul + 1] == 1;
        int langEnd = indexOf(data, nul + 3);
        if (langEnd < 0) return;
        int transEnd = indexOf(data, langEnd + 1);
        if (transEnd < 0) return;
        byte[] text = Arrays.copyOfRange(data, transEnd + 1, data.length);
        if (compressed) text = inflate(text);
        out.putIfAbsent(new String(data, 0, nul, StandardCharsets.ISO_8859_1), new String(text, StandardCharsets.UTF_8));
    }

    private static byte[] inflate(byte[] compressed) throws IOException {
        try (InflaterInputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    private static int indexOf(byte[] data, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == 0) return i;
        }
        return -1;
    }

    /**
     * Finds the first balanced {@code {...}} span that parses as JSON and looks like a graph
     * payload. Braces inside JSON strings are ignored.
     */
    static String scanForJson(byte[] content) {
        String stream = new String(content, StandardCharsets.UTF_8);
        int from = stream.indexOf('{');
        int tried = 0;
        while (from >= 0 && tried < MAX_SCAN_CANDIDATES) {
            tried++;
            int end = balancedEnd(stream, from);
            if (end < 0) return null;
            String valid = validate(stream.substring(from, end + 1));
            if (valid != null) return valid;
            from = stream.indexOf('{', from + 1);
        }
        return null;
    }

    private static int balancedEnd(String s, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '{') depth++;
            else if (c == '}' && --depth == 0) return i;
        }
        return -1;
    }

    /**
     * Returns the JSON to hand to {@link MetadataService}, or null if the text is not a graph
     * payload. A nested {@code workflow} linked document is unwrapped; anything else is kept whole
     * so the service can pick the payload itself.
     */
    static String validate(String json) {
        try {
            JsonNode data = JsonSupport.MAPPER.readTree(json);
            if (data == null || !data.isObject() || data.isEmpty()) return null;
            JsonNode nested = null;
            for (String key : PAYLOAD_KEYS) {
                JsonNode v = data.get(key);
                if (v != null && !v.isNull()) {
                    nested = v;
                    break;
                }
            }
            if (nested != null && nested.isTextual() && nested.asText().trim().startsWith("{")) {
                return json;
            }
            JsonNode graph = nested == null ? data : nested;
            if (graph.isObject() && graph.path("nodes").isArray()) {
                return JsonSupport.MAPPER.writeValueAsString(graph);
            }
            if (graph.isObject() && !graph.isEmpty()) {
                return json;
            }
            return null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
