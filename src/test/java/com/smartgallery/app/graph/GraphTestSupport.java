package com.smartgallery.app.graph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class GraphTestSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphTestSupport() {}

    public static String resource(String name) {
        try (InputStream in = GraphTestSupport.class.getResourceAsStream("/graphs/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing test resource " + name);
            return new String(in.readAllBytes(), java.nio.charset.StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GraphDocument document(String resourceName) throws UnrecognizedFormatException {
        return GraphDocument.of(json(resource(resourceName)));
    }
}
