package com.smartgallery.app.graph;

import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Single-path backward traversal: follows one named input from node to node until a
 * stop type, a literal, or the hop limit is reached.
 */
public final class GraphTracer {

    public static final int DEFAULT_MAX_HOPS = 20;

    private final GraphDocument document;

    public GraphTracer(GraphDocument document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public GraphDocument document() {
        return document;
    }

    public String trace(String startNodeId, String inputName) {
        return trace(startNodeId, inputName, Set.of(), DEFAULT_MAX_HOPS);
    }

    public String trace(String startNodeId, String inputName, Set<String> stopAtTypes) {
        return trace(startNodeId, inputName, stopAtTypes, DEFAULT_MAX_HOPS);
    }

    /**
     * @return id of the node in {@code stopAtTypes} first met on the path, else the last node whose
     *         input is a literal or unconnected; null when the start node is missing or the hop
     *         limit runs out
     */
    public String trace(String startNodeId, String inputName, Set<String> stopAtTypes, int maxHops) {
        String current = startNodeId;
        for (int hop = 0; hop < maxHops; hop++) {
            if (!document.contains(current)) {
                return null;
            }
            if (stopAtTypes != null && !stopAtTypes.isEmpty() && stopAtTypes.contains(document.nodeType(current))) {
                return current;
            }
            String source = document.inputSource(current, inputName);
            if (source == null) {
                return current;
            }
            current = source;
        }
        return null;
    }

    /**
     * Literal parameter of a node, falling back to the value of a primitive node wired into
     * that parameter. Null when neither exists.
     */
    public JsonNode value(String nodeId, String paramName) {
        if (nodeId == null || !document.contains(nodeId)) return null;
        JsonNode direct = document.widgetValue(nodeId, paramName);
        if (direct != null) return direct;

        InputRef ref = document.input(nodeId, paramName);
        if (ref instanceof InputRef.Connection c && NodeTypes.isPrimitive(document.nodeType(c.nodeId()))) {
            return document.primitiveValue(c.nodeId());
        }
        return null;
    }

    public String text(String nodeId, String paramName) {
        JsonNode v = value(nodeId, paramName);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
