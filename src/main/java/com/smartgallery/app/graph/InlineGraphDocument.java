package com.smartgallery.app.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inline (API) serialization: {@code {nodeId: {class_type, inputs}}}. An input is a literal or an
 * inline {@code [nodeId, slot]} pair.
 */
final class InlineGraphDocument implements GraphDocument {

    private static final int SHAPE_SAMPLE = 3;

    private final Map<String, JsonNode> nodesById = new LinkedHashMap<>();

    InlineGraphDocument(JsonNode root) {
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue() != null && e.getValue().isObject()) {
                nodesById.put(e.getKey(), e.getValue());
            }
        }
    }

    /** True when the first few object entries of the map all carry a {@code class_type}. */
    static boolean looksInline(JsonNode root) {
        if (root == null || !root.isObject() || root.isEmpty()) return false;
        List<JsonNode> sample = new ArrayList<>(SHAPE_SAMPLE);
        for (JsonNode v : root) {
            if (v.isObject()) sample.add(v);
            if (sample.size() == SHAPE_SAMPLE) break;
        }
        if (sample.isEmpty()) return false;
        for (JsonNode v : sample) {
            if (!v.has("class_type")) return false;
        }
        return true;
    }

    @Override
    public Variant variant() {
        return Variant.INLINE;
    }

    @Override
    public Collection<String> nodeIds() {
        return Collections.unmodifiableSet(nodesById.keySet());
    }

    @Override
    public boolean contains(String nodeId) {
        return nodeId != null && nodesById.containsKey(nodeId);
    }

    @Override
    public String nodeType(String nodeId) {
        JsonNode node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) return null;
        JsonNode type = node.get("class_type");
        return type != null && type.isTextual() ? type.asText() : null;
    }

    @Override
    public InputRef input(String nodeId, String inputName) {
        JsonNode raw = rawInput(nodeId, inputName);
        if (raw == null) return null;
        if (raw.isArray()) {
            if (raw.isEmpty() || !raw.get(0).isValueNode()) return null;
            return InputRef.connection(raw.get(0).asText(), raw.size() > 1 ? raw.get(1).asInt(0) : 0);
        }
        return InputRef.literal(raw);
    }

    @Override
    public JsonNode widgetValue(String nodeId, String paramName) {
        JsonNode raw = rawInput(nodeId, paramName);
        if (raw == null || raw.isArray()) return null;
        return raw;
    }

    @Override
    public JsonNode primitiveValue(String nodeId) {
        return widgetValue(nodeId, "value");
    }

    private JsonNode rawInput(String nodeId, String name) {
        JsonNode node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) return null;
        JsonNode inputs = node.get("inputs");
        if (inputs == null || !inputs.isObject()) return null;
        JsonNode v = inputs.get(name);
        return (v == null || v.isNull()) ? null : v;
    }
}
