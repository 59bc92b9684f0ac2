package com.smartgallery.app.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Linked (UI) serialization: {@code nodes} array, {@code links} table and optional
 * {@code widget_idx_map}. Widget values are positional.
 */
final class LinkedGraphDocument implements GraphDocument {

    private record LinkTarget(String nodeId, int slot) {}

    private final Map<String, JsonNode> nodesById = new LinkedHashMap<>();
    private final Map<Long, LinkTarget> links = new LinkedHashMap<>();
    private final JsonNode widgetIndexMap;

    LinkedGraphDocument(JsonNode root) {
        for (JsonNode n : root.get("nodes")) {
            if (n == null || !n.isObject() || !n.hasNonNull("id")) continue;
            nodesById.put(n.get("id").asText(), n);
        }
        JsonNode linkList = root.get("links");
        if (linkList != null && linkList.isArray()) {
            for (JsonNode link : linkList) {
                readLink(link);
            }
        }
        JsonNode idx = root.get("widget_idx_map");
        this.widgetIndexMap = (idx != null && idx.isObject()) ? idx : null;
    }

    // [link_id, src_node, src_slot, dst_node, dst_slot, type] or the object form
    private void readLink(JsonNode link) {
        if (link == null) return;
        if (link.isArray() && link.size() >= 3 && link.get(0).canConvertToLong()) {
            links.put(link.get(0).asLong(), new LinkTarget(link.get(1).asText(), link.get(2).asInt(0)));
        } else if (link.isObject() && link.hasNonNull("id") && link.hasNonNull("origin_id")) {
            links.put(link.get("id").asLong(),
                    new LinkTarget(link.get("origin_id").asText(), link.path("origin_slot").asInt(0)));
        }
    }

    @Override
    public Variant variant() {
        return Variant.LINKED;
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
        JsonNode type = node.get("type");
        return type != null && type.isTextual() ? type.asText() : null;
    }

    @Override
    public InputRef input(String nodeId, String inputName) {
        JsonNode node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) return null;
        JsonNode inputs = node.get("inputs");
        if (inputs != null && inputs.isArray()) {
            for (JsonNode def : inputs) {
                if (!def.isObject() || !inputName.equals(def.path("name").asText(null))) continue;
                JsonNode linkId = def.get("link");
                if (linkId != null && linkId.canConvertToLong()) {
                    LinkTarget target = links.get(linkId.asLong());
                    if (target != null) {
                        return InputRef.connection(target.nodeId(), target.slot());
                    }
                }
                break;
            }
        }
        JsonNode literal = widgetValue(nodeId, inputName);
        return literal == null ? null : InputRef.literal(literal);
    }

    @Override
    public JsonNode widgetValue(String nodeId, String paramName) {
        JsonNode node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) return null;
        JsonNode values = node.get("widgets_values");
        if (values == null) return null;

        if (values.isObject()) {
            return present(values.get(paramName));
        }
        if (!values.isArray()) return null;

        if (widgetIndexMap != null) {
            JsonNode perNode = widgetIndexMap.get(nodeId);
            if (perNode != null && perNode.isObject()) {
                JsonNode idx = perNode.get(paramName);
                if (idx != null && idx.isInt() && idx.asInt() >= 0 && idx.asInt() < values.size()) {
                    return present(values.get(idx.asInt()));
                }
            }
        }

        int pos = WidgetPositions.indexOf(nodeType(nodeId), paramName);
        if (pos >= 0 && pos < values.size()) {
            return present(values.get(pos));
        }
        return null;
    }

    @Override
    public JsonNode primitiveValue(String nodeId) {
        JsonNode node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) return null;
        JsonNode values = node.get("widgets_values");
        if (values == null) return null;
        if (values.isArray()) {
            return values.isEmpty() ? null : present(values.get(0));
        }
        return values.isObject() ? present(values.get("value")) : null;
    }

    private static JsonNode present(JsonNode v) {
        return (v == null || v.isNull() || v.isMissingNode()) ? null : v;
    }
}
