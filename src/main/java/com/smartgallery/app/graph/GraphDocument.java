package com.smartgallery.app.graph;

import java.util.Collection;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One node graph, normalized over its two wire serializations.
 * <p>
 * The linked variant carries a top-level {@code nodes} array plus a {@code links} table and
 * addresses widget values by position. The inline variant is a map of node id to
 * {@code {class_type, inputs}} where a connection is an inline {@code [nodeId, slot]} pair.
 * Instances are immutable once built.
 */
public interface GraphDocument {

    enum Variant { LINKED, INLINE }

    Variant variant();

    /** Ids of every well-formed node, in document order. */
    Collection<String> nodeIds();

    /** True when the id names an object-shaped node. */
    boolean contains(String nodeId);

    /** Class name of the node, or null when the node is missing or has none. */
    String nodeType(String nodeId);

    /**
     * Resolves an input to a literal or a connection, or null if the node has no such input.
     * A connection may point at an id that is not in the document; {@link #inputSource} filters those.
     */
    InputRef input(String nodeId, String inputName);

    /** Literal widget parameter, or null. Connections are never returned here. */
    JsonNode widgetValue(String nodeId, String paramName);

    /** The literal held by a primitive/constant node, or null. */
    JsonNode primitiveValue(String nodeId);

    /** Id of the node feeding the named input, or null when it is a literal or unconnected. */
    default String inputSource(String nodeId, String inputName) {
        InputRef ref = input(nodeId, inputName);
        if (ref instanceof InputRef.Connection c && contains(c.nodeId())) {
            return c.nodeId();
        }
        return null;
    }

    /**
     * Picks the variant from the document shape.
     *
     * @throws UnrecognizedFormatException if neither shape matches
     */
    static GraphDocument of(JsonNode root) throws UnrecognizedFormatException {
        if (root == null || !root.isObject()) {
            throw new UnrecognizedFormatException("Graph root must be a JSON object");
        }
        JsonNode nodes = root.get("nodes");
        if (nodes != null && nodes.isArray()) {
            return new LinkedGraphDocument(root);
        }
        if (InlineGraphDocument.looksInline(root)) {
            return new InlineGraphDocument(root);
        }
        throw new UnrecognizedFormatException("Neither a node array nor a node-id map with class_type entries");
    }
}
