package com.smartgallery.app.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node input as seen by the tracer: either a literal value or a connection
 * to another node's output slot.
 */
public sealed interface InputRef permits InputRef.Literal, InputRef.Connection {

    record Literal(JsonNode value) implements InputRef {}

    record Connection(String nodeId, int slot) implements InputRef {}

    static InputRef literal(JsonNode value) {
        return new Literal(value);
    }

    static InputRef connection(String nodeId, int slot) {
        return new Connection(nodeId, slot);
    }
}
