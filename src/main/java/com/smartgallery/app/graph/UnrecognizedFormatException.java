package com.smartgallery.app.graph;

/**
 * Raised when a JSON document is neither a linked (UI) nor an inline (API) node graph.
 */
public class UnrecognizedFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    public UnrecognizedFormatException(String message) {
        super(message);
    }
}
