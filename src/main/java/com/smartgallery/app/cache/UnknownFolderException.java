package com.smartgallery.app.cache;

/** Thrown when a folder key does not name a folder under the output root. */
public class UnknownFolderException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public UnknownFolderException(String key) {
        super("Unknown folder key: " + key);
    }
}
