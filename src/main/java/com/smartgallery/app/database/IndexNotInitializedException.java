package com.smartgallery.app.database;

/** Thrown by every index entry point while the store is not initialized. */
public class IndexNotInitializedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public IndexNotInitializedException() {
        super("Index store is not initialized");
    }
}
