package com.smartgallery.app.database;

/**
 * One indexed media file. {@code id} is derived from {@code path} and must change with it.
 */
public record FileRecord(
        String id,
        String path,
        double mtime,
        String name,
        String type,
        String duration,
        String dimensions,
        boolean hasWorkflow,
        boolean isFavorite,
        String promptPreview,
        String samplerNames
) {}
