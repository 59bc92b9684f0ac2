package com.smartgallery.app.analyze;

import java.io.IOException;
import java.nio.file.Path;

/** Produces a cached preview image for a media file. */
@FunctionalInterface
public interface ThumbnailProducer {

    ThumbnailProducer NONE = (file, contentHash, type) -> null;

    /**
     * @param contentHash path+mtime hash that names the cache entry
     * @return path of the cached thumbnail, or null when none can be made for this type
     */
    Path produce(Path file, String contentHash, MediaType type) throws IOException;
}
