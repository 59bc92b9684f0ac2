package com.smartgallery.app.metadata;

import java.io.IOException;
import java.nio.file.Path;

/** Reads the embedded generation payload of a media file. */
@FunctionalInterface
public interface RawMetadataSource {

    /**
     * @return the raw payload bytes, or null when the file carries none
     */
    byte[] read(Path file) throws IOException;
}
