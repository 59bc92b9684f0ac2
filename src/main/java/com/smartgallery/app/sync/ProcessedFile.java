package com.smartgallery.app.sync;

import java.nio.file.Path;
import java.util.List;

import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.metadata.SamplerRecord;

/**
 * Worker output for one file.
 *
 * @param thumbnail cached preview path, or null when none was produced
 */
public record ProcessedFile(FileRecord file, List<SamplerRecord> samplers, ExtractionStatus status, Path thumbnail) {

    public ProcessedFile {
        samplers = List.copyOf(samplers);
    }
}
