package com.smartgallery.app.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.analyze.FileAnalysis;
import com.smartgallery.app.analyze.FileAnalyzer;
import com.smartgallery.app.analyze.Hashes;
import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.metadata.MetadataService;
import com.smartgallery.app.metadata.SamplerExtractor;
import com.smartgallery.app.metadata.SamplerRecord;

/** Turns one path into its index row and sampler rows. Safe to share between worker threads. */
final class FileProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FileProcessor.class);

    static final int PREVIEW_LENGTH = 150;

    private final SyncSettings settings;
    private final FileAnalyzer analyzer;
    private final MetadataService metadata;

    FileProcessor(SyncSettings settings) {
        this.settings = settings;
        this.analyzer = new FileAnalyzer(settings.extensions());
        this.metadata = new MetadataService(new SamplerExtractor(), settings.debug());
    }

    /**
     * @throws IOException when the file itself cannot be read; metadata and thumbnail problems
     *                     are folded into the result instead
     */
    ProcessedFile process(Path file, SyncMetrics metrics) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        double mtime = mtimeSeconds(attrs);
        String path = file.toString();

        FileAnalysis analysis = analyzer.analyze(file);

        ExtractionStatus status;
        List<SamplerRecord> samplers = List.of();
        byte[] raw = null;
        try {
            raw = settings.metadataSource().read(file);
            if (raw == null || raw.length == 0) {
                status = ExtractionStatus.NO_WORKFLOW;
            } else {
                samplers = metadata.extract(raw, file);
                status = samplers.isEmpty() ? ExtractionStatus.NOT_EXTRACTED : ExtractionStatus.EXTRACTED;
            }
        } catch (IOException | RuntimeException e) {
            status = ExtractionStatus.FAILED;
            if (metrics.parseError()) {
                logger.warn("Metadata read failed for {}: {}", file, e.toString());
            }
        }

        Path thumbnail = null;
        try {
            thumbnail = settings.thumbnails().produce(file, Hashes.thumbnailHash(path, mtime), analysis.type());
        } catch (IOException | RuntimeException e) {
            logger.warn("Thumbnail failed for {}: {}", file, e.toString());
        }

        FileRecord record = new FileRecord(
                Hashes.fileId(path),
                path,
                mtime,
                file.getFileName().toString(),
                analysis.type().dbValue(),
                analysis.duration(),
                analysis.dimensions(),
                raw != null && raw.length > 0,
                false,
                promptPreview(samplers),
                samplerNames(samplers)
        );
        return new ProcessedFile(record, samplers, status, thumbnail);
    }

    static double mtimeSeconds(BasicFileAttributes attrs) {
        return attrs.lastModifiedTime().to(TimeUnit.MICROSECONDS) / 1_000_000.0;
    }

    /** First sampler's positive prompt, trimmed and cut to {@value #PREVIEW_LENGTH} characters plus an ellipsis. */
    static String promptPreview(List<SamplerRecord> samplers) {
        if (samplers.isEmpty()) return null;
        String prompt = StringUtils.trimToNull(samplers.get(0).positivePrompt());
        if (prompt == null) return null;
        return prompt.length() > PREVIEW_LENGTH ? prompt.substring(0, PREVIEW_LENGTH) + "..." : prompt;
    }

    /** Distinct sampler names, sorted, joined with {@code ", "}. */
    static String samplerNames(List<SamplerRecord> samplers) {
        TreeSet<String> names = new TreeSet<>();
        for (SamplerRecord s : samplers) {
            if (StringUtils.isNotBlank(s.samplerName())) names.add(s.samplerName());
        }
        return names.isEmpty() ? null : String.join(", ", names);
    }
}
