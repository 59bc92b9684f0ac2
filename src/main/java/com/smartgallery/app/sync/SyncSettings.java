package com.smartgallery.app.sync;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

import com.smartgallery.app.analyze.ImageIoThumbnailProducer;
import com.smartgallery.app.analyze.MediaExtensions;
import com.smartgallery.app.analyze.ThumbnailProducer;
import com.smartgallery.app.config.GalleryConfig;
import com.smartgallery.app.metadata.DebugSink;
import com.smartgallery.app.metadata.EmbeddedMetadataReader;
import com.smartgallery.app.metadata.RawMetadataSource;

/**
 * Everything a sync pass and its workers need, fixed for the lifetime of one engine.
 *
 * @param excludedDirNames folder names never descended into during a full scan
 */
public record SyncSettings(
        Path root,
        MediaExtensions extensions,
        Set<String> excludedDirNames,
        int workers,
        int batchSize,
        RawMetadataSource metadataSource,
        ThumbnailProducer thumbnails,
        DebugSink debug
) {

    public static final Set<String> DEFAULT_EXCLUDED_DIRS =
            Set.of(GalleryConfig.THUMBNAIL_CACHE_FOLDER_NAME, GalleryConfig.SQLITE_CACHE_FOLDER_NAME);

    public SyncSettings {
        root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        extensions = extensions == null ? MediaExtensions.defaults() : extensions;
        excludedDirNames = excludedDirNames == null ? DEFAULT_EXCLUDED_DIRS : Set.copyOf(excludedDirNames);
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        metadataSource = metadataSource == null ? new EmbeddedMetadataReader() : metadataSource;
        thumbnails = thumbnails == null ? ThumbnailProducer.NONE : thumbnails;
        debug = debug == null ? DebugSink.NONE : debug;
    }

    public static SyncSettings from(GalleryConfig config) {
        return new SyncSettings(
                config.outputPath(),
                MediaExtensions.defaults(),
                DEFAULT_EXCLUDED_DIRS,
                config.workers(),
                config.batchSize(),
                new EmbeddedMetadataReader(),
                new ImageIoThumbnailProducer(config.thumbnailCacheDir(), config.thumbnailWidth()),
                DebugSink.forDirectory(config.debugDir())
        );
    }

    public SyncSettings withThumbnails(ThumbnailProducer producer) {
        return new SyncSettings(root, extensions, excludedDirNames, workers, batchSize, metadataSource, producer, debug);
    }

    public SyncSettings withMetadataSource(RawMetadataSource source) {
        return new SyncSettings(root, extensions, excludedDirNames, workers, batchSize, source, thumbnails, debug);
    }
}
