package com.smartgallery.app.config;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GalleryConfigTest {

    private static final String[] PROPS = {
            "gallery.outputPath", "gallery.dataDir", "gallery.dbName", "gallery.workers",
            "gallery.batchSize", "gallery.pageSize", "gallery.debugDir"
    };

    @AfterEach
    void clearProperties() {
        for (String p : PROPS) System.clearProperty(p);
    }

    @Test
    void systemPropertiesOverrideDefaults() throws Exception {
        Path out = Files.createTempDirectory("gallery-out-");
        Path data = out.resolve("data");
        System.setProperty("gallery.outputPath", out.toString());
        System.setProperty("gallery.dataDir", data.toString());
        System.setProperty("gallery.dbName", "custom.sqlite");
        System.setProperty("gallery.workers", "2");
        System.setProperty("gallery.batchSize", "50");
        System.setProperty("gallery.debugDir", out.resolve("debug").toString());

        GalleryConfig cfg = GalleryConfig.load();

        assertEquals(out.toAbsolutePath().normalize(), cfg.outputPath());
        assertEquals(data.toAbsolutePath().normalize(), cfg.dataDir());
        assertTrue(Files.isDirectory(data), "data directory is created");
        assertEquals(data.toAbsolutePath().normalize().resolve("custom.sqlite"), cfg.dbFilePath());
        assertTrue(cfg.dbUrl().startsWith("jdbc:sqlite:"));
        assertEquals(2, cfg.workers());
        assertEquals(50, cfg.batchSize());
        assertTrue(cfg.debugEnabled());
    }

    @Test
    void invalidNumbersFallBackToDefaults() throws Exception {
        Path out = Files.createTempDirectory("gallery-out-");
        System.setProperty("gallery.outputPath", out.toString());
        System.setProperty("gallery.dataDir", out.resolve("data").toString());
        System.setProperty("gallery.workers", "lots");
        System.setProperty("gallery.pageSize", "-5");

        GalleryConfig cfg = GalleryConfig.load();

        assertEquals(4, cfg.workers());
        assertEquals(1, cfg.pageSize(), "non-positive values are clamped");
    }

    @Test
    void forOutputKeepsDataBesideTheGallery() {
        GalleryConfig cfg = GalleryConfig.forOutput(Path.of("gallery-root"));

        Path root = Path.of("gallery-root").toAbsolutePath().normalize();
        assertEquals(root.resolve(".sqlite_cache"), cfg.dataDir());
        assertEquals(root.resolve(".sqlite_cache").resolve(".thumbnails_cache"), cfg.thumbnailCacheDir());
        assertEquals("gallery_cache.sqlite", cfg.dbName());
        assertFalse(cfg.debugEnabled());
        assertEquals(8, cfg.withWorkers(8).workers());
        assertEquals(1, cfg.withBatchSize(0).batchSize());
    }

    @Test
    void outputPathIsRequired() {
        assertThrows(IllegalArgumentException.class,
                () -> new GalleryConfig(null, Path.of("d"), null, 1, 1, 300, 10, null));
    }
}
