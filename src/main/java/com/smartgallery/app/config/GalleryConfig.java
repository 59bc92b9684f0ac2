package com.smartgallery.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Central configuration of the gallery indexer.
 * Every key is resolved from a JVM system property, then the OS environment,
 * then a local {@code .env} file, then a built-in default.
 */
public record GalleryConfig(
        Path outputPath,
        Path dataDir,
        String dbName,
        int workers,
        int batchSize,
        int thumbnailWidth,
        int pageSize,
        Path debugDir
) {

    private static final String APP_NAME = "SmartGallery";

    public static final String THUMBNAIL_CACHE_FOLDER_NAME = ".thumbnails_cache";
    public static final String SQLITE_CACHE_FOLDER_NAME = ".sqlite_cache";

    private static final String DEFAULT_DB_NAME = "gallery_cache.sqlite";
    private static final int DEFAULT_WORKERS = 4;
    private static final int DEFAULT_BATCH_SIZE = 500;
    private static final int DEFAULT_THUMBNAIL_WIDTH = 300;
    private static final int DEFAULT_PAGE_SIZE = 100;

    private static final String ENV_OUTPUT_PATH = "GALLERY_OUTPUT_PATH";
    private static final String ENV_DATA_DIR = "GALLERY_DATA_DIR";
    private static final String ENV_DB_NAME = "GALLERY_DB_NAME";
    private static final String ENV_WORKERS = "GALLERY_WORKERS";
    private static final String ENV_BATCH_SIZE = "GALLERY_BATCH_SIZE";
    private static final String ENV_THUMBNAIL_WIDTH = "GALLERY_THUMBNAIL_WIDTH";
    private static final String ENV_PAGE_SIZE = "GALLERY_PAGE_SIZE";
    private static final String ENV_DEBUG_DIR = "GALLERY_DEBUG_DIR";

    // System property overrides (tests/CI)
    private static final String PROP_OUTPUT_PATH = "gallery.outputPath";
    private static final String PROP_DATA_DIR = "gallery.dataDir";
    private static final String PROP_DB_NAME = "gallery.dbName";
    private static final String PROP_WORKERS = "gallery.workers";
    private static final String PROP_BATCH_SIZE = "gallery.batchSize";
    private static final String PROP_THUMBNAIL_WIDTH = "gallery.thumbnailWidth";
    private static final String PROP_PAGE_SIZE = "gallery.pageSize";
    private static final String PROP_DEBUG_DIR = "gallery.debugDir";

    // Logger must be initialized before the dotenv loader in case it logs
    private static final Logger logger = LoggerFactory.getLogger(GalleryConfig.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public GalleryConfig {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is required");
        if (dataDir == null) throw new IllegalArgumentException("dataDir is required");
        dbName = StringUtils.defaultIfBlank(dbName, DEFAULT_DB_NAME);
        workers = Math.max(1, workers);
        batchSize = Math.max(1, batchSize);
        thumbnailWidth = Math.max(16, thumbnailWidth);
        pageSize = Math.max(1, pageSize);
    }

    public static GalleryConfig load() {
        Path output = Paths.get(StringUtils.defaultIfBlank(getEnvOrDotenv(ENV_OUTPUT_PATH), "output"))
                .toAbsolutePath().normalize();
        String debug = getEnvOrDotenv(ENV_DEBUG_DIR);
        return new GalleryConfig(
                output,
                resolveDataDir(),
                getEnvOrDotenv(ENV_DB_NAME),
                intOrDefault(ENV_WORKERS, DEFAULT_WORKERS),
                intOrDefault(ENV_BATCH_SIZE, DEFAULT_BATCH_SIZE),
                intOrDefault(ENV_THUMBNAIL_WIDTH, DEFAULT_THUMBNAIL_WIDTH),
                intOrDefault(ENV_PAGE_SIZE, DEFAULT_PAGE_SIZE),
                debug == null ? null : Paths.get(debug).toAbsolutePath().normalize()
        );
    }

    /** Config rooted at an explicit output folder, keeping data next to it. Used by tests and embedders. */
    public static GalleryConfig forOutput(Path outputPath) {
        Path output = outputPath.toAbsolutePath().normalize();
        return new GalleryConfig(output, output.resolve(SQLITE_CACHE_FOLDER_NAME), DEFAULT_DB_NAME,
                DEFAULT_WORKERS, DEFAULT_BATCH_SIZE, DEFAULT_THUMBNAIL_WIDTH, DEFAULT_PAGE_SIZE, null);
    }

    public GalleryConfig withWorkers(int n) {
        return new GalleryConfig(outputPath, dataDir, dbName, n, batchSize, thumbnailWidth, pageSize, debugDir);
    }

    public GalleryConfig withBatchSize(int n) {
        return new GalleryConfig(outputPath, dataDir, dbName, workers, n, thumbnailWidth, pageSize, debugDir);
    }

    public GalleryConfig withDebugDir(Path dir) {
        return new GalleryConfig(outputPath, dataDir, dbName, workers, batchSize, thumbnailWidth, pageSize, dir);
    }

    public Path dbFilePath() {
        return dataDir.resolve(dbName);
    }

    public String dbUrl() {
        return "jdbc:sqlite:" + dbFilePath().toAbsolutePath();
    }

    public Path thumbnailCacheDir() {
        return dataDir.resolve(THUMBNAIL_CACHE_FOLDER_NAME);
    }

    public boolean debugEnabled() {
        return debugDir != null;
    }

    // --- resolution ---

    private static int intOrDefault(String envKey, int fallback) {
        String v = getEnvOrDotenv(envKey);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", envKey, v, fallback);
            return fallback;
        }
    }

    static String getEnvOrDotenv(String key) {
        // 0. system property override
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (StringUtils.isNotBlank(propVal)) {
                return propVal.trim();
            }
        }

        // 1. OS environment
        String envVal = System.getenv(key);
        if (StringUtils.isNotBlank(envVal)) {
            return envVal.trim();
        }

        // 2. .env file
        String fileVal = dotenv.get(key);
        if (StringUtils.isBlank(fileVal)) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_OUTPUT_PATH -> PROP_OUTPUT_PATH;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_WORKERS -> PROP_WORKERS;
            case ENV_BATCH_SIZE -> PROP_BATCH_SIZE;
            case ENV_THUMBNAIL_WIDTH -> PROP_THUMBNAIL_WIDTH;
            case ENV_PAGE_SIZE -> PROP_PAGE_SIZE;
            case ENV_DEBUG_DIR -> PROP_DEBUG_DIR;
            default -> null;
        };
    }

    private static Path resolveDataDir() {
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);
        if (overrideDir != null) {
            Path p = Paths.get(overrideDir).toAbsolutePath().normalize();
            try {
                Files.createDirectories(p);
            } catch (IOException e) {
                throw new IllegalStateException("Could not create data directory: " + p, e);
            }
            logger.info("Index data directory (override): {}", p);
            return p;
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            appDataDir = StringUtils.isNotBlank(appDataEnv)
                    ? Paths.get(appDataEnv, APP_NAME)
                    : Paths.get(userHome, "AppData", "Roaming", APP_NAME);
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // XDG (~/.local/share/SmartGallery)
            String xdgData = System.getenv("XDG_DATA_HOME");
            appDataDir = StringUtils.isNotBlank(xdgData)
                    ? Paths.get(xdgData, APP_NAME)
                    : Paths.get(userHome, ".local", "share", APP_NAME);
        }

        try {
            Files.createDirectories(appDataDir);
            logger.info("Index data directory: {}", appDataDir.toAbsolutePath());
            return appDataDir;
        } catch (IOException e) {
            Path localPath = Paths.get(SQLITE_CACHE_FOLDER_NAME).toAbsolutePath();
            logger.warn("Cannot use {}. Falling back to local directory: {}", appDataDir, localPath);
            return localPath;
        }
    }
}
