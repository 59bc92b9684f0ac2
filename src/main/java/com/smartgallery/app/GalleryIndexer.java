package com.smartgallery.app;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.cache.BoundedCache;
import com.smartgallery.app.cache.CacheStats;
import com.smartgallery.app.cache.FolderLayoutCache;
import com.smartgallery.app.cache.FolderLayoutCache.FolderEntry;
import com.smartgallery.app.config.GalleryConfig;
import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.database.FileRow;
import com.smartgallery.app.database.FilterOptions;
import com.smartgallery.app.database.GalleryFilter;
import com.smartgallery.app.database.IndexDatabase;
import com.smartgallery.app.database.IndexStore;
import com.smartgallery.app.database.Page;
import com.smartgallery.app.database.SortOrder;
import com.smartgallery.app.metadata.SamplerRecord;
import com.smartgallery.app.service.GalleryMutations;
import com.smartgallery.app.sync.SyncEngine;
import com.smartgallery.app.sync.SyncProgress;
import com.smartgallery.app.sync.SyncSettings;
import com.smartgallery.app.sync.SyncSummary;

/**
 * One running gallery: owns the index, the sync engine and every cache. Callers construct it at
 * startup, call {@link #start()}, and hand the instance to whatever serves requests.
 */
public final class GalleryIndexer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GalleryIndexer.class);

    static final int OPTIONS_CACHE_SIZE = 50;
    static final Duration OPTIONS_CACHE_TTL = Duration.ofSeconds(300);
    static final int TIMING_LOG_SIZE = 500;
    static final Duration TIMING_LOG_TTL = Duration.ofSeconds(600);

    private final GalleryConfig config;
    private final IndexStore store;
    private final BoundedCache<String, FilterOptions> optionsCache;
    private final BoundedCache<String, RequestTiming> timings;
    private final FolderLayoutCache folders;
    private final SyncEngine sync;
    private final GalleryMutations mutations;

    public GalleryIndexer(GalleryConfig config) {
        this(config, SyncSettings.from(config));
    }

    public GalleryIndexer(GalleryConfig config, SyncSettings settings) {
        this.config = config;
        this.optionsCache = new BoundedCache<>(OPTIONS_CACHE_SIZE, OPTIONS_CACHE_TTL);
        this.timings = new BoundedCache<>(TIMING_LOG_SIZE, TIMING_LOG_TTL);
        this.store = new IndexStore(new IndexDatabase(config.dbFilePath()), optionsCache);
        this.folders = new FolderLayoutCache(config.outputPath(), settings.excludedDirNames());
        this.sync = new SyncEngine(settings, store, folders::invalidate);
        this.mutations = new GalleryMutations(store, config.thumbnailCacheDir(), folders::invalidate);
    }

    /** Opens and migrates the index. Throws when the schema cannot be brought up to date. */
    public void start() {
        store.init();
        logger.info("Gallery index ready: {} files, {} sampler rows", store.countFiles(), store.countSamplers());
    }

    public GalleryConfig config() {
        return config;
    }

    public IndexStore store() {
        return store;
    }

    public GalleryMutations mutations() {
        return mutations;
    }

    public SyncSummary runFullSync() throws IOException {
        Instant t0 = Instant.now();
        SyncSummary summary = sync.runFullSync();
        recordTiming("full_sync", t0);
        return summary;
    }

    public SyncSummary runFolderSync(String folderKey, Consumer<SyncProgress> progress) {
        return runFolderSync(folders.resolve(folderKey), progress);
    }

    private SyncSummary runFolderSync(Path folder, Consumer<SyncProgress> progress) {
        return timed("folder_sync", () -> sync.runFolderSync(folder, progress));
    }

    public Page<FileRow> queryPage(GalleryFilter filter, SortOrder sort, int page) {
        int limit = config.pageSize();
        int offset = Math.max(0, page) * limit;
        return timed("query_page", () -> store.queryPage(filter, sort, limit, offset));
    }

    public long countMatching(GalleryFilter filter) {
        return timed("count_matching", () -> store.countMatching(filter));
    }

    public FilterOptions filterOptions() {
        return timed("filter_options", store::filterOptions);
    }

    public FileRecord file(String id) {
        return store.findFile(id).orElse(null);
    }

    public List<SamplerRecord> samplers(String fileId) {
        return store.samplers(fileId);
    }

    public Map<String, FolderEntry> folders(boolean forceRefresh) {
        return timed("folders", () -> folders.folders(forceRefresh));
    }

    public RequestTiming lastTiming(String operation) {
        return timings.get(operation);
    }

    public CacheStats optionsCacheStats() {
        return optionsCache.stats();
    }

    private <T> T timed(String operation, Supplier<T> call) {
        Instant t0 = Instant.now();
        try {
            return call.get();
        } finally {
            recordTiming(operation, t0);
        }
    }

    private void recordTiming(String operation, Instant t0) {
        Instant now = Instant.now();
        long ms = Duration.between(t0, now).toMillis();
        timings.set(operation, new RequestTiming(operation, ms, now));
        logger.debug("{} took {} ms", operation, ms);
    }

    @Override
    public void close() {
        sync.close();
        store.close();
        optionsCache.clear();
        timings.clear();
        logger.info("Gallery index closed");
    }
}
