package com.smartgallery.app.database;

import java.io.File;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.cache.BoundedCache;
import com.smartgallery.app.metadata.SamplerRecord;

/**
 * Files and their sampler rows. All reads and writes go through here; every entry point throws
 * {@link IndexNotInitializedException} until {@link #init()} has completed.
 */
public final class IndexStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);

    static final String OPTIONS_KEY = "options";

    private static final RowMapper<FileRow> FILE_ROW_MAPPER = (rs, ctx) ->
            new FileRow(new GalleryDao.FileRecordMapper().map(rs, ctx), rs.getInt("sampler_count"));

    private final IndexDatabase database;
    private final BoundedCache<String, FilterOptions> optionsCache;

    public IndexStore(IndexDatabase database, BoundedCache<String, FilterOptions> optionsCache) {
        this.database = database;
        this.optionsCache = optionsCache;
    }

    public void init() {
        database.init();
    }

    public boolean isReady() {
        return database.isInitialized();
    }

    public Path dbFile() {
        return database.dbFile();
    }

    // --- writes ---

    public void upsertFiles(List<FileRecord> batch) {
        if (batch.isEmpty()) return;
        dao(dao -> {
            dao.upsertFiles(batch);
            return null;
        });
    }

    /** Deletes the file's sampler rows and inserts {@code records} in one transaction. */
    public void replaceSamplers(String fileId, List<SamplerRecord> records) {
        dao(dao -> {
            dao.replaceSamplers(fileId, records);
            return null;
        });
    }

    /** One transaction per call; the sampler rows of the deleted files go with them. */
    public int deleteByPath(List<String> paths) {
        return dao(dao -> dao.deletePaths(paths));
    }

    public void commitBatch(List<FileRecord> files, Map<String, List<SamplerRecord>> samplersByFileId) {
        dao(dao -> {
            dao.commitBatch(files, samplersByFileId);
            return null;
        });
    }

    public int deleteById(String id) {
        return dao(dao -> dao.deleteById(id));
    }

    /** Changes id, path and name together; sampler rows follow the new id. */
    public boolean updateLocation(String oldId, String newId, String newPath, String newName) {
        return dao(dao -> dao.relocate(oldId, newId, newPath, newName)) > 0;
    }

    public int setFavorite(Collection<String> ids, boolean favorite) {
        if (ids.isEmpty()) return 0;
        return dao(dao -> dao.setFavorite(ids, favorite));
    }

    public boolean toggleFavorite(String id) {
        return dao(dao -> dao.toggleFavorite(id)) > 0;
    }

    // --- reads ---

    public Map<String, Double> allPathMtimes() {
        return toMap(dao(GalleryDao::fetchAllPathMtimes));
    }

    /** Indexed paths directly inside {@code folder}, not in its subfolders. */
    public Map<String, Double> pathMtimesIn(Path folder) {
        String prefix = FilterSql.escapeLike(folder.toAbsolutePath().normalize() + File.separator);
        String nested = prefix + "%" + FilterSql.escapeLike(File.separator) + "%";
        return toMap(dao(dao -> dao.fetchPathMtimesIn(prefix + "%", nested)));
    }

    public Optional<FileRecord> findFile(String id) {
        return dao(dao -> dao.findById(id));
    }

    public Optional<FileRecord> findByPath(String path) {
        return dao(dao -> dao.findByPath(path));
    }

    public List<FileRecord> findFiles(Collection<String> ids) {
        if (ids.isEmpty()) return List.of();
        return dao(dao -> dao.findByIds(ids));
    }

    public List<SamplerRecord> samplers(String fileId) {
        return dao(dao -> dao.samplersForFile(fileId));
    }

    public long countFiles() {
        return dao(GalleryDao::countFiles);
    }

    public long countSamplers() {
        return dao(GalleryDao::countSamplers);
    }

    public long countMatching(GalleryFilter filter) {
        FilterSql where = FilterSql.of(filter);
        String sql = "SELECT COUNT(*) FROM files f" + where.where();
        return jdbi().withHandle(h -> h.createQuery(sql)
                .bindMap(where.params())
                .mapTo(Long.class)
                .one());
    }

    public Page<FileRow> queryPage(GalleryFilter filter, SortOrder sort, int limit, int offset) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);

        FilterSql where = FilterSql.of(filter);
        String sql = "SELECT " + GalleryDao.FILE_COLUMNS
                + ", (SELECT COUNT(*) FROM workflow_metadata wc WHERE wc.file_id = f.id) AS sampler_count"
                + " FROM files f" + where.where()
                + " ORDER BY " + sort.sql() + ", f.id"
                + " LIMIT :limit OFFSET :offset";

        List<FileRow> rows = jdbi().withHandle(h -> h.createQuery(sql)
                .bindMap(where.params())
                .bind("limit", limit)
                .bind("offset", offset)
                .map(FILE_ROW_MAPPER)
                .list());
        long total = countMatching(filter);
        return new Page<>(rows, total, limit, offset);
    }

    /** Facet values and numeric ranges, cached until the next {@link #invalidateCaches()}. */
    public FilterOptions filterOptions() {
        requireReady();
        return optionsCache.get(OPTIONS_KEY, () -> dao(dao -> FilterOptions.of(
                dao.modelCounts(), dao.samplerCounts(), dao.schedulerCounts(), dao.ranges())));
    }

    public void invalidateCaches() {
        optionsCache.remove(OPTIONS_KEY);
        logger.debug("Filter options invalidated");
    }

    @Override
    public void close() {
        database.close();
    }

    private Jdbi jdbi() {
        requireReady();
        return database.jdbi();
    }

    private void requireReady() {
        if (!database.isInitialized()) throw new IndexNotInitializedException();
    }

    private <T> T dao(Function<GalleryDao, T> call) {
        return jdbi().withExtension(GalleryDao.class, call::apply);
    }

    private static Map<String, Double> toMap(List<PathMtime> rows) {
        Map<String, Double> out = new HashMap<>(rows.size() * 2);
        for (PathMtime r : rows) out.put(r.path(), r.mtime());
        return out;
    }
}
