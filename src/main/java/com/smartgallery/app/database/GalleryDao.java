package com.smartgallery.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import com.smartgallery.app.database.FilterOptions.FacetCount;
import com.smartgallery.app.metadata.SamplerRecord;

public interface GalleryDao {

    String FILE_COLUMNS = """
            f.id, f.path, f.mtime, f.name, f.type, f.duration, f.dimensions,
            f.has_workflow, f.is_favorite, f.prompt_preview, f.sampler_names
            """;

    // --- Files ---------------------------------------------------------------

    @SqlQuery("SELECT path, mtime FROM files")
    @RegisterConstructorMapper(PathMtime.class)
    List<PathMtime> fetchAllPathMtimes();

    /** Paths directly inside one folder; {@code likePrefix} and {@code likeNested} are escaped LIKE patterns. */
    @SqlQuery("""
        SELECT path, mtime
          FROM files
         WHERE path LIKE :likePrefix ESCAPE '!'
           AND path NOT LIKE :likeNested ESCAPE '!'
        """)
    @RegisterConstructorMapper(PathMtime.class)
    List<PathMtime> fetchPathMtimesIn(@Bind("likePrefix") String likePrefix, @Bind("likeNested") String likeNested);

    @SqlQuery("SELECT " + FILE_COLUMNS + " FROM files f WHERE f.id = :id")
    @RegisterRowMapper(FileRecordMapper.class)
    Optional<FileRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT " + FILE_COLUMNS + " FROM files f WHERE f.id IN (<ids>)")
    @RegisterRowMapper(FileRecordMapper.class)
    List<FileRecord> findByIds(@BindList("ids") Collection<String> ids);

    @SqlQuery("SELECT " + FILE_COLUMNS + " FROM files f WHERE f.path = :path")
    @RegisterRowMapper(FileRecordMapper.class)
    Optional<FileRecord> findByPath(@Bind("path") String path);

    /** Insert or refresh a file; the favorite flag of an existing row is kept. */
    @SqlBatch("""
        INSERT INTO files(id, path, mtime, name, type, duration, dimensions,
                          has_workflow, is_favorite, prompt_preview, sampler_names)
        VALUES(:id, :path, :mtime, :name, :type, :duration, :dimensions,
               :hasWorkflow, :isFavorite, :promptPreview, :samplerNames)
        ON CONFLICT(id) DO UPDATE SET
               path = excluded.path,
               mtime = excluded.mtime,
               name = excluded.name,
               type = excluded.type,
               duration = excluded.duration,
               dimensions = excluded.dimensions,
               has_workflow = excluded.has_workflow,
               prompt_preview = excluded.prompt_preview,
               sampler_names = excluded.sampler_names
        """)
    void upsertFiles(@BindMethods List<FileRecord> files);

    @SqlBatch("DELETE FROM files WHERE path = :path")
    int[] deleteByPaths(@Bind("path") List<String> paths);

    @SqlUpdate("DELETE FROM files WHERE id = :id")
    int deleteById(@Bind("id") String id);

    /** Drops rows left behind at a path another row is about to take over. */
    @SqlUpdate("DELETE FROM files WHERE (id = :newId OR path = :newPath) AND id != :oldId")
    int deleteStaleTarget(@Bind("oldId") String oldId, @Bind("newId") String newId, @Bind("newPath") String newPath);

    /** Moves a row to a new path; sampler rows follow through ON UPDATE CASCADE. */
    @SqlUpdate("UPDATE files SET id = :newId, path = :newPath, name = :newName WHERE id = :oldId")
    int updateLocation(@Bind("oldId") String oldId, @Bind("newId") String newId,
                       @Bind("newPath") String newPath, @Bind("newName") String newName);

    @SqlUpdate("UPDATE files SET is_favorite = :favorite WHERE id IN (<ids>)")
    int setFavorite(@BindList("ids") Collection<String> ids, @Bind("favorite") boolean favorite);

    @SqlUpdate("UPDATE files SET is_favorite = 1 - COALESCE(is_favorite, 0) WHERE id = :id")
    int toggleFavorite(@Bind("id") String id);

    @SqlQuery("SELECT COUNT(*) FROM files")
    long countFiles();

    // --- Samplers ------------------------------------------------------------

    @SqlBatch("DELETE FROM workflow_metadata WHERE file_id = :fileId")
    void deleteSamplers(@Bind("fileId") List<String> fileIds);

    @SqlBatch("""
        INSERT INTO workflow_metadata(file_id, sampler_index, model_name, sampler_name, scheduler,
                                      cfg, steps, positive_prompt, negative_prompt, width, height)
        VALUES(:fileId, :s.samplerIndex, :s.modelName, :s.samplerName, :s.scheduler,
               :s.cfg, :s.steps, :s.positivePrompt, :s.negativePrompt, :s.width, :s.height)
        """)
    void insertSamplers(@Bind("fileId") List<String> fileIds, @BindMethods("s") List<SamplerRecord> samplers);

    @SqlQuery("""
        SELECT sampler_index, model_name, sampler_name, scheduler, positive_prompt, negative_prompt,
               width, height, cfg, steps
          FROM workflow_metadata
         WHERE file_id = :fileId
         ORDER BY sampler_index
        """)
    @RegisterRowMapper(SamplerRecordMapper.class)
    List<SamplerRecord> samplersForFile(@Bind("fileId") String fileId);

    @SqlQuery("SELECT COUNT(*) FROM workflow_metadata")
    long countSamplers();

    // --- Filter options ------------------------------------------------------

    @SqlQuery("""
        SELECT model_name AS value, COUNT(DISTINCT file_id) AS fileCount
          FROM workflow_metadata
         WHERE model_name IS NOT NULL AND model_name != ''
         GROUP BY model_name
         ORDER BY fileCount DESC, model_name
        """)
    @RegisterConstructorMapper(FacetCount.class)
    List<FacetCount> modelCounts();

    @SqlQuery("""
        SELECT sampler_name AS value, COUNT(DISTINCT file_id) AS fileCount
          FROM workflow_metadata
         WHERE sampler_name IS NOT NULL AND sampler_name != ''
         GROUP BY sampler_name
         ORDER BY fileCount DESC, sampler_name
        """)
    @RegisterConstructorMapper(FacetCount.class)
    List<FacetCount> samplerCounts();

    @SqlQuery("""
        SELECT scheduler AS value, COUNT(DISTINCT file_id) AS fileCount
          FROM workflow_metadata
         WHERE scheduler IS NOT NULL AND scheduler != ''
         GROUP BY scheduler
         ORDER BY fileCount DESC, scheduler
        """)
    @RegisterConstructorMapper(FacetCount.class)
    List<FacetCount> schedulerCounts();

    @SqlQuery("""
        SELECT MIN(cfg) AS cfgMin, MAX(cfg) AS cfgMax,
               MIN(steps) AS stepsMin, MAX(steps) AS stepsMax,
               MIN(width) AS widthMin, MAX(width) AS widthMax,
               MIN(height) AS heightMin, MAX(height) AS heightMax
          FROM workflow_metadata
        """)
    @RegisterRowMapper(RangesMapper.class)
    FilterOptions.Ranges ranges();

    // --- Composite writes ----------------------------------------------------

    /**
     * One commit batch: upsert the files, then replace their sampler rows wholesale so no row from a
     * previous run with more samplers survives.
     */
    @Transaction
    default void commitBatch(List<FileRecord> files, Map<String, List<SamplerRecord>> samplersByFileId) {
        if (files.isEmpty()) return;
        upsertFiles(files);

        List<String> ids = new ArrayList<>(files.size());
        for (FileRecord f : files) ids.add(f.id());
        deleteSamplers(ids);

        List<String> owner = new ArrayList<>();
        List<SamplerRecord> rows = new ArrayList<>();
        for (FileRecord f : files) {
            for (SamplerRecord s : samplersByFileId.getOrDefault(f.id(), List.of())) {
                owner.add(f.id());
                rows.add(s);
            }
        }
        if (!rows.isEmpty()) {
            insertSamplers(owner, rows);
        }
    }

    @Transaction
    default void replaceSamplers(String fileId, List<SamplerRecord> samplers) {
        deleteSamplers(List.of(fileId));
        if (samplers.isEmpty()) return;
        List<String> owner = new ArrayList<>(samplers.size());
        for (int i = 0; i < samplers.size(); i++) owner.add(fileId);
        insertSamplers(owner, samplers);
    }

    /**
     * Points a row at its new location. A stale row already holding the target id or path is removed
     * first, in the same transaction, so the update cannot hit the unique constraints.
     */
    @Transaction
    default int relocate(String oldId, String newId, String newPath, String newName) {
        if (!oldId.equals(newId)) {
            deleteStaleTarget(oldId, newId, newPath);
        }
        return updateLocation(oldId, newId, newPath, newName);
    }

    @Transaction
    default int deletePaths(List<String> paths) {
        if (paths.isEmpty()) return 0;
        int total = 0;
        for (int n : deleteByPaths(paths)) total += n;
        return total;
    }

    // --- Mappers -------------------------------------------------------------

    final class FileRecordMapper implements RowMapper<FileRecord> {
        @Override
        public FileRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new FileRecord(
                    rs.getString("id"),
                    rs.getString("path"),
                    rs.getDouble("mtime"),
                    rs.getString("name"),
                    rs.getString("type"),
                    rs.getString("duration"),
                    rs.getString("dimensions"),
                    rs.getInt("has_workflow") != 0,
                    rs.getInt("is_favorite") != 0,
                    rs.getString("prompt_preview"),
                    rs.getString("sampler_names")
            );
        }
    }

    final class SamplerRecordMapper implements RowMapper<SamplerRecord> {
        @Override
        public SamplerRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new SamplerRecord(
                    rs.getInt("sampler_index"),
                    rs.getString("model_name"),
                    rs.getString("sampler_name"),
                    rs.getString("scheduler"),
                    rs.getString("positive_prompt"),
                    rs.getString("negative_prompt"),
                    nullableInt(rs, "width"),
                    nullableInt(rs, "height"),
                    nullableDouble(rs, "cfg"),
                    nullableInt(rs, "steps")
            );
        }
    }

    final class RangesMapper implements RowMapper<FilterOptions.Ranges> {
        @Override
        public FilterOptions.Ranges map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new FilterOptions.Ranges(
                    new FilterOptions.Range(nullableDouble(rs, "cfgMin"), nullableDouble(rs, "cfgMax")),
                    new FilterOptions.Range(nullableDouble(rs, "stepsMin"), nullableDouble(rs, "stepsMax")),
                    new FilterOptions.Range(nullableDouble(rs, "widthMin"), nullableDouble(rs, "widthMax")),
                    new FilterOptions.Range(nullableDouble(rs, "heightMin"), nullableDouble(rs, "heightMax"))
            );
        }
    }

    private static Integer nullableInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    private static Double nullableDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }
}
