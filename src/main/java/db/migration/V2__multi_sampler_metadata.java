package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds {@code workflow_metadata} with a surrogate key so a file can own several sampler rows,
 * unique per {@code (file_id, sampler_index)}. Existing rows become sampler 0.
 * <p>
 * The old table is copied to {@code workflow_metadata_backup} first; if any later step fails the
 * backup is renamed back into place before the error propagates.
 */
public final class V2__multi_sampler_metadata extends BaseJavaMigration {

    private static final Logger logger = LoggerFactory.getLogger(V2__multi_sampler_metadata.class);

    static final String BACKUP_TABLE = "workflow_metadata_backup";

    @Override
    public void migrate(Context context) throws Exception {
        restructure(context.getConnection());
    }

    static void restructure(Connection conn) throws SQLException {
        SchemaInfo schema = SchemaInfo.load(conn);
        if (isCurrentShape(schema)) {
            logger.debug("workflow_metadata already supports multiple samplers");
            return;
        }

        boolean hadSamplerIndex = schema.columnExists("workflow_metadata", "sampler_index");

        try (Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + BACKUP_TABLE);
            st.execute("CREATE TABLE " + BACKUP_TABLE + " AS SELECT * FROM workflow_metadata");
        }

        try (Statement st = conn.createStatement()) {
            st.execute("DROP TABLE workflow_metadata");
            st.execute("""
                CREATE TABLE workflow_metadata (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    file_id TEXT NOT NULL,
                    sampler_index INTEGER NOT NULL DEFAULT 0,
                    model_name TEXT,
                    sampler_name TEXT,
                    scheduler TEXT,
                    cfg REAL,
                    steps INTEGER,
                    positive_prompt TEXT,
                    negative_prompt TEXT,
                    width INTEGER,
                    height INTEGER,
                    FOREIGN KEY (file_id) REFERENCES files(id) ON UPDATE CASCADE ON DELETE CASCADE
                )
                """);

            // rows whose file is gone would violate the foreign key
            int copied = st.executeUpdate("""
                INSERT INTO workflow_metadata(file_id, sampler_index, model_name, sampler_name, scheduler,
                                              cfg, steps, positive_prompt, negative_prompt, width, height)
                SELECT b.file_id, %s, b.model_name, b.sampler_name, b.scheduler,
                       b.cfg, b.steps, b.positive_prompt, b.negative_prompt, b.width, b.height
                  FROM %s b
                 WHERE b.file_id IN (SELECT id FROM files)
                """.formatted(hadSamplerIndex ? "COALESCE(b.sampler_index, 0)" : "0", BACKUP_TABLE));
            logger.info("Migrated {} sampler rows to the multi-sampler layout", copied);

            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_wm_file_sampler ON workflow_metadata(file_id, sampler_index)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_file_id ON workflow_metadata(file_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_model_name ON workflow_metadata(model_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_sampler_name ON workflow_metadata(sampler_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_scheduler ON workflow_metadata(scheduler)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_cfg ON workflow_metadata(cfg)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_steps ON workflow_metadata(steps)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_width ON workflow_metadata(width)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_wm_height ON workflow_metadata(height)");

            st.execute("DROP TABLE " + BACKUP_TABLE);
        } catch (SQLException e) {
            logger.error("workflow_metadata restructuring failed, restoring backup", e);
            restoreBackup(conn, e);
            throw e;
        }
    }

    static boolean isCurrentShape(SchemaInfo schema) {
        return schema.columnExists("workflow_metadata", "sampler_index")
                && schema.columnExists("workflow_metadata", "id")
                && schema.createSql("workflow_metadata").toUpperCase(Locale.ROOT).contains("ON UPDATE CASCADE");
    }

    private static void restoreBackup(Connection conn, SQLException cause) {
        try (Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS workflow_metadata");
            st.execute("ALTER TABLE " + BACKUP_TABLE + " RENAME TO workflow_metadata");
        } catch (SQLException restoreError) {
            cause.addSuppressed(restoreError);
        }
    }

    /** Number of rows in the backup table, or -1 when it does not exist. */
    static long backupRowCount(Connection conn) throws SQLException {
        if (!SchemaInfo.load(conn).tableExists(BACKUP_TABLE)) return -1;
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + BACKUP_TABLE)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
