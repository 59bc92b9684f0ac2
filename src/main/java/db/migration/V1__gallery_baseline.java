package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Files table plus the single-row-per-file metadata table of older indexes. Idempotent, so an
 * index created before versioned migrations is brought to the same shape.
 */
public final class V1__gallery_baseline extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS files (
                    id TEXT PRIMARY KEY,
                    path TEXT NOT NULL UNIQUE,
                    mtime REAL NOT NULL,
                    name TEXT NOT NULL,
                    type TEXT,
                    duration TEXT,
                    dimensions TEXT,
                    has_workflow INTEGER,
                    is_favorite INTEGER DEFAULT 0,
                    prompt_preview TEXT,
                    sampler_names TEXT
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS workflow_metadata (
                    file_id TEXT PRIMARY KEY,
                    model_name TEXT,
                    sampler_name TEXT,
                    scheduler TEXT,
                    cfg REAL,
                    steps INTEGER,
                    positive_prompt TEXT,
                    negative_prompt TEXT,
                    width INTEGER,
                    height INTEGER,
                    FOREIGN KEY (file_id) REFERENCES files(id) ON DELETE CASCADE
                )
                """);
        }

        // columns that older indexes lack
        SchemaInfo schema = SchemaInfo.load(conn);
        schema.addColumnIfMissing(conn, "files", "has_workflow", "INTEGER");
        schema.addColumnIfMissing(conn, "files", "is_favorite", "INTEGER DEFAULT 0");
        schema.addColumnIfMissing(conn, "files", "prompt_preview", "TEXT");
        schema.addColumnIfMissing(conn, "files", "sampler_names", "TEXT");

        ensureFileIndexes(conn);
    }

    private void ensureFileIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_name ON files(name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_mtime ON files(mtime DESC)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_type ON files(type)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_favorite ON files(is_favorite)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_path ON files(path)");
        }
    }
}
