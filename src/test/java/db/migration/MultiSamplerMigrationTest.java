package db.migration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MultiSamplerMigrationTest {

    private static Connection open() throws Exception {
        Path db = Files.createTempDirectory("gallery-migration-").resolve("index.sqlite");
        return DriverManager.getConnection("jdbc:sqlite:" + db);
    }

    private static void createLegacyMetadata(Statement st) throws SQLException {
        st.execute("CREATE TABLE workflow_metadata (file_id TEXT PRIMARY KEY, model_name TEXT, sampler_name TEXT,"
                + " scheduler TEXT, cfg REAL, steps INTEGER, positive_prompt TEXT, negative_prompt TEXT,"
                + " width INTEGER, height INTEGER)");
        st.execute("INSERT INTO workflow_metadata(file_id, model_name) VALUES ('f1', 'base'), ('f2', 'refiner')");
    }

    private static long count(Statement st, String sql) throws SQLException {
        try (ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : -1;
        }
    }

    @Test
    void failedCopyRestoresTheOriginalTable() throws Exception {
        try (Connection conn = open(); Statement st = conn.createStatement()) {
            // no files table: the copy step fails after the old table was dropped
            createLegacyMetadata(st);

            assertThrows(SQLException.class, () -> V2__multi_sampler_metadata.restructure(conn));

            SchemaInfo schema = SchemaInfo.load(conn);
            assertTrue(schema.tableExists("workflow_metadata"));
            assertFalse(schema.columnExists("workflow_metadata", "sampler_index"));
            assertEquals(2, count(st, "SELECT COUNT(*) FROM workflow_metadata"));
            assertEquals(-1, V2__multi_sampler_metadata.backupRowCount(conn));
        }
    }

    @Test
    void restructuresAndIsIdempotent() throws Exception {
        try (Connection conn = open(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE files (id TEXT PRIMARY KEY, path TEXT, mtime REAL, name TEXT)");
            st.execute("INSERT INTO files(id, path, mtime, name) VALUES ('f1', '/a.png', 1, 'a.png')");
            createLegacyMetadata(st);

            V2__multi_sampler_metadata.restructure(conn);

            SchemaInfo schema = SchemaInfo.load(conn);
            assertTrue(V2__multi_sampler_metadata.isCurrentShape(schema));
            assertFalse(schema.tableExists(V2__multi_sampler_metadata.BACKUP_TABLE));
            assertEquals(1, count(st, "SELECT COUNT(*) FROM workflow_metadata WHERE sampler_index = 0"));

            st.execute("INSERT INTO workflow_metadata(file_id, sampler_index, model_name) VALUES ('f1', 1, 'refiner')");
            assertThrows(SQLException.class,
                    () -> st.execute("INSERT INTO workflow_metadata(file_id, sampler_index) VALUES ('f1', 1)"));

            V2__multi_sampler_metadata.restructure(conn);
            assertEquals(2, count(st, "SELECT COUNT(*) FROM workflow_metadata"));
        }
    }

    @Test
    void quotesIdentifiers() {
        assertEquals("\"files\"", SchemaInfo.q("files"));
        assertThrows(IllegalArgumentException.class, () -> SchemaInfo.q("bad\"name"));
        assertThrows(IllegalArgumentException.class, () -> SchemaInfo.q(" "));
    }
}
