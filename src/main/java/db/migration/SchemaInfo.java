package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Snapshot of tables and columns, read once per migration. */
final class SchemaInfo {

    // column types accepted by addColumnIfMissing
    private static final Set<String> ALLOWED_TYPES = Set.of("INTEGER", "TEXT", "BLOB", "REAL", "NUMERIC");

    private final Map<String, Set<String>> columnsByTable = new HashMap<>();
    private final Map<String, String> tableSql = new HashMap<>();

    private SchemaInfo() {}

    static SchemaInfo load(Connection conn) throws SQLException {
        SchemaInfo s = new SchemaInfo();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT name, sql FROM sqlite_master WHERE type='table'");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                s.tableSql.put(rs.getString(1), rs.getString(2));
            }
        }
        for (String t : s.tableSql.keySet()) {
            s.columnsByTable.put(t, readColumns(conn, t));
        }
        return s;
    }

    boolean tableExists(String table) {
        return tableSql.containsKey(table);
    }

    boolean columnExists(String table, String column) {
        return columnsByTable.getOrDefault(table, Set.of()).contains(column.toLowerCase(Locale.ROOT));
    }

    /** The CREATE statement SQLite stored for the table, or an empty string. */
    String createSql(String table) {
        String sql = tableSql.get(table);
        return sql == null ? "" : sql;
    }

    void addColumnIfMissing(Connection conn, String table, String column, String type) throws SQLException {
        if (!tableExists(table) || columnExists(table, column)) return;
        String t = type.trim().toUpperCase(Locale.ROOT);
        String base = t.split("\\s+")[0];
        if (!ALLOWED_TYPES.contains(base)) throw new IllegalArgumentException("Column type not allowed: " + type);
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE " + q(table) + " ADD COLUMN " + q(column) + " " + t);
        }
        columnsByTable.computeIfAbsent(table, k -> new HashSet<>()).add(column.toLowerCase(Locale.ROOT));
    }

    static String q(String ident) {
        if (ident == null || ident.isBlank()) throw new IllegalArgumentException("Empty identifier");
        if (ident.contains("\"")) throw new IllegalArgumentException("Invalid identifier: " + ident);
        return "\"" + ident + "\"";
    }

    private static Set<String> readColumns(Connection conn, String table) throws SQLException {
        Set<String> cols = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + q(table) + ")")) {
            while (rs.next()) {
                cols.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return cols;
    }
}
