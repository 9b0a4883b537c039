package de.bsommerfeld.homedash.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Metadata checks and guarded DDL for SQLite. Every migration that changes
 * the schema re-verifies its preconditions through these helpers, because a
 * unit may run again after a crash that happened between its work and its
 * Ledger entry.
 *
 * <p>
 * Table, column and index names are passed in from code, never from user
 * input; they are quoted but not otherwise validated.
 */
public final class Schema {

    private Schema() {
    }

    public static boolean hasTable(Connection conn, String table) throws SQLException {
        return hasObject(conn, "table", table);
    }

    public static boolean hasIndex(Connection conn, String index) throws SQLException {
        return hasObject(conn, "index", index);
    }

    /** {@code PRAGMA table_info} lookup, case-insensitive like SQLite itself. */
    public static boolean hasColumn(Connection conn, String table, String column) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Adds {@code column} unless it already exists.
     *
     * @param definition type and modifiers as written after the column name,
     *                   e.g. {@code INTEGER DEFAULT 0}
     * @return {@code true} if the column was added by this call
     */
    public static boolean addColumnIfMissing(Connection conn, String table, String column, String definition)
            throws SQLException {
        if (hasColumn(conn, table, column)) {
            return false;
        }
        execute(conn, "ALTER TABLE " + quote(table) + " ADD COLUMN " + quote(column) + " " + definition);
        return true;
    }

    /** @return {@code true} if the column existed and was dropped */
    public static boolean dropColumnIfExists(Connection conn, String table, String column) throws SQLException {
        if (!hasColumn(conn, table, column)) {
            return false;
        }
        execute(conn, "ALTER TABLE " + quote(table) + " DROP COLUMN " + quote(column));
        return true;
    }

    /** @return {@code true} if the index existed before this call */
    public static boolean dropIndexIfExists(Connection conn, String index) throws SQLException {
        boolean existed = hasIndex(conn, index);
        execute(conn, "DROP INDEX IF EXISTS " + quote(index));
        return existed;
    }

    public static int countRows(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + quote(table))) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    /** Executes statements one by one, in order. */
    public static void executeAll(Connection conn, List<String> statements) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    private static boolean hasObject(Connection conn, String type, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = ? AND name = ? LIMIT 1")) {
            ps.setString(1, type);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
