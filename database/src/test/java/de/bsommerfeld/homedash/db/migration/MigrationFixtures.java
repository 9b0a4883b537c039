package de.bsommerfeld.homedash.db.migration;

import de.bsommerfeld.homedash.core.crypto.ConfigEncryption;
import de.bsommerfeld.homedash.db.migration.units.HomedashMigrations;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared helpers for migration tests: temp databases, contexts with a fixed
 * clock, partial lineage runs and logical dumps.
 */
public final class MigrationFixtures {

    public static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private MigrationFixtures() {
    }

    public static Connection open(Path dir, String name) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dir.resolve(name).toAbsolutePath());
    }

    public static MigrationRunner runner() {
        return runner(EncryptionSettings.plaintext());
    }

    public static MigrationRunner runner(EncryptionSettings settings) {
        return new MigrationRunner(settings, new ConfigEncryption(), CLOCK);
    }

    public static MigrationContext context(Connection conn) {
        return context(conn, EncryptionSettings.plaintext(), new UnitReport(0, "test"));
    }

    public static MigrationContext context(Connection conn, EncryptionSettings settings, UnitReport report) {
        return new MigrationContext(conn, new VersionLedger(conn), new ConfigEncryption(), settings, CLOCK, report);
    }

    /** Runs the shipped lineage up to and including {@code version}. */
    public static MigrationResult migrateThrough(Connection conn, int version) throws MigrationException {
        return runner().run(lineageThrough(version), conn);
    }

    public static MigrationRegistry lineageThrough(int version) {
        List<Migration> migrations = new ArrayList<>();
        for (Migration migration : HomedashMigrations.registry().migrations()) {
            if (migration.version() <= version) {
                migrations.add(migration);
            }
        }
        return MigrationRegistry.of(migrations);
    }

    public static Migration unit(int version) {
        return HomedashMigrations.registry().find(version)
                .orElseThrow(() -> new IllegalArgumentException("no migration " + version));
    }

    /**
     * Schema plus every row of every table, in a stable order. Two databases
     * with equal dumps hold the same logical content.
     */
    public static String dump(Connection conn) throws SQLException {
        StringBuilder out = new StringBuilder();
        List<String> tables = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT type, name, tbl_name, sql FROM sqlite_master ORDER BY type, name")) {
            while (rs.next()) {
                out.append(rs.getString("type")).append(' ').append(rs.getString("name")).append(": ")
                        .append(rs.getString("sql")).append('\n');
                if ("table".equals(rs.getString("type"))) {
                    tables.add(rs.getString("name"));
                }
            }
        }
        for (String table : tables) {
            out.append("-- ").append(table).append('\n');
            for (String row : rows(conn, "SELECT * FROM \"" + table + "\"")) {
                out.append(row).append('\n');
            }
        }
        return out.toString();
    }

    /** Every row of {@code sql} as {@code col=value|...}, sorted. */
    public static List<String> rows(Connection conn, String sql, Object... params) throws SQLException {
        List<String> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                while (rs.next()) {
                    StringBuilder row = new StringBuilder();
                    for (int c = 1; c <= meta.getColumnCount(); c++) {
                        if (c > 1) {
                            row.append('|');
                        }
                        row.append(meta.getColumnName(c)).append('=').append(rs.getString(c));
                    }
                    rows.add(row.toString());
                }
            }
        }
        Collections.sort(rows);
        return rows;
    }

    public static String queryString(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public static int queryInt(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    public static int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            return ps.executeUpdate();
        }
    }
}
