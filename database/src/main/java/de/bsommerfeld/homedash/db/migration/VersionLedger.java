package de.bsommerfeld.homedash.db.migration;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.SqlLoader;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The {@code schema_migrations} table: one row per fully applied version.
 * Append-only; the only writer is {@link MigrationRunner}.
 */
public final class VersionLedger {

    static final String TABLE = "schema_migrations";

    private final Connection connection;

    public VersionLedger(Connection connection) {
        this.connection = connection;
    }

    /** Creates the table if absent. Safe on an empty database. */
    public void ensureTable() throws LedgerException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(SqlLoader.load("ledger-create"));
        } catch (SQLException e) {
            throw new LedgerException("Failed to create " + TABLE, e);
        }
    }

    /** All rows in ascending version order, or an empty list before bootstrap. */
    public List<LedgerEntry> appliedEntries() throws LedgerException {
        try {
            if (!Schema.hasTable(connection, TABLE)) {
                return List.of();
            }
            List<LedgerEntry> entries = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("ledger-select-all"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new LedgerEntry(
                            rs.getInt("version"),
                            rs.getString("name"),
                            Instant.ofEpochSecond(rs.getLong("applied_at"))));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new LedgerException("Failed to read " + TABLE, e);
        }
    }

    /** Applied versions in ascending order. */
    public SortedSet<Integer> appliedVersions() throws LedgerException {
        return versionsOf(appliedEntries());
    }

    static SortedSet<Integer> versionsOf(List<LedgerEntry> entries) {
        SortedSet<Integer> versions = new TreeSet<>();
        for (LedgerEntry entry : entries) {
            versions.add(entry.version());
        }
        return versions;
    }

    /** Highest of {@code versions}, 0 for a fresh database. */
    static int highest(SortedSet<Integer> versions) {
        return versions.isEmpty() ? 0 : versions.last();
    }

    void record(Migration migration, Instant appliedAt) throws LedgerException {
        try (PreparedStatement ps = connection.prepareStatement(SqlLoader.load("ledger-insert"))) {
            ps.setInt(1, migration.version());
            ps.setString(2, migration.name());
            ps.setLong(3, appliedAt.getEpochSecond());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException("Failed to record migration " + migration.version() + " in " + TABLE, e);
        }
    }
}
