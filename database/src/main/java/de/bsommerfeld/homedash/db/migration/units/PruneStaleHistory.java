package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Deletes history rows that the retention jobs would no longer keep. The
 * cutoffs are relative to the time this unit runs.
 */
final class PruneStaleHistory extends AbstractMigration {

    static final Duration METRIC_RETENTION = Duration.ofDays(30);
    static final Duration CHECK_RETENTION = Duration.ofDays(7);

    PruneStaleHistory() {
        super(14, "prune_stale_history");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();
        long now = context.nowEpochSeconds();

        int metrics = deleteOlderThan(conn, "metric_history", "timestamp", now - METRIC_RETENTION.toSeconds());
        int checks = 0;
        if (Schema.hasTable(conn, "service_monitor_history")) {
            checks = deleteOlderThan(conn, "service_monitor_history", "checked_at",
                    now - CHECK_RETENTION.toSeconds());
        }
        context.report().migrated(metrics + checks);
        log.debug("{} Pruned {} metric samples and {} monitor checks", prefix(), metrics, checks);
    }

    private static int deleteOlderThan(Connection conn, String table, String column, long cutoff)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM " + table + " WHERE " + column + " < ?")) {
            ps.setLong(1, cutoff);
            return ps.executeUpdate();
        }
    }
}
