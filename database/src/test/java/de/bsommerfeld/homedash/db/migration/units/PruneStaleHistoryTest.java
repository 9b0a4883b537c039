package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.migration.EncryptionSettings;
import de.bsommerfeld.homedash.db.migration.UnitReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static de.bsommerfeld.homedash.db.migration.MigrationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PruneStaleHistoryTest {

    private static final long NOW_SECONDS = NOW.getEpochSecond();
    private static final long DAY = Duration.ofDays(1).toSeconds();

    @TempDir
    Path tempDir;

    private Connection conn;

    @BeforeEach
    void setUp() throws Exception {
        conn = open(tempDir, "history.db");
        migrateThrough(conn, 13);
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void up_shouldDeleteMetricSamplesOlderThanThirtyDays() throws Exception {
        sample("old", NOW_SECONDS - 31 * DAY);
        sample("edge", NOW_SECONDS - 30 * DAY);
        sample("recent", NOW_SECONDS - DAY);

        UnitReport report = run();

        assertEquals(List.of("metric_key=edge", "metric_key=recent"),
                rows(conn, "SELECT metric_key FROM metric_history"));
        assertEquals(1, report.migratedCount());
    }

    @Test
    void up_shouldDeleteMonitorChecksOlderThanSevenDays() throws Exception {
        check("c1", NOW_SECONDS - 8 * DAY);
        check("c2", NOW_SECONDS - 6 * DAY);

        UnitReport report = run();

        assertEquals(List.of("id=c2"), rows(conn, "SELECT id FROM service_monitor_history"));
        assertEquals(1, report.migratedCount());
    }

    @Test
    void up_onEmptyTables_shouldReportNothing() throws Exception {
        assertEquals(0, run().migratedCount());
    }

    private UnitReport run() throws SQLException {
        PruneStaleHistory unit = new PruneStaleHistory();
        UnitReport report = new UnitReport(unit.version(), unit.name());
        unit.up(context(conn, EncryptionSettings.plaintext(), report));
        return report;
    }

    private void sample(String key, long timestamp) throws SQLException {
        update(conn, "INSERT INTO metric_history (integration_id, metric_key, timestamp, value) "
                + "VALUES ('glances-primary', ?, ?, 1.0)", key, timestamp);
    }

    private void check(String id, long checkedAt) throws SQLException {
        update(conn, "INSERT INTO service_monitor_history (id, monitor_id, status, checked_at) VALUES (?, 'm1', 'up', ?)",
                id, checkedAt);
    }
}
