package de.bsommerfeld.homedash.db.migration;

import com.google.common.base.Stopwatch;
import com.google.inject.Inject;
import de.bsommerfeld.homedash.core.crypto.ConfigEncryption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.TimeUnit;

/**
 * Applies every registered migration that the Ledger does not list yet.
 *
 * <h3>Ordering</h3>
 * Pending migrations run strictly in ascending version order, one at a time,
 * on the calling thread. A migration's Ledger row is written only after its
 * {@code up} returned, and the next migration starts only after that row is
 * written.
 *
 * <h3>Transactions</h3>
 * The runner does not wrap migrations in a transaction. The connection is
 * put into auto-commit mode before the first unit runs, so each statement is
 * durable on its own; units that rewrite a batch of rows open their own
 * transaction around that batch.
 *
 * <h3>Failure</h3>
 * The first exception from {@code up} stops the run. No Ledger row is written
 * for the failing version and no later version is attempted.
 */
public class MigrationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationRunner.class);

    private final EncryptionSettings encryptionSettings;
    private final ConfigEncryption encryption;
    private final Clock clock;

    @Inject
    public MigrationRunner(EncryptionSettings encryptionSettings, Clock clock) {
        this(encryptionSettings, new ConfigEncryption(), clock);
    }

    public MigrationRunner(EncryptionSettings encryptionSettings, ConfigEncryption encryption, Clock clock) {
        this.encryptionSettings = encryptionSettings;
        this.encryption = encryption;
        this.clock = clock;
    }

    /**
     * Reads the Ledger and compares it to {@code registry} without changing
     * anything. A database without a Ledger table reports version 0.
     */
    public MigrationStatus status(MigrationRegistry registry, Connection connection) throws MigrationException {
        SortedSet<Integer> applied = new VersionLedger(connection).appliedVersions();
        return new MigrationStatus(VersionLedger.highest(applied), registry.latestVersion(),
                registry.pending(applied));
    }

    /**
     * Brings the database up to {@code registry.latestVersion()}.
     *
     * @throws SchemaDowngradeException      if the Ledger is ahead of the registry
     * @throws StructuralMigrationException  if a migration's {@code up} failed
     * @throws LedgerException               if the Ledger cannot be read or written
     */
    public MigrationResult run(MigrationRegistry registry, Connection connection) throws MigrationException {
        ensureAutoCommit(connection);

        VersionLedger ledger = new VersionLedger(connection);
        ledger.ensureTable();

        List<LedgerEntry> entries = ledger.appliedEntries();
        for (LedgerEntry entry : entries) {
            warnOnNameDrift(registry, entry);
        }
        SortedSet<Integer> applied = VersionLedger.versionsOf(entries);
        int fromVersion = VersionLedger.highest(applied);

        if (fromVersion > registry.latestVersion()) {
            LOG.error("[Migrator] Database is at v{} but this release only knows v{}",
                    fromVersion, registry.latestVersion());
            throw new SchemaDowngradeException(fromVersion, registry.latestVersion());
        }

        List<Migration> pending = registry.pending(applied);
        if (pending.isEmpty()) {
            LOG.debug("[Migrator] Database is up to date (v{})", fromVersion);
            return new MigrationResult(fromVersion, fromVersion, 0, List.of());
        }

        LOG.info("[Migrator] Applying {} migration(s), v{} -> v{}", pending.size(), fromVersion,
                registry.latestVersion());

        List<UnitReport> reports = new ArrayList<>();
        int toVersion = fromVersion;
        for (Migration migration : pending) {
            reports.add(apply(migration, connection, ledger));
            toVersion = Math.max(toVersion, migration.version());
        }

        MigrationResult result = new MigrationResult(fromVersion, toVersion, reports.size(), reports);
        if (result.skippedRows() > 0) {
            LOG.warn("[Migrator] Completed with {} row(s) left in their previous shape", result.skippedRows());
        }
        LOG.info("[Migrator] Database migrated to v{}", toVersion);
        return result;
    }

    private UnitReport apply(Migration migration, Connection connection, VersionLedger ledger)
            throws MigrationException {
        UnitReport report = new UnitReport(migration.version(), migration.name());
        MigrationContext context = new MigrationContext(connection, ledger, encryption, encryptionSettings, clock,
                report);

        LOG.debug("[Migrator] Running {}:{}", migration.version(), migration.name());
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            migration.up(context);
        } catch (SQLException | RuntimeException e) {
            LOG.error("[Migrator] Migration {}:{} failed", migration.version(), migration.name(), e);
            throw new StructuralMigrationException(migration, e);
        }
        report.durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS));

        ledger.record(migration, clock.instant());

        for (String warning : report.warnings()) {
            LOG.warn("[Migrator] {}:{} {}", migration.version(), migration.name(), warning);
        }
        LOG.debug("[Migrator] Applied {}:{} in {} ms (migrated={}, skipped={})", migration.version(),
                migration.name(), report.durationMillis(), report.migratedCount(), report.skippedCount());
        return report;
    }

    private static void warnOnNameDrift(MigrationRegistry registry, LedgerEntry entry) {
        registry.find(entry.version())
                .filter(migration -> !migration.name().equals(entry.name()))
                .ifPresent(migration -> LOG.warn(
                        "[Migrator] Ledger records v{} as '{}' but the registry names it '{}'",
                        entry.version(), entry.name(), migration.name()));
    }

    private static void ensureAutoCommit(Connection connection) throws LedgerException {
        try {
            if (!connection.getAutoCommit()) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to switch connection to auto-commit", e);
        }
    }
}
