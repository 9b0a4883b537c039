package de.bsommerfeld.homedash.db.migration;

import java.util.List;

/**
 * Snapshot of a database against a registry, taken without changing
 * anything.
 *
 * @param currentVersion  highest version in the Ledger, 0 if none
 * @param expectedVersion latest version in the registry
 * @param pending         registered migrations not yet in the Ledger
 */
public record MigrationStatus(int currentVersion, int expectedVersion, List<Migration> pending) {

    public MigrationStatus {
        pending = List.copyOf(pending);
    }

    public boolean needsMigration() {
        return !isDowngrade() && !pending.isEmpty();
    }

    public boolean isDowngrade() {
        return currentVersion > expectedVersion;
    }
}
