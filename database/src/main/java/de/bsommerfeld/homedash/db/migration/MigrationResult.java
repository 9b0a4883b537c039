package de.bsommerfeld.homedash.db.migration;

import java.util.List;

/**
 * Outcome of a successful {@link MigrationRunner#run} call.
 *
 * @param reports one per applied migration, in application order
 */
public record MigrationResult(int fromVersion, int toVersion, int appliedCount, List<UnitReport> reports) {

    public MigrationResult {
        reports = List.copyOf(reports);
    }

    public int skippedRows() {
        int total = 0;
        for (UnitReport report : reports) {
            total += report.skippedCount();
        }
        return total;
    }
}
