package de.bsommerfeld.homedash.db.migration;

import de.bsommerfeld.homedash.db.migration.payload.TransformOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-unit counters collected while {@code up} runs. A skipped row is a
 * recovered data-transform warning: the row was left in its previous shape
 * and the unit still succeeded.
 */
public final class UnitReport {

    private final int version;
    private final String name;
    private int migrated;
    private int skipped;
    private final List<String> warnings = new ArrayList<>();
    private long durationMillis;

    public UnitReport(int version, String name) {
        this.version = version;
        this.name = name;
    }

    public void migrated() {
        migrated(1);
    }

    public void migrated(int count) {
        migrated += count;
    }

    public void skipped(String reason) {
        skipped++;
        warnings.add(reason);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    /**
     * Folds a per-row outcome into the counters.
     *
     * @param rowKey identifies the row in the warning text
     */
    public void record(String rowKey, TransformOutcome outcome) {
        switch (outcome.status()) {
            case TRANSFORMED:
                migrated();
                break;
            case SKIPPED:
                skipped(rowKey + ": " + outcome.reason());
                break;
            default:
                break;
        }
    }

    void durationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    public int version() {
        return version;
    }

    public String name() {
        return name;
    }

    public int migratedCount() {
        return migrated;
    }

    public int skippedCount() {
        return skipped;
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public long durationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return "UnitReport[" + version + ":" + name + ", migrated=" + migrated + ", skipped=" + skipped
                + ", warnings=" + warnings.size() + "]";
    }
}
