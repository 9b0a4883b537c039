package de.bsommerfeld.homedash.db.migration;

/**
 * The database was migrated by a newer release than the one starting now.
 * Running older code against it is refused.
 */
public class SchemaDowngradeException extends MigrationException {

    private final int databaseVersion;
    private final int expectedVersion;

    public SchemaDowngradeException(int databaseVersion, int expectedVersion) {
        super("Database schema (v" + databaseVersion + ") is newer than this release expects (v"
                + expectedVersion + "). Upgrade the application or restore from a backup.");
        this.databaseVersion = databaseVersion;
        this.expectedVersion = expectedVersion;
    }

    public int databaseVersion() {
        return databaseVersion;
    }

    public int expectedVersion() {
        return expectedVersion;
    }
}
