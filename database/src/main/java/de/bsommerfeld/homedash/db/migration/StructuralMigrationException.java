package de.bsommerfeld.homedash.db.migration;

/**
 * A migration unit's {@code up} failed, typically a DDL statement such as a
 * duplicate {@code ADD COLUMN} or a constraint violation. The unit's Ledger
 * row has not been written, so the unit runs again on the next startup.
 */
public class StructuralMigrationException extends MigrationException {

    private final int version;
    private final String migrationName;

    public StructuralMigrationException(Migration migration, Throwable cause) {
        super("Migration " + migration.version() + " (" + migration.name() + ") failed: "
                + cause.getMessage(), cause);
        this.version = migration.version();
        this.migrationName = migration.name();
    }

    public int version() {
        return version;
    }

    public String migrationName() {
        return migrationName;
    }
}
