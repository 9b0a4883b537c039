package de.bsommerfeld.homedash.db.migration;

import java.sql.SQLException;

/**
 * A single versioned schema or data change.
 *
 * <p>
 * {@link #up} must re-verify its own preconditions (column present, index
 * present, destination rows present) before acting. The runner writes the
 * Ledger row only after {@code up} returns, so after a crash the same
 * {@code up} may run against a partially migrated database.
 *
 * <p>
 * Migrations are forward-only. Units that can be reverted implement
 * {@link ReversibleMigration} in addition.
 */
public interface Migration {

    /** Positive, unique across the registry; defines application order. */
    int version();

    /** Short slug for logs and the Ledger. Not used for ordering. */
    String name();

    void up(MigrationContext context) throws SQLException;
}
