package de.bsommerfeld.homedash.db.migration;

import java.sql.SQLException;

/**
 * Optional capability: a migration with a tested inverse. {@code down} after
 * {@code up} must restore the schema and every row it touched.
 *
 * <p>
 * The runner never calls {@code down}. It exists for operators and for the
 * round-trip tests that prove it.
 */
public interface ReversibleMigration extends Migration {

    void down(MigrationContext context) throws SQLException;
}
