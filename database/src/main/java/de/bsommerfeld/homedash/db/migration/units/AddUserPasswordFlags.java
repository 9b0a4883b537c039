package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Adds {@code require_password_reset} (forced change on next login) and
 * {@code has_local_password} (0 for proxy-only accounts). Each column is
 * checked on its own, so a half-applied earlier run is completed.
 */
final class AddUserPasswordFlags extends AbstractMigration {

    AddUserPasswordFlags() {
        super(5, "add_user_password_flags");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();
        boolean addedReset = Schema.addColumnIfMissing(conn, "users", "require_password_reset", "INTEGER DEFAULT 0");
        boolean addedLocal = Schema.addColumnIfMissing(conn, "users", "has_local_password", "INTEGER DEFAULT 1");

        if (addedReset && addedLocal) {
            log.debug("{} Added users.require_password_reset and users.has_local_password", prefix());
        } else if (addedReset || addedLocal) {
            log.debug("{} Added users.{} (the other column already existed)", prefix(),
                    addedReset ? "require_password_reset" : "has_local_password");
        } else {
            log.debug("{} Both password columns already present", prefix());
        }
    }
}
