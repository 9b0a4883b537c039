package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;
import de.bsommerfeld.homedash.db.migration.ReversibleMigration;

import java.sql.SQLException;

/**
 * Marks icons shipped with the application so they can't be deleted from
 * the icon picker.
 */
final class AddCustomIconSystemFlag extends AbstractMigration implements ReversibleMigration {

    static final int VERSION = 4;

    AddCustomIconSystemFlag() {
        super(VERSION, "add_custom_icon_system_flag");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        if (Schema.addColumnIfMissing(context.connection(), "custom_icons", "is_system", "INTEGER DEFAULT 0")) {
            log.debug("{} Added custom_icons.is_system", prefix());
        } else {
            log.debug("{} custom_icons.is_system already present", prefix());
        }
    }

    @Override
    public void down(MigrationContext context) throws SQLException {
        if (Schema.dropColumnIfExists(context.connection(), "custom_icons", "is_system")) {
            log.debug("{} Dropped custom_icons.is_system", prefix());
        }
    }
}
