package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.SQLException;

/**
 * Drops the unique index on {@code (integration_name, share_type,
 * share_target)} created by migration 9. With several instances of one type
 * it rejected the second instance's share for the same target, and
 * {@code INSERT OR IGNORE} turned that into a silent loss. Uniqueness is now
 * enforced per instance by {@code idx_integration_shares_instance_unique}.
 *
 * <p>
 * The index is usually absent already: migration 17 drops it before its
 * fan-out, this unit may have run before a crash, or the database never had
 * it. It remains for databases that ran an earlier migration 17 which kept
 * the index.
 */
final class DropTypeBasedShareIndex extends AbstractMigration {

    static final String STALE_INDEX = "idx_integration_shares_unique";

    DropTypeBasedShareIndex() {
        super(18, "drop_type_based_share_index");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        try {
            if (Schema.dropIndexIfExists(context.connection(), STALE_INDEX)) {
                log.debug("{} Dropped {}", prefix(), STALE_INDEX);
            } else {
                log.debug("{} {} not present, nothing to drop", prefix(), STALE_INDEX);
            }
        } catch (SQLException e) {
            log.debug("{} Could not drop {}, ignoring: {}", prefix(), STALE_INDEX, e.getMessage());
        }
    }
}
