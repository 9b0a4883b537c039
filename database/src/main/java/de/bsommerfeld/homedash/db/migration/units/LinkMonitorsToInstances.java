package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Lets a monitor belong to an integration instance (first-party monitor or a
 * specific Uptime Kuma server).
 */
final class LinkMonitorsToInstances extends AbstractMigration {

    LinkMonitorsToInstances() {
        super(11, "link_monitors_to_instances");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();
        if (Schema.addColumnIfMissing(conn, "service_monitors", "integration_instance_id", "TEXT")) {
            log.debug("{} Added service_monitors.integration_instance_id", prefix());
        }
        Schema.execute(conn, "CREATE INDEX IF NOT EXISTS idx_service_monitors_instance "
                + "ON service_monitors(integration_instance_id)");
    }
}
