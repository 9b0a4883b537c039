package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Renames the integration type {@code uptime-kuma} to {@code uptimekuma}.
 * Instance ids embed the type ({@code uptime-kuma-primary}), and monitors,
 * metric samples and shares refer to instances by id or type, so the rename
 * cascades.
 *
 * <p>
 * Steps run in this order inside one transaction: type, then instance ids
 * (matched by the new type), then the referencing columns.
 */
final class RenameUptimeKumaType extends AbstractMigration {

    static final String OLD_TYPE = "uptime-kuma";
    static final String NEW_TYPE = "uptimekuma";

    RenameUptimeKumaType() {
        super(15, "rename_uptime_kuma_type");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();
        boolean monitorsLinked = Schema.hasColumn(conn, "service_monitors", "integration_instance_id");

        int[] counts = Transactions.inTransaction(conn, c -> {
            int types = update(c, "UPDATE integration_instances SET type = ? WHERE type = ?", NEW_TYPE, OLD_TYPE);
            int ids = update(c, "UPDATE integration_instances SET id = ? || substr(id, ?) "
                    + "WHERE type = ? AND id LIKE ?", NEW_TYPE, OLD_TYPE.length() + 1, NEW_TYPE, OLD_TYPE + "-%");
            int monitors = 0;
            if (monitorsLinked) {
                monitors = update(c, "UPDATE service_monitors SET integration_instance_id = ? || "
                        + "substr(integration_instance_id, ?) WHERE integration_instance_id LIKE ?",
                        NEW_TYPE, OLD_TYPE.length() + 1, OLD_TYPE + "-%");
            }
            int samples = update(c, "UPDATE metric_history SET integration_id = ? || substr(integration_id, ?) "
                    + "WHERE integration_id LIKE ?", NEW_TYPE, OLD_TYPE.length() + 1, OLD_TYPE + "-%");
            int shares = update(c, "UPDATE integration_shares SET integration_name = ? WHERE integration_name = ?",
                    NEW_TYPE, OLD_TYPE);
            return new int[] { types, ids, monitors, samples, shares };
        });

        context.report().migrated(counts[1]);
        log.debug("{} Renamed {} instance type(s), {} id(s), {} monitor link(s), {} metric sample(s), {} share(s)",
                prefix(), counts[0], counts[1], counts[2], counts[3], counts[4]);
    }

    private static int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            return ps.executeUpdate();
        }
    }
}
