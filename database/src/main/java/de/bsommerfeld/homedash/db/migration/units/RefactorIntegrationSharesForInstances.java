package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Integration shares move from type-based ({@code integration_name}) to
 * instance-based ({@code integration_instance_id}).
 *
 * <p>
 * A share of type {@code T} fans out to every instance of {@code T}: the
 * first instance (oldest, then by id) takes over the original row, every
 * other instance gets a copy with a fresh id. Shares of a type without any
 * instance are deleted. Only rows with a {@code NULL} instance id are
 * touched, so a re-run continues where the last one stopped.
 *
 * <p>
 * The type-based unique index from migration 9 is dropped before the
 * fan-out. It would reject the copy for a second instance of the same type.
 */
final class RefactorIntegrationSharesForInstances extends AbstractMigration {

    RefactorIntegrationSharesForInstances() {
        super(17, "refactor_integration_shares_for_instances");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();

        if (Schema.addColumnIfMissing(conn, "integration_shares", "integration_instance_id", "TEXT")) {
            log.debug("{} Added integration_shares.integration_instance_id", prefix());
        }

        if (Schema.dropIndexIfExists(conn, DropTypeBasedShareIndex.STALE_INDEX)) {
            log.debug("{} Dropped {} before fan-out", prefix(), DropTypeBasedShareIndex.STALE_INDEX);
        }

        List<Share> shares = readUnassignedShares(conn);
        Map<String, List<String>> instancesByType = readInstancesByType(conn);

        int[] counts = Transactions.inTransaction(conn, c -> {
            int migrated = 0;
            int deleted = 0;
            try (PreparedStatement assign = c.prepareStatement(
                    "UPDATE integration_shares SET integration_instance_id = ? WHERE id = ?");
                    PreparedStatement copy = c.prepareStatement(
                            "INSERT OR IGNORE INTO integration_shares (id, integration_name, integration_instance_id, "
                                    + "share_type, share_target, shared_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)");
                    PreparedStatement delete = c.prepareStatement("DELETE FROM integration_shares WHERE id = ?")) {

                for (Share share : shares) {
                    List<String> instances = instancesByType.getOrDefault(share.integrationName(), List.of());
                    if (instances.isEmpty()) {
                        delete.setString(1, share.id());
                        delete.executeUpdate();
                        deleted++;
                        continue;
                    }
                    for (int i = 0; i < instances.size(); i++) {
                        if (i == 0) {
                            assign.setString(1, instances.get(0));
                            assign.setString(2, share.id());
                            assign.executeUpdate();
                        } else {
                            copy.setString(1, UUID.randomUUID().toString());
                            copy.setString(2, share.integrationName());
                            copy.setString(3, instances.get(i));
                            copy.setString(4, share.shareType());
                            copy.setString(5, share.shareTarget());
                            copy.setString(6, share.sharedBy());
                            copy.setLong(7, share.createdAt());
                            copy.executeUpdate();
                        }
                        migrated++;
                    }
                }
            }
            return new int[] { migrated, deleted };
        });

        context.report().migrated(counts[0]);
        log.debug("{} Share migration complete (migrated={}, deleted={})", prefix(), counts[0], counts[1]);

        Schema.execute(conn, "CREATE INDEX IF NOT EXISTS idx_integration_shares_instance_id "
                + "ON integration_shares(integration_instance_id)");
        Schema.execute(conn, "CREATE UNIQUE INDEX IF NOT EXISTS idx_integration_shares_instance_unique "
                + "ON integration_shares(integration_instance_id, share_type, share_target)");
    }

    private static List<Share> readUnassignedShares(Connection conn) throws SQLException {
        List<Share> shares = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, integration_name, share_type, share_target, shared_by, created_at "
                        + "FROM integration_shares WHERE integration_instance_id IS NULL ORDER BY created_at, id");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                shares.add(new Share(rs.getString("id"), rs.getString("integration_name"),
                        rs.getString("share_type"), rs.getString("share_target"), rs.getString("shared_by"),
                        rs.getLong("created_at")));
            }
        }
        return shares;
    }

    private static Map<String, List<String>> readInstancesByType(Connection conn) throws SQLException {
        Map<String, List<String>> byType = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, type FROM integration_instances ORDER BY created_at, id");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                byType.computeIfAbsent(rs.getString("type"), t -> new ArrayList<>()).add(rs.getString("id"));
            }
        }
        return byType;
    }

    private record Share(String id, String integrationName, String shareType, String shareTarget, String sharedBy,
            long createdAt) {
    }
}
