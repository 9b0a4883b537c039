package de.bsommerfeld.homedash.db.migration.units;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Splits the old {@code systemstatus} integration into the new
 * {@code glances} type and gives first-party monitors their own
 * {@code monitor} instance.
 *
 * <ol>
 * <li>{@code systemstatus} with a Glances or custom backend becomes
 * {@code glances-primary}; its nested config is flattened to
 * {@code {url, password}} or {@code {url, token}} and re-encrypted.</li>
 * <li>{@code monitor-primary} is created unless present. Its enabled flag is
 * taken from a legacy {@code servicemonitoring} instance, which is then
 * removed.</li>
 * <li>Monitors without an instance are assigned to {@code monitor-primary}.</li>
 * </ol>
 */
final class MigrateMonitoringTypes extends AbstractMigration {

    static final String GLANCES_ID = "glances-primary";
    static final String MONITOR_ID = "monitor-primary";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    MigrateMonitoringTypes() {
        super(16, "migrate_monitoring_types");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Transactions.inTransaction(context.connection(), conn -> {
            migrateSystemStatus(context, conn);
            ensureMonitorInstance(context, conn);

            int assigned;
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE service_monitors SET integration_instance_id = ? WHERE integration_instance_id IS NULL")) {
                ps.setString(1, MONITOR_ID);
                assigned = ps.executeUpdate();
            }
            context.report().migrated(assigned);
            log.debug("{} Assigned {} monitor(s) to {}", prefix(), assigned, MONITOR_ID);
            return null;
        });
    }

    private void migrateSystemStatus(MigrationContext context, Connection conn) throws SQLException {
        String id;
        String stored;
        int enabled;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, config_encrypted, enabled FROM integration_instances WHERE type = 'systemstatus' LIMIT 1");
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return;
            }
            id = rs.getString("id");
            stored = rs.getString("config_encrypted");
            enabled = rs.getInt("enabled");
        }

        if (exists(conn, GLANCES_ID)) {
            log.debug("{} {} already exists, keeping it", prefix(), GLANCES_ID);
        } else {
            ObjectNode flat = flatten(context.decryptConfig(stored));
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO integration_instances (id, type, display_name, config_encrypted, enabled, created_at, "
                            + "updated_at) VALUES (?, 'glances', 'Glances', ?, ?, ?, NULL)")) {
                ps.setString(1, GLANCES_ID);
                ps.setString(2, context.encryptConfig(flat));
                ps.setInt(3, enabled);
                ps.setLong(4, context.nowEpochSeconds());
                ps.executeUpdate();
            }
            context.report().migrated();
            log.debug("{} Created {} from {}", prefix(), GLANCES_ID, id);
        }

        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM integration_instances WHERE id = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
        }
        log.debug("{} Removed {}", prefix(), id);
    }

    /**
     * {@code {backend: 'glances', glances: {url, password}}} becomes
     * {@code {url, password}}; the custom backend keeps url and token. Any
     * other shape yields an empty config.
     */
    static ObjectNode flatten(JsonNode old) {
        ObjectNode flat = MAPPER.createObjectNode();
        String backend = old.path("backend").asText("");
        if ("glances".equals(backend) && old.path("glances").isObject()) {
            flat.put("url", old.path("glances").path("url").asText(""));
            flat.put("password", old.path("glances").path("password").asText(""));
        } else if ("custom".equals(backend) && old.path("custom").isObject()) {
            flat.put("url", old.path("custom").path("url").asText(""));
            flat.put("token", old.path("custom").path("token").asText(""));
        }
        return flat;
    }

    private void ensureMonitorInstance(MigrationContext context, Connection conn) throws SQLException {
        if (exists(conn, MONITOR_ID)) {
            return;
        }

        Integer legacyEnabled = null;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT enabled FROM integration_instances WHERE type = 'servicemonitoring' LIMIT 1");
                ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                legacyEnabled = rs.getInt(1);
            }
        }

        ObjectNode config = MAPPER.createObjectNode().put("label", "Primary Monitors");
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO integration_instances (id, type, display_name, config_encrypted, enabled, created_at, "
                        + "updated_at) VALUES (?, 'monitor', 'Service Monitor', ?, ?, ?, NULL)")) {
            ps.setString(1, MONITOR_ID);
            ps.setString(2, context.encryptConfig(config));
            ps.setInt(3, legacyEnabled != null ? legacyEnabled : 1);
            ps.setLong(4, context.nowEpochSeconds());
            ps.executeUpdate();
        }
        context.report().migrated();
        log.debug("{} Created {}", prefix(), MONITOR_ID);

        if (legacyEnabled != null) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM integration_instances WHERE type = 'servicemonitoring'")) {
                ps.executeUpdate();
            }
            log.debug("{} Removed legacy servicemonitoring instance", prefix());
        }
    }

    private static boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM integration_instances WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
