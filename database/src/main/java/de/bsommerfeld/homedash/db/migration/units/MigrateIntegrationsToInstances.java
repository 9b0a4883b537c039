package de.bsommerfeld.homedash.db.migration.units;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Moves the single-instance integration settings out of
 * {@code system_config['integrations']} into one {@code integration_instances}
 * row per type, with id {@code <type>-primary}.
 *
 * <p>
 * Skipped entirely once {@code integration_instances} has any row. The
 * {@code sharing} block is dropped (sharing lives in its own tables from
 * migration 9 on) and {@code enabled} moves into its own column. Types whose
 * remaining config is empty are not migrated.
 */
final class MigrateIntegrationsToInstances extends AbstractMigration {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    MigrateIntegrationsToInstances() {
        super(8, "migrate_integrations_to_instances");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();

        if (Schema.countRows(conn, "integration_instances") > 0) {
            log.debug("{} integration_instances already populated, skipping", prefix());
            return;
        }

        String raw = readIntegrationsBlob(conn);
        if (raw == null) {
            log.debug("{} No legacy integrations config found", prefix());
            return;
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            context.report().skipped("system_config.integrations: invalid JSON");
            return;
        }
        if (!root.isObject()) {
            context.report().skipped("system_config.integrations: not a JSON object");
            return;
        }

        List<Instance> instances = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String type = field.getKey();
            if (!field.getValue().isObject()) {
                context.report().skipped("integration '" + type + "': config is not an object");
                continue;
            }

            ObjectNode config = ((ObjectNode) field.getValue()).deepCopy();
            boolean enabled = config.path("enabled").asBoolean(true);
            config.remove("sharing");
            config.remove("enabled");
            if (config.isEmpty()) {
                log.debug("{} Skipping '{}': no configuration", prefix(), type);
                continue;
            }
            instances.add(new Instance(type + "-primary", type, displayName(type),
                    context.encryptConfig(config), enabled));
        }

        long now = context.nowEpochSeconds();
        int inserted = Transactions.inTransaction(conn, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO integration_instances (id, type, display_name, config_encrypted, enabled, "
                            + "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, NULL)")) {
                for (Instance instance : instances) {
                    ps.setString(1, instance.id());
                    ps.setString(2, instance.type());
                    ps.setString(3, instance.displayName());
                    ps.setString(4, instance.config());
                    ps.setInt(5, instance.enabled() ? 1 : 0);
                    ps.setLong(6, now);
                    ps.executeUpdate();
                }
            }
            return instances.size();
        });

        context.report().migrated(inserted);
        log.debug("{} Migrated {} integration(s) to instances", prefix(), inserted);
    }

    private static String readIntegrationsBlob(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM system_config WHERE key = 'integrations'");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    static String displayName(String type) {
        if (type.isEmpty()) {
            return type;
        }
        return Character.toUpperCase(type.charAt(0)) + type.substring(1);
    }

    private record Instance(String id, String type, String displayName, String config, boolean enabled) {
    }
}
