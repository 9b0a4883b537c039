package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.migration.Migration;
import de.bsommerfeld.homedash.db.migration.MigrationRegistry;
import de.bsommerfeld.homedash.db.migration.ScriptMigration;

import java.util.List;

/**
 * The application's migration lineage. New migrations are appended with the
 * next version; released entries are never renumbered or removed.
 */
public final class HomedashMigrations {

    private static final List<Migration> ALL = List.of(
            new ScriptMigration(1, "initial_schema", "0001-initial-schema"),
            new ScriptMigration(2, "add_linked_accounts", "0002-add-linked-accounts"),
            new ScriptMigration(3, "add_push_subscriptions", "0003-add-push-subscriptions"),
            new AddCustomIconSystemFlag(),
            new AddUserPasswordFlags(),
            new ScriptMigration(6, "add_dashboard_templates", "0006-add-dashboard-templates"),
            new ScriptMigration(7, "add_integration_instances", "0007-add-integration-instances"),
            new MigrateIntegrationsToInstances(),
            new ScriptMigration(9, "add_sharing_tables", "0009-add-sharing-tables"),
            new ScriptMigration(10, "add_service_monitors", "0010-add-service-monitors"),
            new LinkMonitorsToInstances(),
            new ScriptMigration(12, "add_metric_history", "0012-add-metric-history"),
            new DoubleWidgetHeights(),
            new PruneStaleHistory(),
            new RenameUptimeKumaType(),
            new MigrateMonitoringTypes(),
            new RefactorIntegrationSharesForInstances(),
            new DropTypeBasedShareIndex(),
            new NeutralizeProxyPlaceholderPasswords(),
            new ScriptMigration(20, "add_media_library", "0020-add-media-library"));

    private static final MigrationRegistry REGISTRY = MigrationRegistry.of(ALL);

    private HomedashMigrations() {
    }

    public static MigrationRegistry registry() {
        return REGISTRY;
    }
}
