package de.bsommerfeld.homedash.db.migration;

import de.bsommerfeld.homedash.db.Schema;
import de.bsommerfeld.homedash.db.SqlLoader;

import java.sql.SQLException;
import java.util.List;

/**
 * A schema-only unit whose DDL lives in {@code sql/migrations/<script>.sql}.
 * Every statement in such a script must be re-runnable on its own
 * ({@code IF NOT EXISTS}, {@code INSERT OR IGNORE}).
 */
public class ScriptMigration extends AbstractMigration {

    private final String script;

    public ScriptMigration(int version, String name, String script) {
        super(version, name);
        this.script = script;
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        List<String> statements = SqlLoader.loadScript("migrations/" + script);
        Schema.executeAll(context.connection(), statements);
        log.debug("{} Applied {} statements from {}.sql", prefix(), statements.size(), script);
    }
}
