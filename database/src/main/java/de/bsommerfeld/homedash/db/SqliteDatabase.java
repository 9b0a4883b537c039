package de.bsommerfeld.homedash.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.homedash.db.migration.MigrationException;
import de.bsommerfeld.homedash.db.migration.MigrationRegistry;
import de.bsommerfeld.homedash.db.migration.MigrationResult;
import de.bsommerfeld.homedash.db.migration.MigrationRunner;
import de.bsommerfeld.homedash.db.migration.MigrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * The application's SQLite file. Construction brings the schema up to date,
 * so an instance that exists is fully migrated.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed by the caller.
 * SQLite serializes writes at the file level anyway, so pooling provides no
 * benefit.
 *
 * <h3>Startup failure</h3>
 * A failed migration is rethrown as {@link IllegalStateException}. Guice
 * reports it as a provisioning error and the host does not start.
 */
@Singleton
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private final Path file;
    private final String dbUrl;
    private final MigrationRegistry registry;
    private final MigrationRunner runner;
    private MigrationResult migrationResult;

    @Inject
    public SqliteDatabase(@Named(DatabaseModule.DATABASE_FILE) Path file, MigrationRegistry registry,
            MigrationRunner runner) {
        this.file = file.toAbsolutePath();
        this.dbUrl = "jdbc:sqlite:" + this.file;
        this.registry = registry;
        this.runner = runner;
        createParentDirectory();
        initialize();
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    public Path file() {
        return file;
    }

    /** What the startup migration did; {@code appliedCount} is 0 when nothing was pending. */
    public MigrationResult migrationResult() {
        return migrationResult;
    }

    public MigrationStatus status() throws MigrationException, SQLException {
        try (Connection conn = getConnection()) {
            return runner.status(registry, conn);
        }
    }

    private void createParentDirectory() {
        Path parent = file.getParent();
        if (parent == null || Files.exists(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create database directory " + parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            migrationResult = runner.run(registry, conn);
        } catch (MigrationException e) {
            LOG.error("Database migration failed, refusing to start: {}", e.getMessage());
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        } catch (SQLException e) {
            throw new IllegalStateException("Database initialization failed", e);
        }
        LOG.info("Database ready at schema v{}", migrationResult.toVersion());
    }
}
