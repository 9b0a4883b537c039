package de.bsommerfeld.homedash.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.homedash.core.config.ApplicationMode;
import de.bsommerfeld.homedash.core.config.DatabaseLocation;
import de.bsommerfeld.homedash.db.migration.EncryptionSettings;
import de.bsommerfeld.homedash.db.migration.MigrationRegistry;
import de.bsommerfeld.homedash.db.migration.units.HomedashMigrations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the database. {@link SqliteDatabase} is bound eagerly, so
 * creating the injector runs pending migrations and fails if one fails.
 */
public class DatabaseModule extends AbstractModule {

    public static final String DATABASE_FILE = "homedash.database.file";

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    @Override
    protected void configure() {
        LOG.info("Application Mode initialized: {}", ApplicationMode.get());
        bind(SqliteDatabase.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    @Named(DATABASE_FILE)
    Path databaseFile() {
        return DatabaseLocation.resolve();
    }

    @Provides
    @Singleton
    MigrationRegistry migrationRegistry() {
        return HomedashMigrations.registry();
    }

    @Provides
    @Singleton
    EncryptionSettings encryptionSettings() {
        EncryptionSettings settings = EncryptionSettings.fromEnvironment();
        LOG.info("Config storage: {}", settings);
        return settings;
    }

    @Provides
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
