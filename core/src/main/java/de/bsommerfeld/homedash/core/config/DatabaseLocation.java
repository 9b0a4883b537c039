package de.bsommerfeld.homedash.core.config;

import de.bsommerfeld.homedash.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves where the SQLite database file lives.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>system property {@code homedash.db.path}</li>
 * <li>environment variable {@code HOMEDASH_DB_PATH}</li>
 * <li>{@code homedash.db} inside the platform application data directory</li>
 * </ol>
 */
public final class DatabaseLocation {

    public static final String APP_NAME = "homedash";
    public static final String DEFAULT_FILE_NAME = "homedash.db";

    private DatabaseLocation() {
    }

    /**
     * Returns the absolute path of the database file. The parent directory is
     * not created here.
     */
    public static Path resolve() {
        return Settings.lookup("homedash.db.path", "HOMEDASH_DB_PATH")
                .map(Paths::get)
                .orElseGet(() -> StorageUtils.getAppDataDir(APP_NAME).resolve(DEFAULT_FILE_NAME))
                .toAbsolutePath();
    }

    /** JDBC URL for the resolved database file. */
    public static String jdbcUrl() {
        return jdbcUrl(resolve());
    }

    public static String jdbcUrl(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath();
    }
}
