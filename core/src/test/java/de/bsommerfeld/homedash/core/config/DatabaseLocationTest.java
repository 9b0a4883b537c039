package de.bsommerfeld.homedash.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseLocationTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        System.clearProperty("homedash.db.path");
    }

    @Test
    void resolve_shouldPreferSystemProperty() {
        Path file = tempDir.resolve("custom.db");
        System.setProperty("homedash.db.path", file.toString());

        assertEquals(file.toAbsolutePath(), DatabaseLocation.resolve());
    }

    @Test
    void resolve_withoutOverride_shouldEndWithDefaultFileName() {
        System.clearProperty("homedash.db.path");
        if (System.getenv("HOMEDASH_DB_PATH") != null)
            return;

        Path resolved = DatabaseLocation.resolve();
        assertEquals(DatabaseLocation.DEFAULT_FILE_NAME, resolved.getFileName().toString());
        assertEquals(DatabaseLocation.APP_NAME, resolved.getParent().getFileName().toString());
    }

    @Test
    void jdbcUrl_shouldUseSqliteScheme() {
        Path file = tempDir.resolve("x.db");
        assertEquals("jdbc:sqlite:" + file.toAbsolutePath(), DatabaseLocation.jdbcUrl(file));
    }
}
