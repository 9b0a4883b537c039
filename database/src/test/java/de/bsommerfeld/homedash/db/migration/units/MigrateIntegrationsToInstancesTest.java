package de.bsommerfeld.homedash.db.migration.units;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.homedash.core.crypto.ConfigEncryption;
import de.bsommerfeld.homedash.core.crypto.EncryptionMode;
import de.bsommerfeld.homedash.db.migration.EncryptionSettings;
import de.bsommerfeld.homedash.db.migration.UnitReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.Arrays;

import static de.bsommerfeld.homedash.db.migration.MigrationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MigrateIntegrationsToInstancesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Connection conn;
    private final MigrateIntegrationsToInstances unit = new MigrateIntegrationsToInstances();

    @BeforeEach
    void setUp() throws Exception {
        conn = open(tempDir, "instances.db");
        migrateThrough(conn, 7);
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void up_shouldCreatePrimaryInstanceAndSkipEmptyConfig() throws Exception {
        storeIntegrations("{\"plex\": {\"url\":\"x\",\"apiKey\":\"y\",\"enabled\":true}, \"empty\": {}}");
        UnitReport report = new UnitReport(8, unit.name());

        unit.up(context(conn, EncryptionSettings.plaintext(), report));

        assertEquals(1, queryInt(conn, "SELECT COUNT(*) FROM integration_instances"));
        assertEquals("plex", queryString(conn, "SELECT type FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals("Plex",
                queryString(conn, "SELECT display_name FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals(1, queryInt(conn, "SELECT enabled FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals(0, queryInt(conn, "SELECT COUNT(*) FROM integration_instances WHERE type = 'empty'"));

        JsonNode config = MAPPER.readTree(
                queryString(conn, "SELECT config_encrypted FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals("x", config.path("url").asText());
        assertEquals("y", config.path("apiKey").asText());
        assertEquals(1, report.migratedCount());
    }

    @Test
    void up_shouldStripSharingAndTreatSharingOnlyConfigAsEmpty() throws Exception {
        storeIntegrations("{\"sonarr\": {\"url\":\"http://s\",\"enabled\":false,\"sharing\":{\"enabled\":true}},"
                + "\"radarr\": {\"sharing\":{\"mode\":\"everyone\"}}}");

        unit.up(context(conn));

        assertEquals(1, queryInt(conn, "SELECT COUNT(*) FROM integration_instances"));
        assertEquals(0, queryInt(conn, "SELECT enabled FROM integration_instances WHERE id = 'sonarr-primary'"));
        JsonNode config = MAPPER.readTree(
                queryString(conn, "SELECT config_encrypted FROM integration_instances WHERE id = 'sonarr-primary'"));
        assertFalse(config.has("sharing"));
        assertEquals("http://s", config.path("url").asText());
    }

    @Test
    void up_withoutEnabledKey_shouldKeepIntegrationEnabled() throws Exception {
        storeIntegrations("{\"plex\": {\"url\":\"x\",\"apiKey\":\"y\"}, \"sonarr\": {\"url\":\"s\",\"enabled\":null}}");

        unit.up(context(conn));

        assertEquals(1, queryInt(conn, "SELECT enabled FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals(1, queryInt(conn, "SELECT enabled FROM integration_instances WHERE id = 'sonarr-primary'"));
    }

    @Test
    void up_shouldSkipEntirelyWhenInstancesExist() throws Exception {
        storeIntegrations("{\"plex\": {\"url\":\"x\"}, \"sonarr\": {\"url\":\"s\"}}");
        update(conn, "INSERT INTO integration_instances (id, type, display_name, config_encrypted) "
                + "VALUES ('plex-home', 'plex', 'Home', '{}')");

        unit.up(context(conn));

        assertEquals(1, queryInt(conn, "SELECT COUNT(*) FROM integration_instances"));
    }

    @Test
    void up_withoutLegacyConfig_shouldDoNothing() throws Exception {
        unit.up(context(conn));
        assertEquals(0, queryInt(conn, "SELECT COUNT(*) FROM integration_instances"));
    }

    @Test
    void up_withMalformedLegacyConfig_shouldRecordSkipAndSucceed() throws Exception {
        storeIntegrations("{broken");
        UnitReport report = new UnitReport(8, unit.name());

        unit.up(context(conn, EncryptionSettings.plaintext(), report));

        assertEquals(1, report.skippedCount());
        assertEquals(0, queryInt(conn, "SELECT COUNT(*) FROM integration_instances"));
    }

    @Test
    void up_withKey_shouldStoreEncryptedConfig() throws Exception {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) 7);
        EncryptionSettings settings = new EncryptionSettings(EncryptionMode.ENCRYPTED, key);
        storeIntegrations("{\"plex\": {\"url\":\"x\",\"token\":\"secret\"}}");

        unit.up(context(conn, settings, new UnitReport(8, unit.name())));

        String stored = queryString(conn,
                "SELECT config_encrypted FROM integration_instances WHERE id = 'plex-primary'");
        assertFalse(stored.contains("secret"));
        assertTrue(ConfigEncryption.isLikelyEncrypted(stored));
        JsonNode decrypted = new ConfigEncryption().decryptConfig(stored, EncryptionMode.ENCRYPTED, key);
        assertEquals("secret", decrypted.path("token").asText());
    }

    @Test
    void up_inEncryptedModeWithoutKey_shouldFallBackToPlaintextAndWarn() throws Exception {
        storeIntegrations("{\"plex\": {\"url\":\"x\"}}");
        UnitReport report = new UnitReport(8, unit.name());

        unit.up(context(conn, new EncryptionSettings(EncryptionMode.ENCRYPTED, null), report));

        assertEquals("{\"url\":\"x\"}",
                queryString(conn, "SELECT config_encrypted FROM integration_instances WHERE id = 'plex-primary'"));
        assertEquals(1, report.warnings().size());
        assertEquals(0, report.skippedCount());
    }

    @Test
    void displayName_shouldCapitalizeType() {
        assertEquals("Overseerr", MigrateIntegrationsToInstances.displayName("overseerr"));
        assertEquals("", MigrateIntegrationsToInstances.displayName(""));
    }

    private void storeIntegrations(String json) throws Exception {
        update(conn, "INSERT INTO system_config (key, value) VALUES ('integrations', ?)", json);
    }
}
