package de.bsommerfeld.homedash.db.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.homedash.core.crypto.ConfigEncryption;
import de.bsommerfeld.homedash.core.crypto.EncryptionMode;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;

/**
 * Everything a unit may touch while its {@code up} runs. Handed out fresh
 * per unit by {@link MigrationRunner}; nothing here is global.
 */
public final class MigrationContext {

    private final Connection connection;
    private final VersionLedger ledger;
    private final ConfigEncryption encryption;
    private final EncryptionSettings encryptionSettings;
    private final Clock clock;
    private final UnitReport report;
    private boolean plaintextFallbackReported;

    public MigrationContext(Connection connection, VersionLedger ledger, ConfigEncryption encryption,
            EncryptionSettings encryptionSettings, Clock clock, UnitReport report) {
        this.connection = connection;
        this.ledger = ledger;
        this.encryption = encryption;
        this.encryptionSettings = encryptionSettings;
        this.clock = clock;
        this.report = report;
    }

    public Connection connection() {
        return connection;
    }

    /** Read-only use only: units must never write Ledger rows themselves. */
    public VersionLedger ledger() {
        return ledger;
    }

    public UnitReport report() {
        return report;
    }

    public Instant now() {
        return clock.instant();
    }

    public long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }

    /**
     * Serializes and encrypts a config for {@code integration_instances}. A
     * missing key is recorded once per unit as a warning.
     */
    public String encryptConfig(Object config) {
        if (encryptionSettings.mode() == EncryptionMode.ENCRYPTED && !encryptionSettings.active()
                && !plaintextFallbackReported) {
            report.warn("no valid encryption key configured, configs stored as plaintext");
            plaintextFallbackReported = true;
        }
        return encryption.encryptConfig(config, encryptionSettings.mode(), encryptionSettings.key());
    }

    public ObjectNode decryptConfig(String stored) {
        return encryption.decryptConfig(stored, encryptionSettings.mode(), encryptionSettings.key());
    }
}
