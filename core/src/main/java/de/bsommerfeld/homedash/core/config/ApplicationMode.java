package de.bsommerfeld.homedash.core.config;

import de.bsommerfeld.homedash.core.crypto.EncryptionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumeration representing the running mode of the application.
 * Controls whether integration secrets are encrypted at rest.
 */
public enum ApplicationMode {

    PROD,
    DEVELOPMENT;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current application mode from system properties ("app.mode")
     * or environment variables ("APP_MODE"). Defaults to PROD if not set or
     * invalid. "dev" is accepted as shorthand for DEVELOPMENT.
     */
    public static ApplicationMode get() {
        String mode = Settings.lookup("app.mode", "APP_MODE").orElse(null);
        if (mode == null) {
            return PROD;
        }

        if (mode.equalsIgnoreCase("dev")) {
            return DEVELOPMENT;
        }
        try {
            return ApplicationMode.valueOf(mode.toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isDevelopment() {
        return this == DEVELOPMENT;
    }

    /**
     * Development installations keep integration configs in plaintext so they
     * can be inspected with any SQLite browser.
     */
    public EncryptionMode encryptionMode() {
        return isDevelopment() ? EncryptionMode.PLAINTEXT : EncryptionMode.ENCRYPTED;
    }
}
