package de.bsommerfeld.homedash.db.migration;

import de.bsommerfeld.homedash.core.config.ApplicationMode;
import de.bsommerfeld.homedash.core.config.EncryptionKeySource;
import de.bsommerfeld.homedash.core.crypto.ConfigEncryption;
import de.bsommerfeld.homedash.core.crypto.EncryptionMode;

import java.util.Arrays;
import java.util.Objects;

/**
 * Storage mode and optional key used by units that write integration configs.
 *
 * @param mode requested storage mode
 * @param key  32-byte key, or {@code null} when none is configured
 */
public record EncryptionSettings(EncryptionMode mode, byte[] key) {

    public EncryptionSettings {
        key = key == null ? null : key.clone();
    }

    public static EncryptionSettings plaintext() {
        return new EncryptionSettings(EncryptionMode.PLAINTEXT, null);
    }

    /** Mode from {@link ApplicationMode}, key from {@link EncryptionKeySource}. */
    public static EncryptionSettings fromEnvironment() {
        return new EncryptionSettings(ApplicationMode.get().encryptionMode(),
                EncryptionKeySource.fromEnvironment().orElse(null));
    }

    /** {@code true} if configs will actually be encrypted. */
    public boolean active() {
        return ConfigEncryption.encrypts(mode, key);
    }

    /** A copy of the key, or {@code null}. */
    @Override
    public byte[] key() {
        return key == null ? null : key.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptionSettings)) {
            return false;
        }
        EncryptionSettings other = (EncryptionSettings) o;
        return mode == other.mode && Arrays.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(mode) + Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "EncryptionSettings[mode=" + mode + ", key=" + (key == null ? "absent" : "present") + "]";
    }
}
