package de.bsommerfeld.homedash.core.config;

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the symmetric key used to encrypt integration configs at rest.
 *
 * <p>
 * The key is a 64 character hex string (32 bytes) taken from
 * {@code secret.encryption.key} or {@code SECRET_ENCRYPTION_KEY}. A missing
 * or malformed key is not an error at this level: callers fall back to
 * plaintext storage. Production startup is expected to have rejected a
 * missing key long before any migration runs.
 */
public final class EncryptionKeySource {

    private static final Logger LOG = LoggerFactory.getLogger(EncryptionKeySource.class);
    private static final Pattern HEX_KEY = Pattern.compile("[0-9a-fA-F]{64}");

    private EncryptionKeySource() {
    }

    /** Key from the process configuration, if one is present and valid. */
    public static Optional<byte[]> fromEnvironment() {
        return Settings.lookup("secret.encryption.key", "SECRET_ENCRYPTION_KEY")
                .flatMap(EncryptionKeySource::parse);
    }

    /**
     * Decodes a hex key. Anything other than exactly 64 hex characters yields
     * empty and a warning naming the actual length (the key itself is never
     * logged).
     */
    public static Optional<byte[]> parse(String hex) {
        if (hex == null || hex.isBlank()) {
            return Optional.empty();
        }
        if (!HEX_KEY.matcher(hex).matches()) {
            LOG.warn("[Encryption] Ignoring malformed encryption key: expected 64 hex characters, got {}",
                    hex.length());
            return Optional.empty();
        }
        return Optional.of(BaseEncoding.base16().decode(hex.toUpperCase(Locale.ROOT)));
    }
}
