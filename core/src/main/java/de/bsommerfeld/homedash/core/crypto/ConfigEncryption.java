package de.bsommerfeld.homedash.core.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Encrypts integration configuration blobs for at-rest storage.
 *
 * <h3>Stored format</h3>
 * In {@link EncryptionMode#ENCRYPTED} mode with a valid key the stored value
 * is {@code base64(iv || authTag || ciphertext)}, using AES-256-GCM with a
 * 16-byte IV and a 16-byte authentication tag. A fresh IV is drawn for every
 * call, so encrypting the same config twice never yields the same string.
 *
 * <h3>Plaintext fallback</h3>
 * {@link EncryptionMode#PLAINTEXT}, or {@code ENCRYPTED} without a usable
 * 32-byte key, stores the canonical JSON serialization. The missing key case
 * is logged as a warning and never throws.
 */
public final class ConfigEncryption {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigEncryption.class);

    static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int IV_LENGTH = 16;
    static final int AUTH_TAG_LENGTH = 16;
    static final int KEY_LENGTH = 32;

    // IV + tag + one byte of data, base64 encoded
    private static final int MIN_ENCRYPTED_LENGTH = 44;
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+=*$");

    private final ObjectMapper mapper;
    private final SecureRandom random;

    public ConfigEncryption() {
        this(new ObjectMapper(), new SecureRandom());
    }

    public ConfigEncryption(ObjectMapper mapper, SecureRandom random) {
        this.mapper = mapper;
        this.random = random;
    }

    /** Whether {@code key} can be used for AES-256. */
    public static boolean isValidKey(byte[] key) {
        return key != null && key.length == KEY_LENGTH;
    }

    /**
     * Whether a call with these arguments produces ciphertext rather than
     * falling back to plaintext.
     */
    public static boolean encrypts(EncryptionMode mode, byte[] key) {
        return mode == EncryptionMode.ENCRYPTED && isValidKey(key);
    }

    /**
     * Serializes and, when possible, encrypts {@code config}.
     *
     * @param config any Jackson-serializable value, typically an
     *               {@link ObjectNode} or a {@code Map}
     * @param mode   requested storage mode
     * @param key    32-byte key, may be {@code null}
     * @return the value to store in {@code config_encrypted}
     */
    public String encryptConfig(Object config, EncryptionMode mode, byte[] key) {
        String json = serialize(config);
        if (mode == EncryptionMode.PLAINTEXT) {
            return json;
        }
        if (!isValidKey(key)) {
            LOG.warn("[Encryption] No valid encryption key configured, storing config as plaintext");
            return json;
        }

        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
            // JCE appends the tag: ciphertext || tag
            byte[] sealed = cipher.doFinal(json.getBytes(StandardCharsets.UTF_8));
            int cipherLength = sealed.length - AUTH_TAG_LENGTH;

            ByteBuffer combined = ByteBuffer.allocate(IV_LENGTH + sealed.length);
            combined.put(iv);
            combined.put(sealed, cipherLength, AUTH_TAG_LENGTH);
            combined.put(sealed, 0, cipherLength);
            return Base64.getEncoder().encodeToString(combined.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Reverses {@link #encryptConfig}. Values that were stored as plaintext
     * (development installs, or written before a key was configured) are
     * parsed directly. Anything that cannot be decrypted or parsed yields an
     * empty object, never an exception, so a single corrupt row cannot block
     * the caller.
     */
    public ObjectNode decryptConfig(String stored, EncryptionMode mode, byte[] key) {
        if (stored == null || stored.isBlank()) {
            return mapper.createObjectNode();
        }
        if (!encrypts(mode, key) || !isLikelyEncrypted(stored)) {
            return parseObject(stored);
        }

        try {
            byte[] data = Base64.getDecoder().decode(stored);
            byte[] iv = new byte[IV_LENGTH];
            System.arraycopy(data, 0, iv, 0, IV_LENGTH);

            int cipherLength = data.length - IV_LENGTH - AUTH_TAG_LENGTH;
            byte[] sealed = new byte[cipherLength + AUTH_TAG_LENGTH];
            System.arraycopy(data, IV_LENGTH + AUTH_TAG_LENGTH, sealed, 0, cipherLength);
            System.arraycopy(data, IV_LENGTH, sealed, cipherLength, AUTH_TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
            return parseObject(new String(cipher.doFinal(sealed), StandardCharsets.UTF_8));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.warn("[Encryption] Decryption failed, treating config as empty: {}", e.getMessage());
            return mapper.createObjectNode();
        }
    }

    /**
     * Heuristic used to tell ciphertext from plaintext JSON. Ciphertext is
     * base64 of at least 33 bytes; plaintext configs start with a brace or
     * bracket.
     */
    public static boolean isLikelyEncrypted(String value) {
        if (value == null || value.length() < MIN_ENCRYPTED_LENGTH) {
            return false;
        }
        if (value.startsWith("{") || value.startsWith("[")) {
            return false;
        }
        return BASE64.matcher(value).matches();
    }

    private String serialize(Object config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Config is not serializable to JSON", e);
        }
    }

    private ObjectNode parseObject(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node instanceof ObjectNode) {
                return (ObjectNode) node;
            }
        } catch (JsonProcessingException e) {
            LOG.debug("[Encryption] Stored config is not valid JSON: {}", e.getOriginalMessage());
        }
        return mapper.createObjectNode();
    }
}
