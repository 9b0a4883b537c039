package de.bsommerfeld.homedash.core.crypto;

/**
 * How integration configs are written to the database.
 */
public enum EncryptionMode {

    /** Canonical JSON, stored verbatim. */
    PLAINTEXT,

    /** AES-256-GCM, base64 of {@code iv || authTag || ciphertext}. */
    ENCRYPTED
}
