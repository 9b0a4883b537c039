package de.bsommerfeld.homedash.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EncryptionKeySourceTest {

    private static final String VALID_KEY = "00112233445566778899aabbccddeeff00112233445566778899AABBCCDDEEFF";

    @AfterEach
    void clearProperty() {
        System.clearProperty("secret.encryption.key");
    }

    @Test
    void parse_shouldDecodeValidHexKey() {
        Optional<byte[]> key = EncryptionKeySource.parse(VALID_KEY);

        assertTrue(key.isPresent());
        assertEquals(32, key.get().length);
        assertEquals((byte) 0x11, key.get()[1]);
        assertEquals((byte) 0xff, key.get()[31]);
    }

    @Test
    void parse_shouldRejectWrongLength() {
        assertTrue(EncryptionKeySource.parse("abcdef").isEmpty());
    }

    @Test
    void parse_shouldRejectNonHexCharacters() {
        assertTrue(EncryptionKeySource.parse(VALID_KEY.replace('a', 'z')).isEmpty());
    }

    @Test
    void parse_shouldTreatBlankAsAbsent() {
        assertTrue(EncryptionKeySource.parse("  ").isEmpty());
        assertTrue(EncryptionKeySource.parse(null).isEmpty());
    }

    @Test
    void fromEnvironment_shouldReadSystemProperty() {
        System.setProperty("secret.encryption.key", VALID_KEY);
        assertTrue(EncryptionKeySource.fromEnvironment().isPresent());
    }
}
