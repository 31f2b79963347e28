package com.queryhub.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmCredentialCipherTest {

    private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);
    private static final String OTHER_KEY = Base64.getEncoder().encodeToString(
            "0123456789abcdef0123456789abcdef".getBytes());

    @Test
    void testEncryptDecrypt() {
        // Given
        AesGcmCredentialCipher cipher = new AesGcmCredentialCipher(KEY);

        // When
        String sealed = cipher.encrypt("phx_secret_key");

        // Then
        assertTrue(sealed.startsWith("v1:"));
        assertFalse(sealed.contains("phx_secret_key"));
        assertEquals("phx_secret_key", cipher.decrypt(sealed));
    }

    @Test
    void testEncrypt_FreshIvPerCall() {
        AesGcmCredentialCipher cipher = new AesGcmCredentialCipher(KEY);

        assertNotEquals(cipher.encrypt("same"), cipher.encrypt("same"));
    }

    @Test
    void testDecrypt_WrongKeyFails() {
        // Given
        String sealed = new AesGcmCredentialCipher(KEY).encrypt("phx_secret_key");

        // Then
        assertThrows(CredentialCipherException.class, () -> new AesGcmCredentialCipher(OTHER_KEY).decrypt(sealed));
    }

    @Test
    void testDecrypt_MalformedInput() {
        AesGcmCredentialCipher cipher = new AesGcmCredentialCipher(KEY);

        assertThrows(CredentialCipherException.class, () -> cipher.decrypt("plaintext"));
        assertThrows(CredentialCipherException.class, () -> cipher.decrypt("v2:a:b"));
        assertThrows(CredentialCipherException.class, () -> cipher.decrypt("v1:!!:??"));
    }

    @Test
    void testConstructor_RejectsMissingOrShortKey() {
        assertThrows(IllegalStateException.class, () -> new AesGcmCredentialCipher(""));
        assertThrows(IllegalStateException.class,
                () -> new AesGcmCredentialCipher(Base64.getEncoder().encodeToString(new byte[10])));
        assertThrows(IllegalStateException.class, () -> new AesGcmCredentialCipher("not base64 %%"));
    }
}
