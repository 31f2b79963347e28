package com.queryhub.infrastructure.crypto;

/**
 * Symmetric encryption for credential secrets at rest.
 */
public interface CredentialCipher {

    String encrypt(String plaintext);

    /**
     * @throws CredentialCipherException if the ciphertext is malformed or was
     *                                   produced with a different key
     */
    String decrypt(String ciphertext);
}
