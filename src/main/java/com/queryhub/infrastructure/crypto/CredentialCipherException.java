package com.queryhub.infrastructure.crypto;

public class CredentialCipherException extends RuntimeException {

    public CredentialCipherException(String message) {
        super(message);
    }

    public CredentialCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
