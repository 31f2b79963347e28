package com.queryhub.domain.model;

public enum CredentialStatus {
    CONNECTED,
    VALIDATING,
    DISCONNECTED,
    ERROR;

    /**
     * Only connected or validating credentials may be used against the remote engine.
     */
    public boolean isUsable() {
        return this == CONNECTED || this == VALIDATING;
    }
}
