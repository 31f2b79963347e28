package com.queryhub.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Decrypted connection secret for one workspace and integration.
 *
 * Lives only for the duration of a single call; never cached or logged.
 */
@Value
@Builder
public class WorkspaceCredential {

    String workspaceId;
    String integrationName;

    @ToString.Exclude
    String apiKey;

    /** PostHog project id. */
    String tenantId;
    String host;
    IntegrationMode mode;
    boolean active;
    CredentialStatus status;

    public String maskedApiKey() {
        return mask(apiKey);
    }

    public static String mask(String secret) {
        if (secret == null || secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "…" + secret.substring(secret.length() - 4);
    }
}
