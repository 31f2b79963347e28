package com.queryhub.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * PostHog connection settings.
 */
@Value
@Builder
public class PostHogConfig implements IntegrationConfig {

    public static final String NAME = "posthog";

    @ToString.Exclude
    String apiKey;

    String projectId;
    IntegrationMode mode;

    /** {@code us} or {@code eu}; ignored in self-hosted mode. */
    String region;

    /** Base URL, required in self-hosted mode. */
    String host;

    @Override
    public String getIntegrationName() {
        return NAME;
    }
}
