package com.queryhub.domain.model;

/**
 * Per-integration configuration. Each integration validates its own required
 * fields at the boundary, see {@code IntegrationConfigParser}.
 */
public interface IntegrationConfig {

    String getIntegrationName();

    String getApiKey();
}
