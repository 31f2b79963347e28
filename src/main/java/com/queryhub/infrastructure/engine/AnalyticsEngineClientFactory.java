package com.queryhub.infrastructure.engine;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.WorkspaceCredential;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds a per-call engine client from a resolved credential.
 *
 * Clients are not cached: the credential is decrypted per call and must not
 * outlive it.
 */
@Component
public class AnalyticsEngineClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final String usHost;
    private final String euHost;

    public AnalyticsEngineClientFactory(
            WebClient.Builder webClientBuilder,
            @Value("${app.engine.us-host:https://us.posthog.com}") String usHost,
            @Value("${app.engine.eu-host:https://eu.posthog.com}") String euHost) {
        this.webClientBuilder = webClientBuilder;
        this.usHost = usHost;
        this.euHost = euHost;
    }

    public AnalyticsEngineClient forCredential(WorkspaceCredential credential) {
        return new PostHogEngineClient(
                webClientBuilder.clone(),
                resolveHost(credential),
                credential.getTenantId(),
                credential.getApiKey());
    }

    /**
     * Self-hosted credentials carry their own host. Cloud credentials store the
     * region ({@code us}/{@code eu}) or a full cloud URL in the host column.
     */
    String resolveHost(WorkspaceCredential credential) {
        String host = credential.getHost();
        if (credential.getMode() == IntegrationMode.SELF_HOSTED) {
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("Self-hosted analytics integration has no host configured");
            }
            return host;
        }
        if (host == null || host.isBlank() || "us".equalsIgnoreCase(host)) {
            return usHost;
        }
        if ("eu".equalsIgnoreCase(host)) {
            return euHost;
        }
        return host;
    }
}
