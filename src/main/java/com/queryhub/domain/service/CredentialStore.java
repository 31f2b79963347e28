package com.queryhub.domain.service;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.CredentialAccess;
import com.queryhub.domain.model.CredentialStatus;
import com.queryhub.domain.model.IntegrationConfig;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.PostHogConfig;
import com.queryhub.domain.model.WorkspaceCredential;
import com.queryhub.infrastructure.crypto.CredentialCipher;
import com.queryhub.infrastructure.crypto.CredentialCipherException;
import com.queryhub.infrastructure.persistence.entity.IntegrationCredentialEntity;
import com.queryhub.infrastructure.persistence.repository.IntegrationCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Encrypted per-workspace integration credentials.
 *
 * Every lookup filters by the access's workspace in the query and checks the
 * returned row again. Admin access has no database-side tenant scoping, so the
 * second check is the one that counts for machine callers.
 *
 * Decryption happens on every call; decrypted keys are never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final IntegrationCredentialRepository repository;
    private final CredentialCipher cipher;
    private final QueryCache queryCache;

    @Transactional(readOnly = true)
    public WorkspaceCredential resolve(CredentialAccess access, String integrationName) {
        String workspaceId = access.getWorkspaceId();
        String label = displayName(integrationName);

        IntegrationCredentialEntity row = repository
                .findByWorkspaceIdAndIntegrationName(workspaceId, integrationName)
                .filter(entity -> workspaceId.equals(entity.getWorkspaceId()))
                .orElseThrow(() -> new ConfigurationException(
                        label + " integration is not configured for this workspace"));

        if (!row.isActive()) {
            throw new ConfigurationException(label + " integration is disabled");
        }
        if (row.getStatus() == null || !row.getStatus().isUsable()) {
            throw new ConfigurationException(label + " integration is not connected (status "
                    + (row.getStatus() == null ? "unknown" : row.getStatus().name().toLowerCase(Locale.ROOT)) + ")");
        }

        String apiKey = decrypt(row, label);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(label + " integration has no API key");
        }
        if (PostHogConfig.NAME.equals(integrationName)
                && (row.getProjectId() == null || row.getProjectId().isBlank())) {
            throw new ConfigurationException(label + " integration has no project id");
        }

        log.debug("Resolved {} credential for workspace {} ({})", integrationName, workspaceId, access.getMode());

        return WorkspaceCredential.builder()
                .workspaceId(row.getWorkspaceId())
                .integrationName(row.getIntegrationName())
                .apiKey(apiKey)
                .tenantId(row.getProjectId())
                .host(row.getMode() == IntegrationMode.SELF_HOSTED ? row.getHost() : row.getRegion())
                .mode(row.getMode())
                .active(row.isActive())
                .status(row.getStatus())
                .build();
    }

    /**
     * Stores (or replaces) the workspace's settings for one integration and
     * marks it connected.
     */
    @Transactional
    public IntegrationCredentialEntity configure(CredentialAccess access, IntegrationConfig config) {
        String workspaceId = access.getWorkspaceId();
        String integrationName = config.getIntegrationName();

        IntegrationCredentialEntity row = repository
                .findByWorkspaceIdAndIntegrationName(workspaceId, integrationName)
                .filter(entity -> workspaceId.equals(entity.getWorkspaceId()))
                .orElseGet(() -> IntegrationCredentialEntity.builder()
                        .workspaceId(workspaceId)
                        .integrationName(integrationName)
                        .build());

        row.setApiKeyEncrypted(cipher.encrypt(config.getApiKey()));
        if (config instanceof PostHogConfig) {
            PostHogConfig posthog = (PostHogConfig) config;
            row.setProjectId(posthog.getProjectId());
            row.setMode(posthog.getMode());
            row.setRegion(posthog.getRegion());
            row.setHost(posthog.getHost());
        }
        row.setActive(true);
        row.setStatus(CredentialStatus.CONNECTED);

        IntegrationCredentialEntity saved = repository.save(row);
        log.info("Configured {} integration for workspace {}", integrationName, workspaceId);
        return saved;
    }

    /**
     * Disables the integration and drops the workspace's cached results.
     */
    @Transactional
    public void disconnect(CredentialAccess access, String integrationName) {
        String workspaceId = access.getWorkspaceId();

        IntegrationCredentialEntity row = repository
                .findByWorkspaceIdAndIntegrationName(workspaceId, integrationName)
                .filter(entity -> workspaceId.equals(entity.getWorkspaceId()))
                .orElseThrow(() -> new ConfigurationException(
                        displayName(integrationName) + " integration is not configured for this workspace"));

        row.markDisconnected();
        repository.save(row);
        queryCache.invalidateWorkspace(workspaceId);

        log.info("Disconnected {} integration for workspace {}", integrationName, workspaceId);
    }

    @Transactional(readOnly = true)
    public List<String> activeWorkspaces(String integrationName) {
        return repository.findByIntegrationNameAndActiveTrue(integrationName).stream()
                .filter(row -> row.getStatus() != null && row.getStatus().isUsable())
                .map(IntegrationCredentialEntity::getWorkspaceId)
                .distinct()
                .collect(Collectors.toList());
    }

    private String decrypt(IntegrationCredentialEntity row, String label) {
        if (row.getApiKeyEncrypted() == null) {
            return null;
        }
        try {
            return cipher.decrypt(row.getApiKeyEncrypted());
        } catch (CredentialCipherException e) {
            log.warn("Could not decrypt {} credential for workspace {}", row.getIntegrationName(), row.getWorkspaceId());
            throw new ConfigurationException(label + " credential could not be decrypted; reconnect the integration");
        }
    }

    static String displayName(String integrationName) {
        if (PostHogConfig.NAME.equals(integrationName)) {
            return "PostHog";
        }
        if (integrationName == null || integrationName.isEmpty()) {
            return "Integration";
        }
        return Character.toUpperCase(integrationName.charAt(0)) + integrationName.substring(1);
    }
}
