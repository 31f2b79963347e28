package com.queryhub.domain.service;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.CredentialAccess;
import com.queryhub.domain.model.CredentialStatus;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.PostHogConfig;
import com.queryhub.domain.model.WorkspaceCredential;
import com.queryhub.infrastructure.crypto.CredentialCipher;
import com.queryhub.infrastructure.crypto.CredentialCipherException;
import com.queryhub.infrastructure.persistence.entity.IntegrationCredentialEntity;
import com.queryhub.infrastructure.persistence.repository.IntegrationCredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialStoreTest {

    @Mock
    private IntegrationCredentialRepository repository;

    @Mock
    private CredentialCipher cipher;

    @Mock
    private QueryCache queryCache;

    private CredentialStore credentialStore;

    @BeforeEach
    void setUp() {
        credentialStore = new CredentialStore(repository, cipher, queryCache);
    }

    @Test
    void testResolve_DecryptsConnectedCredential() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-1").build()));
        when(cipher.decrypt("v1:iv:ct")).thenReturn("phx_plain_key");

        // When
        WorkspaceCredential credential = credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog");

        // Then
        assertEquals("ws-1", credential.getWorkspaceId());
        assertEquals("phx_plain_key", credential.getApiKey());
        assertEquals("1234", credential.getTenantId());
        assertEquals("eu", credential.getHost());
        assertFalse(credential.toString().contains("phx_plain_key"));
    }

    @Test
    void testResolve_SelfHostedUsesStoredHost() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-1")
                        .mode(IntegrationMode.SELF_HOSTED)
                        .host("https://posthog.internal.example")
                        .build()));
        when(cipher.decrypt(anyString())).thenReturn("phx_plain_key");

        // When
        WorkspaceCredential credential = credentialStore.resolve(
                CredentialAccess.admin("ws-1", IssuedBy.MACHINE), "posthog");

        // Then
        assertEquals("https://posthog.internal.example", credential.getHost());
        assertEquals(IntegrationMode.SELF_HOSTED, credential.getMode());
    }

    @Test
    void testResolve_MissingRow() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog")).thenReturn(Optional.empty());

        // When
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog"));

        // Then
        assertEquals("PostHog integration is not configured for this workspace", e.getMessage());
    }

    @Test
    void testResolve_RowOfAnotherWorkspaceIsRejected() {
        // Given: a misbehaving lookup returns someone else's row
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-2").build()));

        // Then
        assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.admin("ws-1", IssuedBy.AGENT), "posthog"));
        verifyNoInteractions(cipher);
    }

    @Test
    void testResolve_InactiveOrDisconnected() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-1").active(false).build()))
                .thenReturn(Optional.of(row("ws-1").status(CredentialStatus.ERROR).build()));

        // Then
        assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog"));
        ConfigurationException status = assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog"));
        assertTrue(status.getMessage().contains("error"));
    }

    @Test
    void testResolve_DecryptFailureIsConfigurationError() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-1").build()));
        when(cipher.decrypt(anyString())).thenThrow(new CredentialCipherException("Decryption failed"));

        // When
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog"));

        // Then
        assertFalse(e.getMessage().contains("v1:iv:ct"));
    }

    @Test
    void testResolve_PostHogWithoutProjectId() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog"))
                .thenReturn(Optional.of(row("ws-1").projectId(null).build()));
        when(cipher.decrypt(anyString())).thenReturn("phx_plain_key");

        // Then
        assertThrows(ConfigurationException.class,
                () -> credentialStore.resolve(CredentialAccess.session("ws-1"), "posthog"));
    }

    @Test
    void testConfigure_EncryptsKeyAndMarksConnected() {
        // Given
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog")).thenReturn(Optional.empty());
        when(cipher.encrypt("phx_new_key")).thenReturn("v1:new:ct");
        when(repository.save(any(IntegrationCredentialEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        PostHogConfig config = PostHogConfig.builder()
                .apiKey("phx_new_key")
                .projectId("99")
                .mode(IntegrationMode.CLOUD)
                .region("us")
                .build();

        // When
        IntegrationCredentialEntity saved = credentialStore.configure(CredentialAccess.session("ws-1"), config);

        // Then
        assertEquals("ws-1", saved.getWorkspaceId());
        assertEquals("v1:new:ct", saved.getApiKeyEncrypted());
        assertEquals("99", saved.getProjectId());
        assertEquals(CredentialStatus.CONNECTED, saved.getStatus());
        assertTrue(saved.isActive());
    }

    @Test
    void testDisconnect_MarksRowAndDropsCache() {
        // Given
        IntegrationCredentialEntity existing = row("ws-1").build();
        when(repository.findByWorkspaceIdAndIntegrationName("ws-1", "posthog")).thenReturn(Optional.of(existing));

        // When
        credentialStore.disconnect(CredentialAccess.session("ws-1"), "posthog");

        // Then
        ArgumentCaptor<IntegrationCredentialEntity> captor = ArgumentCaptor.forClass(IntegrationCredentialEntity.class);
        verify(repository).save(captor.capture());
        assertFalse(captor.getValue().isActive());
        assertEquals(CredentialStatus.DISCONNECTED, captor.getValue().getStatus());
        verify(queryCache).invalidateWorkspace("ws-1");
    }

    @Test
    void testActiveWorkspaces_SkipsUnusableRows() {
        // Given
        when(repository.findByIntegrationNameAndActiveTrue("posthog")).thenReturn(List.of(
                row("ws-1").build(),
                row("ws-2").status(CredentialStatus.ERROR).build(),
                row("ws-3").status(CredentialStatus.VALIDATING).build()));

        // When
        List<String> workspaces = credentialStore.activeWorkspaces("posthog");

        // Then
        assertEquals(List.of("ws-1", "ws-3"), workspaces);
    }

    private static IntegrationCredentialEntity.IntegrationCredentialEntityBuilder row(String workspaceId) {
        return IntegrationCredentialEntity.builder()
                .workspaceId(workspaceId)
                .integrationName("posthog")
                .apiKeyEncrypted("v1:iv:ct")
                .projectId("1234")
                .region("eu")
                .mode(IntegrationMode.CLOUD)
                .active(true)
                .status(CredentialStatus.CONNECTED);
    }
}
