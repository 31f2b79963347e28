package com.queryhub.infrastructure.persistence.entity;

import com.queryhub.domain.model.CredentialStatus;
import com.queryhub.domain.model.IntegrationMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Encrypted integration credential of a workspace.
 *
 * Only the API key is secret and stored as ciphertext; the rest is metadata.
 */
@Entity
@Table(name = "integration_credentials",
        uniqueConstraints = @UniqueConstraint(name = "uq_credential_workspace_integration",
                columnNames = {"workspace_id", "integration_name"}),
        indexes = {
                @Index(name = "idx_credential_active", columnList = "integration_name, is_active")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrationCredentialEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(name = "integration_name", nullable = false, length = 50)
    private String integrationName;

    @ToString.Exclude
    @Column(name = "api_key_encrypted", columnDefinition = "TEXT")
    private String apiKeyEncrypted;

    @Column(name = "project_id", length = 64)
    private String projectId;

    @Column(name = "host", length = 255)
    private String host;

    @Column(name = "region", length = 10)
    private String region;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 20)
    @Builder.Default
    private IntegrationMode mode = IntegrationMode.CLOUD;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private CredentialStatus status = CredentialStatus.CONNECTED;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void markDisconnected() {
        this.active = false;
        this.status = CredentialStatus.DISCONNECTED;
    }
}
