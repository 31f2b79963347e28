package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.IntegrationCredentialEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IntegrationCredentialRepository extends JpaRepository<IntegrationCredentialEntity, UUID> {

    Optional<IntegrationCredentialEntity> findByWorkspaceIdAndIntegrationName(String workspaceId, String integrationName);

    List<IntegrationCredentialEntity> findByIntegrationNameAndActiveTrue(String integrationName);
}
