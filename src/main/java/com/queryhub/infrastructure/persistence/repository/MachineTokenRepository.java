package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.MachineTokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MachineTokenRepository extends JpaRepository<MachineTokenEntity, UUID> {

    Optional<MachineTokenEntity> findByTokenHash(String tokenHash);
}
