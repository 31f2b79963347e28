package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.MtuTrackingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MtuTrackingRepository extends JpaRepository<MtuTrackingEntity, UUID> {

    Optional<MtuTrackingEntity> findByWorkspaceIdAndTrackingDate(String workspaceId, LocalDate trackingDate);
}
