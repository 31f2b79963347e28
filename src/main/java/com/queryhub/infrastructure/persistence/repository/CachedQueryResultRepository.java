package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.CachedQueryResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CachedQueryResultRepository extends JpaRepository<CachedQueryResultEntity, UUID> {

    Optional<CachedQueryResultEntity> findByWorkspaceIdAndQueryHash(String workspaceId, String queryHash);

    @Modifying
    @Query("DELETE FROM CachedQueryResultEntity c WHERE " +
           "c.workspaceId = :workspaceId AND " +
           "c.expiresAt IS NOT NULL AND " +
           "c.expiresAt <= :now")
    int deleteExpiredForWorkspace(@Param("workspaceId") String workspaceId, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM CachedQueryResultEntity c WHERE " +
           "c.expiresAt IS NOT NULL AND " +
           "c.expiresAt <= :now")
    int deleteAllExpired(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM CachedQueryResultEntity c WHERE c.workspaceId = :workspaceId")
    int deleteByWorkspace(@Param("workspaceId") String workspaceId);
}
