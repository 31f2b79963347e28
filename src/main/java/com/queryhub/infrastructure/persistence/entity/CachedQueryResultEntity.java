package com.queryhub.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached result of one query for one workspace.
 *
 * At most one row per (workspace_id, query_hash); recomputation overwrites it.
 */
@Entity
@Table(name = "cached_query_results",
        uniqueConstraints = @UniqueConstraint(name = "uq_cache_workspace_hash",
                columnNames = {"workspace_id", "query_hash"}),
        indexes = {
                @Index(name = "idx_cache_expires_at", columnList = "expires_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedQueryResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(name = "query_hash", nullable = false, length = 64)
    private String queryHash;

    @Column(name = "query_id", nullable = false, length = 64)
    private String queryId;

    @Column(name = "columns_json", nullable = false, columnDefinition = "TEXT")
    private String columnsJson;

    @Column(name = "rows_json", nullable = false, columnDefinition = "TEXT")
    private String rowsJson;

    @Column(name = "row_count", nullable = false)
    private int rowCount;

    @Column(name = "cached_at", nullable = false)
    private Instant cachedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
