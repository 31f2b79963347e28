package com.queryhub.domain.service;

import com.queryhub.domain.model.CachedResult;
import com.queryhub.domain.model.QueryResultSet;
import com.queryhub.infrastructure.cache.QueryCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Workspace-scoped result cache.
 *
 * The cache is an optimisation: store failures read as a miss and writes are
 * skipped, they never fail the query.
 */
@Slf4j
@Service
public class QueryCache {

    private final QueryCacheStore store;
    private final Clock clock;
    private final Duration defaultTtl;

    public QueryCache(QueryCacheStore store, Clock clock,
                      @Value("${app.cache.ttl-seconds:300}") long ttlSeconds) {
        this.store = store;
        this.clock = clock;
        this.defaultTtl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<CachedResult> get(String workspaceId, String queryHash) {
        try {
            Instant now = clock.instant();
            return store.find(workspaceId, queryHash)
                    .filter(entry -> workspaceId.equals(entry.getWorkspaceId()))
                    .filter(entry -> entry.isLive(now));
        } catch (Exception e) {
            log.warn("Cache lookup failed for workspace {}, treating as miss: {}", workspaceId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores a fresh result. A {@code null} ttl uses the configured default; a
     * zero or negative ttl stores an entry that never expires.
     */
    public void put(String workspaceId, String queryHash, String queryId, QueryResultSet resultSet, Duration ttl) {
        Duration effective = ttl == null ? defaultTtl : ttl;
        Instant now = clock.instant();
        CachedResult entry = CachedResult.builder()
                .workspaceId(workspaceId)
                .queryHash(queryHash)
                .queryId(queryId)
                .columns(resultSet.getColumns())
                .rows(resultSet.getRows())
                .rowCount(resultSet.getRowCount())
                .cachedAt(now)
                .expiresAt(effective.isZero() || effective.isNegative() ? null : now.plus(effective))
                .build();
        try {
            store.upsert(entry);
        } catch (Exception e) {
            log.warn("Cache write failed for workspace {}: {}", workspaceId, e.getMessage());
        }
    }

    public int invalidateExpired(String workspaceId) {
        try {
            int purged = store.deleteExpired(workspaceId, clock.instant());
            log.info("Purged {} expired cache entries for workspace {}", purged, workspaceId);
            return purged;
        } catch (Exception e) {
            log.warn("Cache purge failed for workspace {}: {}", workspaceId, e.getMessage());
            return 0;
        }
    }

    /**
     * Drops every entry of the workspace. Failures propagate: a disconnect must
     * not leave cached data behind.
     */
    public int invalidateWorkspace(String workspaceId) {
        int purged = store.deleteWorkspace(workspaceId);
        log.info("Dropped {} cache entries for workspace {}", purged, workspaceId);
        return purged;
    }

    /**
     * Global sweep; errors propagate to the scheduler so they show up in its logs.
     */
    public int invalidateAllExpired() {
        return store.deleteAllExpired(clock.instant());
    }
}
