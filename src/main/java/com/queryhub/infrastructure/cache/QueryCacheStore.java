package com.queryhub.infrastructure.cache;

import com.queryhub.domain.model.CachedResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for cached query results. Every read and delete is scoped by workspace
 * except the global expiry sweep.
 *
 * Expiry is applied by the caller at lookup time; stores return what they hold.
 */
public interface QueryCacheStore {

    Optional<CachedResult> find(String workspaceId, String queryHash);

    /**
     * Inserts or replaces the entry for (workspaceId, queryHash).
     */
    void upsert(CachedResult result);

    int deleteExpired(String workspaceId, Instant now);

    int deleteAllExpired(Instant now);

    int deleteWorkspace(String workspaceId);
}
