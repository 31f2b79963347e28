package com.queryhub.infrastructure.cache;

import com.queryhub.domain.model.CachedResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache store for single-instance deployments and tests.
 */
@Component
@ConditionalOnProperty(name = "app.cache.store", havingValue = "memory")
public class InMemoryQueryCacheStore implements QueryCacheStore {

    private final Map<String, Map<String, CachedResult>> byWorkspace = new ConcurrentHashMap<>();

    @Override
    public Optional<CachedResult> find(String workspaceId, String queryHash) {
        Map<String, CachedResult> entries = byWorkspace.get(workspaceId);
        if (entries == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(queryHash));
    }

    @Override
    public void upsert(CachedResult result) {
        byWorkspace.computeIfAbsent(result.getWorkspaceId(), k -> new ConcurrentHashMap<>())
                .put(result.getQueryHash(), result);
    }

    @Override
    public int deleteExpired(String workspaceId, Instant now) {
        Map<String, CachedResult> entries = byWorkspace.get(workspaceId);
        if (entries == null) {
            return 0;
        }
        return removeExpired(entries, now);
    }

    @Override
    public int deleteAllExpired(Instant now) {
        int removed = 0;
        for (Map<String, CachedResult> entries : byWorkspace.values()) {
            removed += removeExpired(entries, now);
        }
        return removed;
    }

    @Override
    public int deleteWorkspace(String workspaceId) {
        Map<String, CachedResult> removed = byWorkspace.remove(workspaceId);
        return removed == null ? 0 : removed.size();
    }

    private static int removeExpired(Map<String, CachedResult> entries, Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLive(now));
        return before - entries.size();
    }
}
