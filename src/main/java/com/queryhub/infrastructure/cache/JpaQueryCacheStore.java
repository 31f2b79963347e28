package com.queryhub.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryhub.domain.model.CachedResult;
import com.queryhub.infrastructure.persistence.entity.CachedQueryResultEntity;
import com.queryhub.infrastructure.persistence.repository.CachedQueryResultRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cache store backed by the {@code cached_query_results} table.
 *
 * Columns and rows are stored as JSON text. A circuit breaker keeps a slow or
 * failing database from adding latency to every query; an open breaker reads
 * as a miss and skips writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cache.store", havingValue = "jpa", matchIfMissing = true)
public class JpaQueryCacheStore implements QueryCacheStore {

    private static final TypeReference<List<String>> COLUMNS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<List<Object>>> ROWS_TYPE = new TypeReference<>() {
    };

    private final CachedQueryResultRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "cacheStore", fallbackMethod = "findFallback")
    public Optional<CachedResult> find(String workspaceId, String queryHash) {
        return repository.findByWorkspaceIdAndQueryHash(workspaceId, queryHash)
                .filter(entity -> workspaceId.equals(entity.getWorkspaceId()))
                .map(this::toDomain);
    }

    @Override
    @Transactional
    @CircuitBreaker(name = "cacheStore", fallbackMethod = "upsertFallback")
    public void upsert(CachedResult result) {
        CachedQueryResultEntity entity = repository
                .findByWorkspaceIdAndQueryHash(result.getWorkspaceId(), result.getQueryHash())
                .orElseGet(() -> CachedQueryResultEntity.builder()
                        .workspaceId(result.getWorkspaceId())
                        .queryHash(result.getQueryHash())
                        .build());

        entity.setQueryId(result.getQueryId());
        entity.setColumnsJson(write(result.getColumns()));
        entity.setRowsJson(write(result.getRows()));
        entity.setRowCount(result.getRowCount());
        entity.setCachedAt(result.getCachedAt());
        entity.setExpiresAt(result.getExpiresAt());

        repository.save(entity);
        log.debug("Cached result for workspace {} (hash {}, expires {})",
                result.getWorkspaceId(), shortHash(result.getQueryHash()), result.getExpiresAt());
    }

    @Override
    @Transactional
    @CircuitBreaker(name = "cacheStore", fallbackMethod = "deleteExpiredFallback")
    public int deleteExpired(String workspaceId, Instant now) {
        return repository.deleteExpiredForWorkspace(workspaceId, now);
    }

    @Override
    @Transactional
    public int deleteAllExpired(Instant now) {
        return repository.deleteAllExpired(now);
    }

    @Override
    @Transactional
    public int deleteWorkspace(String workspaceId) {
        return repository.deleteByWorkspace(workspaceId);
    }

    private CachedResult toDomain(CachedQueryResultEntity entity) {
        try {
            return CachedResult.builder()
                    .workspaceId(entity.getWorkspaceId())
                    .queryHash(entity.getQueryHash())
                    .queryId(entity.getQueryId())
                    .columns(objectMapper.readValue(entity.getColumnsJson(), COLUMNS_TYPE))
                    .rows(objectMapper.readValue(entity.getRowsJson(), ROWS_TYPE))
                    .rowCount(entity.getRowCount())
                    .cachedAt(entity.getCachedAt())
                    .expiresAt(entity.getExpiresAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry " + entity.getId(), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Result is not serializable", e);
        }
    }

    private static String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    // Fallback methods (circuit breaker)

    private Optional<CachedResult> findFallback(String workspaceId, String queryHash, Exception e) {
        log.warn("Cache store unavailable, treating lookup as miss: {}", e.getMessage());
        return Optional.empty();
    }

    private void upsertFallback(CachedResult result, Exception e) {
        log.warn("Cache store unavailable, skipping cache write: {}", e.getMessage());
    }

    private int deleteExpiredFallback(String workspaceId, Instant now, Exception e) {
        log.warn("Cache store unavailable, skipping expiry purge: {}", e.getMessage());
        return 0;
    }
}
