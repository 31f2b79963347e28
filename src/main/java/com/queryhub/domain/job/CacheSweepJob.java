package com.queryhub.domain.job;

import com.queryhub.domain.service.QueryCache;
import com.queryhub.domain.service.RateLimiter;
import com.queryhub.infrastructure.ratelimit.InMemoryRateLimitStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic purge of expired cache rows across all workspaces.
 *
 * Also drops stale in-memory rate-limit windows when that store is active.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheSweepJob {

    private final QueryCache queryCache;
    private final RateLimiter rateLimiter;
    private final ObjectProvider<InMemoryRateLimitStore> inMemoryRateLimitStore;

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:600000}",
            initialDelayString = "${app.cache.sweep-interval-ms:600000}")
    public void sweep() {
        try {
            int purged = queryCache.invalidateAllExpired();
            if (purged > 0) {
                log.info("Cache sweep purged {} expired entries", purged);
            } else {
                log.debug("Cache sweep found nothing to purge");
            }
        } catch (Exception e) {
            log.error("Cache sweep failed: {}", e.getMessage(), e);
        }

        inMemoryRateLimitStore.ifAvailable(store -> store.evictExpired(rateLimiter.getWindowMs()));
    }
}
