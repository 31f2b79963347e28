package com.queryhub.infrastructure.ratelimit;

import com.queryhub.domain.model.RateLimitDecision;
import com.queryhub.domain.model.RateLimitWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-instance rate-limit windows.
 *
 * Counters are not shared between replicas, so the effective quota across a
 * deployment is approximate. The remote engine enforces its own hard limits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ratelimit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public RateLimitDecision tryConsume(String key, int limit, long windowMs, int cost) {
        long now = clock.millis();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        // compute() holds the bin lock, so check-and-increment is atomic per key
        windows.compute(key, (k, window) -> {
            if (window == null || window.isExpired(now, windowMs)) {
                window = new RateLimitWindow(k, now, 0, limit);
            }
            window.setLimit(limit);
            if (window.getRequestCount() + cost > limit) {
                decision[0] = RateLimitDecision.rejected(limit, window.resetInMs(now, windowMs));
                return window;
            }
            window.setRequestCount(window.getRequestCount() + cost);
            decision[0] = RateLimitDecision.allowed(
                    limit, limit - window.getRequestCount(), window.resetInMs(now, windowMs));
            return window;
        });

        return decision[0];
    }

    int size() {
        return windows.size();
    }

    /**
     * Drops windows that have already reset. Called by the cache sweep so the
     * map does not grow with every workspace ever seen.
     */
    public int evictExpired(long windowMs) {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(w -> w.isExpired(now, windowMs));
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Evicted {} expired rate-limit windows", removed);
        }
        return removed;
    }
}
