package com.queryhub.domain.service;

import com.queryhub.domain.model.RateLimitDecision;
import com.queryhub.domain.model.RateLimitScope;
import com.queryhub.infrastructure.ratelimit.RateLimitStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-workspace fixed-window admission control.
 *
 * Each scope has its own window and quota, so listing tables does not eat
 * into the query budget.
 */
@Slf4j
@Service
public class RateLimiter {

    private final RateLimitStore store;
    private final MeterRegistry meterRegistry;
    private final long windowMs;
    private final Map<RateLimitScope, Integer> limits = new EnumMap<>(RateLimitScope.class);

    public RateLimiter(
            RateLimitStore store,
            MeterRegistry meterRegistry,
            @Value("${app.ratelimit.window-seconds:60}") long windowSeconds,
            @Value("${app.ratelimit.query.limit:20}") int queryLimit,
            @Value("${app.ratelimit.schema.limit:30}") int schemaLimit,
            @Value("${app.ratelimit.count.limit:15}") int countLimit) {
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.windowMs = windowSeconds * 1000L;
        limits.put(RateLimitScope.QUERY, queryLimit);
        limits.put(RateLimitScope.SCHEMA, schemaLimit);
        limits.put(RateLimitScope.COUNT, countLimit);
    }

    public RateLimitDecision admit(String workspaceId, RateLimitScope scope) {
        return admit(workspaceId, scope, 1);
    }

    public RateLimitDecision admit(String workspaceId, RateLimitScope scope, int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be positive");
        }
        int limit = limitFor(scope);
        String key = scope.name().toLowerCase(Locale.ROOT) + ":" + workspaceId;

        RateLimitDecision decision = store.tryConsume(key, limit, windowMs, cost);

        if (!decision.isAllowed()) {
            log.info("Rate limit hit: workspace={}, scope={}, limit={}/{}s",
                    workspaceId, scope, limit, windowMs / 1000);
            Counter.builder("ratelimit.rejected")
                    .tag("scope", scope.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry)
                    .increment();
        }
        return decision;
    }

    public int limitFor(RateLimitScope scope) {
        return limits.get(scope);
    }

    public long getWindowMs() {
        return windowMs;
    }
}
