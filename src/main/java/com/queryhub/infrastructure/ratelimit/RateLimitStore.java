package com.queryhub.infrastructure.ratelimit;

import com.queryhub.domain.model.RateLimitDecision;

/**
 * Backing store for fixed-window rate-limit counters.
 *
 * Implementations must make check-and-increment atomic per key and must never
 * let the stored count exceed {@code limit}.
 */
public interface RateLimitStore {

    RateLimitDecision tryConsume(String key, int limit, long windowMs, int cost);
}
