package com.queryhub.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Fixed-window counter for one (scope, workspace) key.
 */
@Data
@AllArgsConstructor
public class RateLimitWindow {

    private String key;
    private long windowStartMs;
    private int requestCount;
    private int limit;

    public boolean isExpired(long nowMs, long windowMs) {
        return nowMs - windowStartMs >= windowMs;
    }

    public long resetInMs(long nowMs, long windowMs) {
        return Math.max(0, windowStartMs + windowMs - nowMs);
    }
}
