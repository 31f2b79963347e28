package com.queryhub.domain.model;

import lombok.Value;

@Value
public class RateLimitDecision {

    boolean allowed;
    int limit;
    int remaining;

    /** Milliseconds until the current window resets. */
    long retryAfterMs;

    public static RateLimitDecision allowed(int limit, int remaining, long resetInMs) {
        return new RateLimitDecision(true, limit, remaining, resetInMs);
    }

    public static RateLimitDecision rejected(int limit, long retryAfterMs) {
        return new RateLimitDecision(false, limit, 0, Math.max(1, retryAfterMs));
    }
}
