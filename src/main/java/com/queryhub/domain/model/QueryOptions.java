package com.queryhub.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class QueryOptions {

    /** Bypass the cache lookup (setup and validation flows). The fresh result is still stored. */
    boolean skipCache;

    /** Cache TTL; {@code null} means the configured default. */
    Duration cacheTtl;

    @Builder.Default
    RateLimitScope rateLimitScope = RateLimitScope.QUERY;

    @Builder.Default
    String integrationName = "posthog";

    /** Present only for countable queries that may fall back to enumeration. */
    CountFallback countFallback;

    public static QueryOptions defaults() {
        return QueryOptions.builder().build();
    }
}
