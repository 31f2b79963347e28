package com.queryhub.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class CachedResult {

    String workspaceId;
    String queryHash;
    String queryId;
    List<String> columns;
    List<List<Object>> rows;
    int rowCount;
    Instant cachedAt;

    /** {@code null} means the entry never expires. */
    Instant expiresAt;

    public boolean isLive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
