package com.queryhub.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single query issued on behalf of a workspace. Never persisted as-is.
 */
@Value
@Builder
public class QueryRequest {

    String workspaceId;
    String queryText;
    IssuedBy issuedBy;

    /** Executor deadline; {@code null} means the configured default. */
    Long timeoutMs;
}
