package com.queryhub.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Uniform result envelope returned to every caller surface.
 */
@Value
@Builder
public class ExecutionResult {

    String queryId;
    ExecutionStatus status;
    List<String> columns;
    List<List<Object>> rows;
    int rowCount;
    long executionTimeMs;
    boolean cached;
    int rateLimitRemaining;
    int rateLimitLimit;

    /** Only set for count queries that went through the fallback aggregator. */
    CountSource countSource;
}
