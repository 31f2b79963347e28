package com.queryhub.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Tabular result returned by the analytics engine.
 */
@Value
@Builder
public class QueryResultSet {

    List<String> columns;
    List<List<Object>> rows;
    int rowCount;
    long executionTimeMs;

    @Builder.Default
    ExecutionStatus status = ExecutionStatus.COMPLETED;

    /** Set when the result was produced by a count with fallback. */
    CountSource countSource;
}
