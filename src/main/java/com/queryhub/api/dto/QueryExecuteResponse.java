package com.queryhub.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryhub.domain.model.CountSource;
import com.queryhub.domain.model.ExecutionResult;
import com.queryhub.domain.model.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryExecuteResponse {

    private String queryId;
    private ExecutionStatus status;
    private long executionTimeMs;
    private int rowCount;
    private List<String> columns;
    private List<List<Object>> results;
    private boolean cached;
    private RateLimitInfo rateLimit;
    private CountSource countSource;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimitInfo {
        private int remaining;
        private int limit;
    }

    public static QueryExecuteResponse from(ExecutionResult result) {
        return QueryExecuteResponse.builder()
                .queryId(result.getQueryId())
                .status(result.getStatus())
                .executionTimeMs(result.getExecutionTimeMs())
                .rowCount(result.getRowCount())
                .columns(result.getColumns())
                .results(result.getRows())
                .cached(result.isCached())
                .rateLimit(new RateLimitInfo(result.getRateLimitRemaining(), result.getRateLimitLimit()))
                .countSource(result.getCountSource())
                .build();
    }
}
