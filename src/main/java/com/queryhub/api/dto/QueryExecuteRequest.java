package com.queryhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryExecuteRequest {

    @NotBlank(message = "query is required")
    private String query;

    private Boolean skipCache;

    /** Required for agent callers. */
    private String sessionId;

    /** Optional per-request deadline, capped by the server default. */
    private Long timeoutMs;
}
