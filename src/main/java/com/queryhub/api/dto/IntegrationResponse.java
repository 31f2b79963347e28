package com.queryhub.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.WorkspaceCredential;
import com.queryhub.infrastructure.persistence.entity.IntegrationCredentialEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Integration settings as shown to users. The API key is always masked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntegrationResponse {

    private String integrationName;
    private String status;
    @JsonProperty("is_active")
    private boolean active;
    private String mode;
    private String projectId;
    private String region;
    private String host;
    private String apiKey;

    public static IntegrationResponse from(IntegrationCredentialEntity row, String plainApiKey) {
        IntegrationMode mode = row.getMode();
        return IntegrationResponse.builder()
                .integrationName(row.getIntegrationName())
                .status(row.getStatus().name().toLowerCase(Locale.ROOT))
                .active(row.isActive())
                .mode(mode == null ? null : mode.name().toLowerCase(Locale.ROOT))
                .projectId(row.getProjectId())
                .region(row.getRegion())
                .host(row.getHost())
                .apiKey(WorkspaceCredential.mask(plainApiKey))
                .build();
    }
}
