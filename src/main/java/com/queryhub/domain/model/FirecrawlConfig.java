package com.queryhub.domain.model;

import lombok.ToString;
import lombok.Value;

@Value
public class FirecrawlConfig implements IntegrationConfig {

    public static final String NAME = "firecrawl";

    @ToString.Exclude
    String apiKey;

    @Override
    public String getIntegrationName() {
        return NAME;
    }
}
