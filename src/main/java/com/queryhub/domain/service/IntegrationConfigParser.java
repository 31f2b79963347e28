package com.queryhub.domain.service;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.FirecrawlConfig;
import com.queryhub.domain.model.IntegrationConfig;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.PostHogConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a raw integration settings payload into one of the known config variants.
 */
@Component
public class IntegrationConfigParser {

    private static final Set<String> REGIONS = Set.of("us", "eu");

    public IntegrationConfig parse(String integrationName, Map<String, Object> payload) {
        if (integrationName == null) {
            throw new ConfigurationException("Integration name is required");
        }
        Map<String, Object> raw = payload == null ? Map.of() : payload;

        return switch (integrationName.toLowerCase(Locale.ROOT)) {
            case PostHogConfig.NAME -> parsePostHog(raw);
            case FirecrawlConfig.NAME -> new FirecrawlConfig(required(raw, "api_key"));
            default -> throw new ConfigurationException("Unsupported integration: " + integrationName);
        };
    }

    private PostHogConfig parsePostHog(Map<String, Object> raw) {
        String apiKey = required(raw, "api_key");
        String projectId = required(raw, "project_id");

        IntegrationMode mode;
        try {
            mode = IntegrationMode.fromValue(optional(raw, "mode"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("mode must be 'cloud' or 'self_hosted'");
        }

        if (mode == IntegrationMode.SELF_HOSTED) {
            String host = required(raw, "host");
            if (!host.startsWith("https://") && !host.startsWith("http://")) {
                throw new ConfigurationException("host must be an http(s) URL");
            }
            return PostHogConfig.builder()
                    .apiKey(apiKey)
                    .projectId(projectId)
                    .mode(mode)
                    .host(host)
                    .build();
        }

        String region = optional(raw, "region");
        region = region == null ? "us" : region.toLowerCase(Locale.ROOT);
        if (!REGIONS.contains(region)) {
            throw new ConfigurationException("region must be 'us' or 'eu'");
        }
        return PostHogConfig.builder()
                .apiKey(apiKey)
                .projectId(projectId)
                .mode(mode)
                .region(region)
                .build();
    }

    private static String required(Map<String, Object> raw, String field) {
        String value = optional(raw, field);
        if (value == null) {
            throw new ConfigurationException(field + " is required");
        }
        return value;
    }

    private static String optional(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
