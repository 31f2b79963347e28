package com.queryhub.domain.service;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.FirecrawlConfig;
import com.queryhub.domain.model.IntegrationConfig;
import com.queryhub.domain.model.IntegrationMode;
import com.queryhub.domain.model.PostHogConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationConfigParserTest {

    private final IntegrationConfigParser parser = new IntegrationConfigParser();

    @Test
    void testParse_PostHogCloudDefaultsToUs() {
        // When
        IntegrationConfig config = parser.parse("posthog", Map.of("api_key", "phx_1", "project_id", 1234));

        // Then
        PostHogConfig posthog = assertInstanceOf(PostHogConfig.class, config);
        assertEquals("1234", posthog.getProjectId());
        assertEquals(IntegrationMode.CLOUD, posthog.getMode());
        assertEquals("us", posthog.getRegion());
        assertFalse(posthog.toString().contains("phx_1"));
    }

    @Test
    void testParse_PostHogSelfHosted() {
        // When
        PostHogConfig config = (PostHogConfig) parser.parse("posthog", Map.of(
                "api_key", "phx_1",
                "project_id", "7",
                "mode", "self_hosted",
                "host", "https://ph.example.org"));

        // Then
        assertEquals(IntegrationMode.SELF_HOSTED, config.getMode());
        assertEquals("https://ph.example.org", config.getHost());
    }

    @Test
    void testParse_PostHogValidation() {
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("project_id", "7")));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("api_key", "phx_1")));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("api_key", "phx_1", "project_id", "7", "mode", "hybrid")));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("api_key", "phx_1", "project_id", "7", "mode", "self_hosted")));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("api_key", "phx_1", "project_id", "7",
                        "mode", "self_hosted", "host", "ftp://ph.example.org")));
        assertThrows(ConfigurationException.class,
                () -> parser.parse("posthog", Map.of("api_key", "phx_1", "project_id", "7", "region", "apac")));
    }

    @Test
    void testParse_Firecrawl() {
        IntegrationConfig config = parser.parse("firecrawl", Map.of("api_key", "fc-1"));

        assertInstanceOf(FirecrawlConfig.class, config);
        assertEquals("firecrawl", config.getIntegrationName());
    }

    @Test
    void testParse_UnknownIntegration() {
        assertThrows(ConfigurationException.class, () -> parser.parse("mixpanel", Map.of("api_key", "x")));
    }
}
