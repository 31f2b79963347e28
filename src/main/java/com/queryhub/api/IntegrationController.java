package com.queryhub.api;

import com.queryhub.api.dto.IntegrationResponse;
import com.queryhub.api.web.CallerAuthenticationException;
import com.queryhub.api.web.CallerContext;
import com.queryhub.api.web.CallerResolver;
import com.queryhub.domain.model.IntegrationConfig;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.service.CredentialStore;
import com.queryhub.domain.service.IntegrationConfigParser;
import com.queryhub.infrastructure.persistence.entity.IntegrationCredentialEntity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;

/**
 * Integration settings of the caller's workspace. User sessions only.
 *
 * Endpoints:
 * - PUT /api/v1/integrations/{name} - Connect or update an integration
 * - DELETE /api/v1/integrations/{name} - Disconnect an integration
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/integrations")
@RequiredArgsConstructor
public class IntegrationController {

    private final CredentialStore credentialStore;
    private final IntegrationConfigParser configParser;
    private final CallerResolver callerResolver;

    /**
     * PUT /api/v1/integrations/posthog
     *
     * Request body:
     * {
     *   "api_key": "phx_...",
     *   "project_id": "12345",
     *   "mode": "cloud",
     *   "region": "us"
     * }
     */
    @PutMapping("/{name}")
    public ResponseEntity<IntegrationResponse> configure(
            @PathVariable String name,
            @RequestBody Map<String, Object> payload,
            HttpServletRequest httpRequest) {

        CallerContext caller = requireUser(httpRequest);
        IntegrationConfig config = configParser.parse(name, payload);

        log.info("Configure integration: workspace={}, integration={}", caller.getWorkspaceId(), config.getIntegrationName());

        IntegrationCredentialEntity saved = credentialStore.configure(caller.access(), config);
        return ResponseEntity.ok(IntegrationResponse.from(saved, config.getApiKey()));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> disconnect(@PathVariable String name, HttpServletRequest httpRequest) {
        CallerContext caller = requireUser(httpRequest);

        log.info("Disconnect integration: workspace={}, integration={}", caller.getWorkspaceId(), name);

        credentialStore.disconnect(caller.access(), name.toLowerCase(Locale.ROOT));
        return ResponseEntity.noContent().build();
    }

    private CallerContext requireUser(HttpServletRequest httpRequest) {
        CallerContext caller = callerResolver.resolve(httpRequest, null);
        if (caller.getIssuedBy() != IssuedBy.USER) {
            throw new CallerAuthenticationException("Integration settings require a user session");
        }
        return caller;
    }
}
