package com.queryhub.api.web;

import com.queryhub.domain.error.InvalidQueryException;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.service.AgentSessionService;
import com.queryhub.domain.service.MachineTokenService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Works out who is calling and on behalf of which workspace.
 *
 * Checked in order:
 * - X-Agent-Secret: embedded agent; workspace from the agent session
 * - Authorization: Bearer: MCP machine token
 * - X-Workspace-Id: human session, set by the authenticating gateway
 *
 * The workspace header carries no proof of membership. It is only safe when
 * every request passes through the gateway, which authenticates the user,
 * checks the membership and overwrites any client-supplied value. A
 * deployment reachable without that gateway must set
 * {@code app.auth.trust-workspace-header=false}, leaving only the agent
 * secret and machine tokens. The header never overrides the workspace of an
 * agent or machine caller.
 */
@Slf4j
@Component
public class CallerResolver {

    public static final String AGENT_SECRET_HEADER = "X-Agent-Secret";
    public static final String WORKSPACE_HEADER = "X-Workspace-Id";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AgentSessionService agentSessionService;
    private final MachineTokenService machineTokenService;
    private final byte[] agentSecret;
    private final boolean trustWorkspaceHeader;

    public CallerResolver(AgentSessionService agentSessionService,
                          MachineTokenService machineTokenService,
                          @Value("${app.agent.secret:}") String agentSecret,
                          @Value("${app.auth.trust-workspace-header:true}") boolean trustWorkspaceHeader) {
        this.agentSessionService = agentSessionService;
        this.machineTokenService = machineTokenService;
        this.agentSecret = agentSecret.getBytes(StandardCharsets.UTF_8);
        this.trustWorkspaceHeader = trustWorkspaceHeader;
    }

    public CallerContext resolve(HttpServletRequest request, String sessionId) {
        String providedSecret = request.getHeader(AGENT_SECRET_HEADER);
        if (providedSecret != null) {
            if (agentSecret.length == 0
                    || !MessageDigest.isEqual(agentSecret, providedSecret.getBytes(StandardCharsets.UTF_8))) {
                log.warn("Rejected agent call with invalid secret from {}", request.getRemoteAddr());
                throw new CallerAuthenticationException("Invalid agent secret");
            }
            if (sessionId == null || sessionId.isBlank()) {
                throw new InvalidQueryException("session_id is required for agent calls");
            }
            return new CallerContext(agentSessionService.resolveWorkspace(sessionId), IssuedBy.AGENT);
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String workspaceId = machineTokenService
                    .resolveWorkspace(authorization.substring(BEARER_PREFIX.length()))
                    .orElseThrow(() -> new CallerAuthenticationException("Invalid or expired access token"));
            return new CallerContext(workspaceId, IssuedBy.MACHINE);
        }

        String workspaceId = request.getHeader(WORKSPACE_HEADER);
        if (workspaceId != null && !workspaceId.isBlank()) {
            if (!trustWorkspaceHeader) {
                log.warn("Ignored {} header from {}: header trust is disabled", WORKSPACE_HEADER, request.getRemoteAddr());
                throw new CallerAuthenticationException("Authentication required");
            }
            return new CallerContext(workspaceId.trim(), IssuedBy.USER);
        }

        throw new CallerAuthenticationException("Authentication required");
    }
}
