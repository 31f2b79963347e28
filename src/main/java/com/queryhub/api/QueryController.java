package com.queryhub.api;

import com.queryhub.api.dto.QueryExecuteRequest;
import com.queryhub.api.dto.QueryExecuteResponse;
import com.queryhub.api.dto.TableListResponse;
import com.queryhub.api.web.CallerContext;
import com.queryhub.api.web.CallerResolver;
import com.queryhub.domain.model.PostHogConfig;
import com.queryhub.domain.model.QueryOptions;
import com.queryhub.domain.model.QueryRequest;
import com.queryhub.domain.service.QueryCache;
import com.queryhub.domain.service.QueryOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Query API shared by the dashboard, the embedded agent and MCP clients.
 *
 * Endpoints:
 * - POST /api/v1/query/execute - Run a read-only query
 * - GET /api/v1/tables - List queryable tables
 * - POST /api/v1/query/cache/invalidate-expired - Purge the caller's expired cache entries
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueryController {

    private final QueryOrchestrator orchestrator;
    private final QueryCache queryCache;
    private final CallerResolver callerResolver;

    /**
     * POST /api/v1/query/execute
     *
     * Request body:
     * {
     *   "query": "SELECT ...",
     *   "skip_cache": false,
     *   "session_id": "..."   (agent callers only)
     * }
     */
    @PostMapping("/query/execute")
    public Mono<ResponseEntity<QueryExecuteResponse>> execute(
            @Valid @RequestBody QueryExecuteRequest body,
            HttpServletRequest httpRequest) {

        CallerContext caller = callerResolver.resolve(httpRequest, body.getSessionId());
        log.info("Execute query: workspace={}, caller={}, skipCache={}",
                caller.getWorkspaceId(), caller.getIssuedBy(), body.getSkipCache());

        QueryRequest request = QueryRequest.builder()
                .workspaceId(caller.getWorkspaceId())
                .queryText(body.getQuery())
                .issuedBy(caller.getIssuedBy())
                .timeoutMs(body.getTimeoutMs())
                .build();

        QueryOptions options = QueryOptions.builder()
                .skipCache(Boolean.TRUE.equals(body.getSkipCache()))
                .build();

        return orchestrator.execute(request, options)
                .map(result -> ResponseEntity.ok(QueryExecuteResponse.from(result)));
    }

    /**
     * GET /api/v1/tables?session_id=...
     *
     * Response: { "tables": [ { "table_name": "events", "source_type": "posthog" } ] }
     */
    @GetMapping("/tables")
    public Mono<ResponseEntity<TableListResponse>> listTables(
            @RequestParam(name = "session_id", required = false) String sessionId,
            HttpServletRequest httpRequest) {

        CallerContext caller = callerResolver.resolve(httpRequest, sessionId);
        log.info("List tables: workspace={}, caller={}", caller.getWorkspaceId(), caller.getIssuedBy());

        return orchestrator.listTables(caller.getWorkspaceId(), caller.getIssuedBy(), PostHogConfig.NAME)
                .map(tables -> ResponseEntity.ok(new TableListResponse(tables)));
    }

    @PostMapping("/query/cache/invalidate-expired")
    public ResponseEntity<Map<String, Integer>> invalidateExpired(
            @RequestParam(name = "session_id", required = false) String sessionId,
            HttpServletRequest httpRequest) {

        CallerContext caller = callerResolver.resolve(httpRequest, sessionId);
        int purged = queryCache.invalidateExpired(caller.getWorkspaceId());

        return ResponseEntity.ok(Map.of("purged", purged));
    }
}
