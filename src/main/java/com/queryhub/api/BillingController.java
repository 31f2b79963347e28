package com.queryhub.api;

import com.queryhub.api.web.CallerContext;
import com.queryhub.api.web.CallerResolver;
import com.queryhub.domain.model.MtuResult;
import com.queryhub.domain.service.MtuService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
public class BillingController {

    private final MtuService mtuService;
    private final CallerResolver callerResolver;

    /**
     * POST /api/v1/billing/mtu?skip_cache=false
     *
     * Response: { "workspace_id", "mtu_count", "source", "tracked_date",
     *            "billing_cycle_start", "billing_cycle_end", "cached" }
     */
    @PostMapping("/mtu")
    public Mono<ResponseEntity<MtuResult>> calculateMtu(
            @RequestParam(name = "skip_cache", defaultValue = "false") boolean skipCache,
            @RequestParam(name = "session_id", required = false) String sessionId,
            HttpServletRequest httpRequest) {

        CallerContext caller = callerResolver.resolve(httpRequest, sessionId);
        log.info("Calculate MTU: workspace={}, skipCache={}", caller.getWorkspaceId(), skipCache);

        return mtuService.calculate(caller.getWorkspaceId(), caller.getIssuedBy(), skipCache)
                .map(ResponseEntity::ok);
    }
}
