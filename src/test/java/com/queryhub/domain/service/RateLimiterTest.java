package com.queryhub.domain.service;

import com.queryhub.domain.model.RateLimitDecision;
import com.queryhub.domain.model.RateLimitScope;
import com.queryhub.infrastructure.ratelimit.RateLimitStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateLimiterTest {

    @Mock
    private RateLimitStore store;

    private MeterRegistry meterRegistry;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        rateLimiter = new RateLimiter(store, meterRegistry, 60, 20, 30, 15);
    }

    @Test
    void testAdmit_UsesScopedKeyAndLimit() {
        // Given
        when(store.tryConsume("schema:ws-1", 30, 60_000L, 1))
                .thenReturn(RateLimitDecision.allowed(30, 29, 60_000));

        // When
        RateLimitDecision decision = rateLimiter.admit("ws-1", RateLimitScope.SCHEMA);

        // Then
        assertTrue(decision.isAllowed());
        assertEquals(29, decision.getRemaining());
        assertEquals(0.0, meterRegistry.counter("ratelimit.rejected", "scope", "schema").count());
    }

    @Test
    void testAdmit_RejectionIsCounted() {
        // Given
        when(store.tryConsume("count:ws-1", 15, 60_000L, 1))
                .thenReturn(RateLimitDecision.rejected(15, 12_000));

        // When
        RateLimitDecision decision = rateLimiter.admit("ws-1", RateLimitScope.COUNT);

        // Then
        assertFalse(decision.isAllowed());
        assertEquals(12_000, decision.getRetryAfterMs());
        assertEquals(1.0, meterRegistry.counter("ratelimit.rejected", "scope", "count").count());
    }

    @Test
    void testAdmit_RejectsNonPositiveCost() {
        assertThrows(IllegalArgumentException.class,
                () -> rateLimiter.admit("ws-1", RateLimitScope.QUERY, 0));
        verifyNoInteractions(store);
    }

    @Test
    void testLimitFor_EachScope() {
        assertEquals(20, rateLimiter.limitFor(RateLimitScope.QUERY));
        assertEquals(30, rateLimiter.limitFor(RateLimitScope.SCHEMA));
        assertEquals(15, rateLimiter.limitFor(RateLimitScope.COUNT));
        assertEquals(60_000, rateLimiter.getWindowMs());
    }

    @Test
    void testRejectedDecision_RetryAfterIsAtLeastOneMillisecond() {
        RateLimitDecision decision = RateLimitDecision.rejected(20, 0);

        assertEquals(1, decision.getRetryAfterMs());
        assertEquals(0, decision.getRemaining());
    }
}
