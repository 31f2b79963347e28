package com.queryhub.infrastructure.ratelimit;

import com.queryhub.domain.model.RateLimitDecision;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * Rate-limit windows shared by every replica through Redis.
 *
 * A Lua script performs check-and-increment atomically. When Redis is
 * unavailable the store fails open: the remote engine still protects itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ratelimit.store", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    static final String KEY_PREFIX = "ratelimit:";

    // Returns "allowed:count:pttl"
    private static final String LUA_SCRIPT = """
        local key = KEYS[1]
        local limit = tonumber(ARGV[1])
        local window = tonumber(ARGV[2])
        local cost = tonumber(ARGV[3])

        local count = tonumber(redis.call('GET', key)) or 0
        local ttl = redis.call('PTTL', key)
        if ttl < 0 then
            count = 0
            ttl = window
        end

        if count + cost > limit then
            return string.format('%d:%d:%d', 0, count, ttl)
        end

        count = redis.call('INCRBY', key, cost)
        if count == cost then
            redis.call('PEXPIRE', key, window)
            ttl = window
        end
        return string.format('%d:%d:%d', 1, count, ttl)
    """;

    static final RedisScript<String> SCRIPT = RedisScript.of(LUA_SCRIPT, String.class);

    private final StringRedisTemplate redis;

    @Override
    @CircuitBreaker(name = "rateLimitStore", fallbackMethod = "tryConsumeFallback")
    public RateLimitDecision tryConsume(String key, int limit, long windowMs, int cost) {
        String result = redis.execute(
                SCRIPT,
                Collections.singletonList(KEY_PREFIX + key),
                String.valueOf(limit),
                String.valueOf(windowMs),
                String.valueOf(cost));

        String[] parts = result == null ? new String[0] : result.split(":");
        if (parts.length != 3) {
            throw new IllegalStateException("Unexpected rate-limit script result: " + result);
        }

        boolean allowed = "1".equals(parts[0]);
        long count = Long.parseLong(parts[1]);
        long ttl = Long.parseLong(parts[2]);

        if (!allowed) {
            return RateLimitDecision.rejected(limit, ttl);
        }
        return RateLimitDecision.allowed(limit, (int) Math.max(0, limit - count), ttl);
    }

    private RateLimitDecision tryConsumeFallback(String key, int limit, long windowMs, int cost, Exception e) {
        log.warn("Rate-limit store unavailable, admitting request for key {}: {}", key, e.getMessage());
        return RateLimitDecision.allowed(limit, limit, windowMs);
    }
}
