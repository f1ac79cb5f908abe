package com.flagship.property_settlement.ratelimit;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window limit on status update requests per client IP, kept in Redis.
 *
 * Admins are exempt. When Redis is missing or unreachable the limiter lets the
 * request through and logs a warning: rate limiting protects against spam, it
 * is not a correctness guarantee.
 */
@Component
@Slf4j
public class StatusUpdateRateLimiter {

    static final String KEY_PREFIX = "rate-limit:status-update:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final SettlementMetrics metrics;
    private final boolean enabled;
    private final int maxRequests;
    private final Duration window;

    public StatusUpdateRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                                   SettlementMetrics metrics,
                                   @Value("${sales.rate-limit.enabled:true}") boolean enabled,
                                   @Value("${sales.rate-limit.max-requests:10}") int maxRequests,
                                   @Value("${sales.rate-limit.window:PT5M}") Duration window) {
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.enabled = enabled;
        this.maxRequests = maxRequests;
        this.window = window;
    }

    /**
     * Counts one request from {@code clientIp}.
     *
     * @throws RateLimitExceededException when the window's budget is used up
     */
    public void check(String clientIp, DirectoryUser caller) {
        if (!enabled || caller.isAdmin() || redisTemplate.isEmpty()) {
            return;
        }
        StringRedisTemplate redis = redisTemplate.get();
        String key = KEY_PREFIX + (clientIp == null ? "unknown" : clientIp);

        long count;
        Duration retryAfter;
        try {
            Long incremented = redis.opsForValue().increment(key);
            count = incremented == null ? 0 : incremented;
            if (count == 1) {
                redis.expire(key, window);
            }
            if (count <= maxRequests) {
                return;
            }
            Long ttlSeconds = redis.getExpire(key, TimeUnit.SECONDS);
            retryAfter = ttlSeconds != null && ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : window;
        } catch (RuntimeException e) {
            log.warn("Rate limiter unavailable, allowing status update from {}: {}", clientIp, e.getMessage());
            return;
        }

        metrics.incrementRateLimited();
        log.warn("Status update rate limit exceeded for {} ({} requests in {})", clientIp, count, window);
        throw new RateLimitExceededException(
            "Too many status update attempts. Please wait before making another status update", retryAfter);
    }
}
