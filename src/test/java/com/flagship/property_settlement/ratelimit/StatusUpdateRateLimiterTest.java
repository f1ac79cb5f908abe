package com.flagship.property_settlement.ratelimit;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.directory.UserRole;
import com.flagship.property_settlement.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusUpdateRateLimiterTest {

    private static final String KEY = StatusUpdateRateLimiter.KEY_PREFIX + "10.0.0.1";
    private static final Duration WINDOW = Duration.ofMinutes(5);

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private StatusUpdateRateLimiter limiter;
    private DirectoryUser agent;

    @BeforeEach
    void setUp() {
        limiter = new StatusUpdateRateLimiter(Optional.of(redisTemplate),
                new SettlementMetrics(new SimpleMeterRegistry()), true, 10, WINDOW);
        agent = new DirectoryUser(UUID.randomUUID(), "Alex Agent", null, UserRole.AGENT, null);
    }

    @Test
    @DisplayName("First request in a window starts the expiry")
    void testFirstRequest_SetsExpiry() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(KEY)).thenReturn(1L);

        limiter.check("10.0.0.1", agent);

        verify(redisTemplate).expire(KEY, WINDOW);
    }

    @Test
    @DisplayName("Tenth request passes, eleventh is rejected with the remaining window")
    void testLimitExceeded() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(KEY)).thenReturn(10L, 11L);
        when(redisTemplate.getExpire(KEY, TimeUnit.SECONDS)).thenReturn(120L);

        limiter.check("10.0.0.1", agent);
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> limiter.check("10.0.0.1", agent));

        assertEquals(Duration.ofSeconds(120), e.getRetryAfter());
        assertEquals("Too many status update attempts. Please wait before making another status update",
                e.getMessage());
    }

    @Test
    @DisplayName("Admins are never counted")
    void testAdminExempt() {
        DirectoryUser admin = new DirectoryUser(UUID.randomUUID(), "Ada Admin", null, UserRole.ADMIN, null);

        limiter.check("10.0.0.1", admin);

        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Redis outage lets the request through")
    void testFailOpen() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertDoesNotThrow(() -> limiter.check("10.0.0.1", agent));
    }

    @Test
    @DisplayName("Disabled limiter and missing Redis both allow everything")
    void testDisabled() {
        StatusUpdateRateLimiter disabled = new StatusUpdateRateLimiter(Optional.of(redisTemplate),
                new SettlementMetrics(new SimpleMeterRegistry()), false, 10, WINDOW);
        StatusUpdateRateLimiter noRedis = new StatusUpdateRateLimiter(Optional.empty(),
                new SettlementMetrics(new SimpleMeterRegistry()), true, 10, WINDOW);

        disabled.check("10.0.0.1", agent);
        noRedis.check("10.0.0.1", agent);

        verify(redisTemplate, never()).opsForValue();
    }
}
