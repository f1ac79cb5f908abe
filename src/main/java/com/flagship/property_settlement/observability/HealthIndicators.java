package com.flagship.property_settlement.observability;

import com.flagship.property_settlement.history.ProcessingStatus;
import com.flagship.property_settlement.history.StatusHistoryRepository;
import com.flagship.property_settlement.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Actuator health indicators for the settlement workflow.
 */
public class HealthIndicators {

    /**
     * DOWN when undelivered notification tasks pile up.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * WARNING when transitions sit in PROCESSING past the recovery threshold,
     * which means the recovery job is disabled or failing.
     */
    @Component("transitionHealth")
    public static class StalledTransitionHealthIndicator implements HealthIndicator {

        private final StatusHistoryRepository historyRepository;
        private final Duration staleAfter;

        public StalledTransitionHealthIndicator(StatusHistoryRepository historyRepository,
                                                @Value("${sales.recovery.stale-after:PT10M}") Duration staleAfter) {
            this.historyRepository = historyRepository;
            this.staleAfter = staleAfter;
        }

        @Override
        public Health health() {
            try {
                Instant cutoff = Instant.now().minus(staleAfter.multipliedBy(3));
                long stalled = historyRepository.countByProcessingStatusAndCreatedAtBefore(
                        ProcessingStatus.PROCESSING, cutoff);
                long failed = historyRepository.countByProcessingStatus(ProcessingStatus.FAILED);

                Health.Builder builder = stalled == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("stalledTransitions", stalled)
                        .withDetail("failedTransitions", failed)
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * DEGRADED rather than DOWN: the status-update rate limiter fails open
     * when Redis is unreachable.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return degraded("Unexpected ping response: " + result);
                }
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Status update rate limiting is disabled while Redis is unavailable")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
