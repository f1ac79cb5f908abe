package com.flagship.property_settlement.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the sales-status and invoicing workflow.
 *
 * Metrics exposed:
 * - sales.transition: counter tagged by target status and outcome
 * - sales.transition.duration: timer over the whole request-path orchestration
 * - invoice.created / invoice.idempotent_hit / invoice.generation.failed: tagged by category
 * - notification.dispatched: tagged by notification type and delivery result
 * - sales.rate_limited: rejected status update requests
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Timer transitionTimer;
    private final Counter rateLimited;
    private final Counter recoveredTransitions;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transitionTimer = Timer.builder("sales.transition.duration")
                .description("Time taken to apply a sales status transition")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.rateLimited = Counter.builder("sales.rate_limited")
                .description("Status update requests rejected by the rate limiter")
                .register(registry);

        this.recoveredTransitions = Counter.builder("sales.transition.recovered")
                .description("Transitions resumed by the stalled-transition recovery job")
                .register(registry);
    }

    public void recordTransition(String newStatus, String outcome) {
        registry.counter("sales.transition",
                "status", sanitizeTag(newStatus),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransitionDuration(Duration duration) {
        transitionTimer.record(duration);
    }

    public void recordInvoiceCreated(String category) {
        registry.counter("invoice.created", "category", sanitizeTag(category)).increment();
    }

    public void recordInvoiceIdempotentHit(String category) {
        registry.counter("invoice.idempotent_hit", "category", sanitizeTag(category)).increment();
    }

    public void recordInvoiceGenerationFailed(String category) {
        registry.counter("invoice.generation.failed", "category", sanitizeTag(category)).increment();
    }

    public void recordNotificationDispatched(String type, String result) {
        registry.counter("notification.dispatched",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void incrementRateLimited() {
        rateLimited.increment();
    }

    public void incrementRecoveredTransitions() {
        recoveredTransitions.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
