package com.flagship.property_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled a notification task.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    UUID propertyId;
    String consumerGroup;
    Instant processedAt;
    Result result;
    String note;

    public enum Result {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, UUID propertyId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, propertyId, consumerGroup, Instant.now(), Result.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, UUID propertyId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, propertyId, consumerGroup, Instant.now(), Result.SKIPPED, reason);
    }
}
