package com.flagship.property_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification task waiting in the outbox.
 *
 * Written in the same transaction as the history entry it belongs to and
 * delivered to Kafka later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Property"
    UUID aggregateId;          // property id, used as the Kafka key
    String eventType;          // e.g. "StatusChanged"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until delivered
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
