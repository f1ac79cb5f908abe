package com.flagship.property_settlement.notification.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification task carried through the outbox and the notifications topic.
 *
 * Every task names the history entry that caused it, so delivery outcomes can
 * be appended to that entry.
 */
public interface NotificationEvent {

    /**
     * Unique per task. Consumers deduplicate on it.
     */
    UUID getEventId();

    String getEventType();

    UUID getPropertyId();

    UUID getHistoryId();

    String getCorrelationId();

    Instant getOccurredAt();
}
