package com.flagship.property_settlement.notification.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class InvoiceGenerationFailedEvent implements NotificationEvent {

    public static final String EVENT_TYPE = "InvoiceGenerationFailed";

    UUID eventId;
    UUID historyId;
    UUID propertyId;
    String propertyTitle;
    UUID actorId;
    String actorName;
    String error;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
