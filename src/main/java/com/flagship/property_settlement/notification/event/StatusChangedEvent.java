package com.flagship.property_settlement.notification.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusChangedEvent implements NotificationEvent {

    public static final String EVENT_TYPE = "StatusChanged";

    UUID eventId;
    UUID historyId;
    UUID propertyId;
    String propertyTitle;
    UUID ownerId;
    String contactEmail;
    SalesStatus previousStatus;
    SalesStatus newStatus;
    UUID changedBy;
    String changedByName;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
