package com.flagship.property_settlement.notification;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Notification {
    UUID id;
    UUID recipientId;
    NotificationAudience audience;
    NotificationType type;
    NotificationPriority priority;
    String title;
    String message;
    UUID propertyId;
    UUID invoiceId;
    @JsonRawValue
    String data;
    boolean read;
    Instant createdAt;
    Instant readAt;
}
