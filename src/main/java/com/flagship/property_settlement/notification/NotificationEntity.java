package com.flagship.property_settlement.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "notifications",
    indexes = {
        @Index(name = "idx_notifications_recipient", columnList = "recipient_id, created_at"),
        @Index(name = "idx_notifications_audience", columnList = "audience, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "recipient_id", updatable = false)
    private UUID recipientId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private NotificationAudience audience;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private NotificationPriority priority;

    @Column(nullable = false, updatable = false, length = 200)
    private String title;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "property_id", updatable = false)
    private UUID propertyId;

    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "data", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String data;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static NotificationEntity create(UUID recipientId, NotificationAudience audience, NotificationType type,
                                     NotificationPriority priority, String title, String message,
                                     UUID propertyId, UUID invoiceId, String dataJson) {
        if (audience == NotificationAudience.USER && recipientId == null) {
            throw new IllegalArgumentException("A user notification needs a recipient");
        }
        NotificationEntity entity = new NotificationEntity();
        entity.id = UUID.randomUUID();
        entity.recipientId = recipientId;
        entity.audience = audience;
        entity.type = type;
        entity.priority = priority;
        entity.title = title;
        entity.message = message;
        entity.propertyId = propertyId;
        entity.invoiceId = invoiceId;
        entity.data = dataJson;
        return entity;
    }

    void markRead(Instant at) {
        if (!read) {
            this.read = true;
            this.readAt = at;
        }
    }

    Notification toDomain() {
        return new Notification(id, recipientId, audience, type, priority, title, message,
                propertyId, invoiceId, data, read, createdAt, readAt);
    }
}
