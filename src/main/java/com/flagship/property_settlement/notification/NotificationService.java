package com.flagship.property_settlement.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_settlement.directory.DirectoryUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-app notifications: per-user inbox plus the shared admin alert feed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final int INBOX_LIMIT = 100;

    private final NotificationRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public Notification createForUser(UUID recipientId, NotificationType type, NotificationPriority priority,
                                      String title, String message, UUID propertyId, UUID invoiceId,
                                      Map<String, Object> data) {
        NotificationEntity entity = NotificationEntity.create(recipientId, NotificationAudience.USER, type,
                priority, title, message, propertyId, invoiceId, toJson(data));
        Notification saved = repository.save(entity).toDomain();
        log.debug("Created {} notification {} for user {}", type, saved.getId(), recipientId);
        return saved;
    }

    @Transactional
    public Notification createAdminAlert(NotificationType type, NotificationPriority priority,
                                         String title, String message, UUID propertyId,
                                         Map<String, Object> data) {
        NotificationEntity entity = NotificationEntity.create(null, NotificationAudience.ADMIN, type,
                priority, title, message, propertyId, null, toJson(data));
        Notification saved = repository.save(entity).toDomain();
        log.info("Admin alert raised: {} ({}) for property {}", title, priority, propertyId);
        return saved;
    }

    /**
     * The caller's own notifications, newest first. Admins also see the admin feed.
     */
    @Transactional(readOnly = true)
    public List<Notification> listFor(DirectoryUser caller) {
        PageRequest page = PageRequest.of(0, INBOX_LIMIT);
        List<Notification> result = new ArrayList<>();
        repository.findByRecipientIdOrderByCreatedAtDesc(caller.getId(), page)
                .forEach(n -> result.add(n.toDomain()));
        if (caller.isAdmin()) {
            repository.findByAudienceOrderByCreatedAtDesc(NotificationAudience.ADMIN, page)
                    .forEach(n -> result.add(n.toDomain()));
            result.sort(Comparator.comparing(Notification::getCreatedAt).reversed());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<Notification> listForProperty(UUID propertyId) {
        return repository.findByPropertyIdOrderByCreatedAtDesc(propertyId).stream()
                .map(NotificationEntity::toDomain)
                .toList();
    }

    @Transactional
    public Notification markRead(UUID notificationId, DirectoryUser caller) {
        NotificationEntity entity = repository.findById(notificationId)
                .filter(n -> visibleTo(n, caller))
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        entity.markRead(Instant.now(clock));
        return repository.save(entity).toDomain();
    }

    private static boolean visibleTo(NotificationEntity notification, DirectoryUser caller) {
        if (notification.getAudience() == NotificationAudience.ADMIN) {
            return caller.isAdmin();
        }
        return caller.getId().equals(notification.getRecipientId());
    }

    private String toJson(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification data", e);
        }
    }
}
