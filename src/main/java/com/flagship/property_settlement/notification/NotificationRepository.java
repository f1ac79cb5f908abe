package com.flagship.property_settlement.notification;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, UUID> {

    List<NotificationEntity> findByRecipientIdOrderByCreatedAtDesc(UUID recipientId, Pageable pageable);

    List<NotificationEntity> findByAudienceOrderByCreatedAtDesc(NotificationAudience audience, Pageable pageable);

    List<NotificationEntity> findByPropertyIdOrderByCreatedAtDesc(UUID propertyId);

    long countByRecipientIdAndReadFalse(UUID recipientId);
}
