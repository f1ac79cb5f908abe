package com.flagship.property_settlement.property;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable read view of a property, safe to pass outside a transaction.
 */
@Value
public class PropertySnapshot {
    UUID id;
    String slug;
    String title;
    BigDecimal price;
    SalesStatus salesStatus;
    ListingStatus status;
    UUID ownerId;
    String contactEmail;
    UUID activeAgentId;
    LocalDate settlementDate;
    boolean deleted;
    Instant updatedAt;

    public static PropertySnapshot of(PropertyEntity entity) {
        return new PropertySnapshot(
            entity.getId(),
            entity.getSlug(),
            entity.getTitle(),
            entity.getPrice(),
            entity.getSalesStatus(),
            entity.getStatus(),
            entity.getOwnerId(),
            entity.getContactEmail(),
            entity.activeAgent().map(AgentAssignment::getAgentId).orElse(null),
            entity.getSettlementDate(),
            entity.isDeleted(),
            entity.getUpdatedAt()
        );
    }

    /**
     * Last six characters of the id, used as the bank transfer reference suffix.
     */
    public String shortReference() {
        String raw = id.toString().replace("-", "");
        return raw.substring(raw.length() - 6);
    }
}
