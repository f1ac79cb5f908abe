package com.flagship.property_settlement.property;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA entity for a property under sale.
 *
 * Owns the current sales status. History entries record transitions, but the
 * authoritative current state always lives here.
 *
 * Key design principles:
 * - No @Setter: sales status changes go through {@link #applySalesStatus}
 * - At most one active agent assignment, enforced by {@link #assignAgent}
 * - Soft delete only
 */
@Entity
@Table(
    name = "properties",
    indexes = {
        @Index(name = "idx_properties_slug", columnList = "slug"),
        @Index(name = "idx_properties_owner", columnList = "owner_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PropertyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 200)
    private String slug;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 500)
    private String address;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "sales_status", length = 30)
    private SalesStatus salesStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ListingStatus status;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "contact_email")
    private String contactEmail;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "property_agents", joinColumns = @JoinColumn(name = "property_id"))
    private List<AgentAssignment> agents = new ArrayList<>();

    @Column(name = "settlement_date")
    private LocalDate settlementDate;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "last_modified_by")
    private UUID lastModifiedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates a new listing with no sales status.
     */
    public static PropertyEntity list(UUID id, String slug, String title, String address,
                                      BigDecimal price, UUID ownerId, String contactEmail,
                                      ListingStatus status) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Property price must be zero or positive");
        }
        PropertyEntity entity = new PropertyEntity();
        entity.id = id;
        entity.slug = slug;
        entity.title = title;
        entity.address = address;
        entity.price = price;
        entity.ownerId = ownerId;
        entity.contactEmail = contactEmail;
        entity.status = status;
        return entity;
    }

    /**
     * Assigns an agent as the acting agent, deactivating any previous active assignment.
     */
    public void assignAgent(UUID agentId, AgentRole role, BigDecimal commissionRate) {
        agents.forEach(AgentAssignment::deactivate);
        agents.add(AgentAssignment.active(agentId, role, commissionRate));
    }

    public boolean isActiveAgent(UUID agentId) {
        return agentId != null && agents.stream()
                .anyMatch(a -> a.isActive() && agentId.equals(a.getAgentId()));
    }

    public Optional<AgentAssignment> activeAgent() {
        return agents.stream().filter(AgentAssignment::isActive).findFirst();
    }

    public List<AgentAssignment> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    /**
     * Applies a sales status. Settling also marks the listing SOLD and records the
     * settlement date when one is supplied.
     */
    public void applySalesStatus(SalesStatus newStatus, UUID modifiedBy, LocalDate newSettlementDate) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Sales status cannot be null");
        }
        this.salesStatus = newStatus;
        this.lastModifiedBy = modifiedBy;
        if (newStatus == SalesStatus.SETTLED) {
            this.status = ListingStatus.SOLD;
            if (newSettlementDate != null) {
                this.settlementDate = newSettlementDate;
            }
        }
    }

    public void markDeleted() {
        this.deleted = true;
    }
}
