package com.flagship.property_settlement.history;

import com.flagship.property_settlement.property.SalesStatus;
import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit entry for one sales status transition.
 *
 * The facts of the transition (property, statuses, actor, reason, request metadata,
 * settlement details) are written once and mapped {@code updatable = false}.
 * Only the outcome side (invoices, notifications, processing status, error log)
 * changes after insert, and the error log only ever grows.
 */
@Entity
@Table(
    name = "property_status_history",
    indexes = {
        @Index(name = "idx_history_property_created", columnList = "property_id, created_at"),
        @Index(name = "idx_history_changed_by_created", columnList = "changed_by, created_at"),
        @Index(name = "idx_history_processing_status", columnList = "processing_status, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PropertyStatusHistoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "property_id", nullable = false, updatable = false)
    private UUID propertyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", updatable = false, length = 30)
    private SalesStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, updatable = false, length = 30)
    private SalesStatus newStatus;

    @Column(name = "changed_by", nullable = false, updatable = false)
    private UUID changedBy;

    @Column(name = "change_reason", nullable = false, updatable = false, length = 500)
    private String changeReason;

    @Embedded
    private RequestMetadata metadata;

    @Column(name = "settlement_details", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String settlementDetails;

    @Column(name = "requested_seller_id", updatable = false)
    private UUID requestedSellerId;

    @Column(name = "requested_buyer_id", updatable = false)
    private UUID requestedBuyerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "generated", column = @Column(name = "invoice_generated")),
        @AttributeOverride(name = "invoiceId", column = @Column(name = "invoice_id")),
        @AttributeOverride(name = "invoiceNumber", column = @Column(name = "invoice_number", length = 30)),
        @AttributeOverride(name = "generatedAt", column = @Column(name = "invoice_generated_at")),
        @AttributeOverride(name = "amount", column = @Column(name = "invoice_amount", precision = 19, scale = 2)),
        @AttributeOverride(name = "status", column = @Column(name = "invoice_status", length = 20)),
        @AttributeOverride(name = "alreadyExisted", column = @Column(name = "invoice_already_existed"))
    })
    private InvoiceOutcome invoice;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "generated", column = @Column(name = "buyer_invoice_generated")),
        @AttributeOverride(name = "invoiceId", column = @Column(name = "buyer_invoice_id")),
        @AttributeOverride(name = "invoiceNumber", column = @Column(name = "buyer_invoice_number", length = 30)),
        @AttributeOverride(name = "generatedAt", column = @Column(name = "buyer_invoice_generated_at")),
        @AttributeOverride(name = "amount", column = @Column(name = "buyer_invoice_amount", precision = 19, scale = 2)),
        @AttributeOverride(name = "status", column = @Column(name = "buyer_invoice_status", length = 20)),
        @AttributeOverride(name = "alreadyExisted", column = @Column(name = "buyer_invoice_already_existed"))
    })
    private InvoiceOutcome buyerInvoice;

    @ElementCollection
    @CollectionTable(name = "status_history_notifications", joinColumns = @JoinColumn(name = "history_id"))
    @OrderColumn(name = "delivery_index")
    private List<NotificationDelivery> notifications = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 20)
    private ProcessingStatus processingStatus;

    @ElementCollection
    @CollectionTable(name = "status_history_errors", joinColumns = @JoinColumn(name = "history_id"))
    @OrderColumn(name = "error_index")
    private List<HistoryError> errorLog = new ArrayList<>();

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

    static PropertyStatusHistoryEntity processing(TransitionRecord record, String settlementDetailsJson) {
        PropertyStatusHistoryEntity entity = new PropertyStatusHistoryEntity();
        entity.id = UUID.randomUUID();
        entity.propertyId = record.getPropertyId();
        entity.previousStatus = record.getPreviousStatus();
        entity.newStatus = record.getNewStatus();
        entity.changedBy = record.getChangedBy();
        entity.changeReason = record.getChangeReason() == null ? "" : record.getChangeReason();
        entity.metadata = record.getMetadata();
        entity.settlementDetails = settlementDetailsJson;
        entity.requestedSellerId = record.getRequestedSellerId();
        entity.requestedBuyerId = record.getRequestedBuyerId();
        entity.processingStatus = ProcessingStatus.PROCESSING;
        return entity;
    }

    void attachInvoice(InvoiceOutcome outcome) {
        this.invoice = outcome;
    }

    void attachBuyerInvoice(InvoiceOutcome outcome) {
        this.buyerInvoice = outcome;
    }

    void appendError(String error, Instant at) {
        errorLog.add(new HistoryError(error, at, false));
    }

    void addNotification(NotificationDelivery delivery) {
        notifications.add(delivery);
    }

    /**
     * COMPLETED unless the entry already FAILED; a failure is never overwritten.
     */
    void markProcessed() {
        if (processingStatus != ProcessingStatus.FAILED) {
            this.processingStatus = ProcessingStatus.COMPLETED;
        }
    }

    void markFailed(String error, Instant at) {
        this.processingStatus = ProcessingStatus.FAILED;
        appendError(error, at);
    }
}
