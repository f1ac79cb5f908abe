package com.flagship.property_settlement.paymentrecord;

import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Reconciliation snapshot of what a seller is expected to pay against a commission
 * invoice. The invoice columns are copied at snapshot time and never updated.
 */
@Entity
@Table(
    name = "payment_records",
    indexes = {
        @Index(name = "idx_payment_records_status", columnList = "status, created_at"),
        @Index(name = "idx_payment_records_seller", columnList = "seller_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, unique = true, updatable = false)
    private UUID invoiceId;

    @Column(name = "property_id", nullable = false, updatable = false)
    private UUID propertyId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private UUID agentId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentRecordStatus status;

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 30)
    private String invoiceNumber;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "gst_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal gstAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "initiated_at")
    private Instant initiatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

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

    static PaymentRecordEntity snapshotOf(Invoice invoice) {
        if (invoice.getSellerId() == null) {
            throw new IllegalArgumentException("Payment records are only kept for seller invoices");
        }
        PaymentRecordEntity entity = new PaymentRecordEntity();
        entity.id = UUID.randomUUID();
        entity.invoiceId = invoice.getId();
        entity.propertyId = invoice.getPropertyId();
        entity.sellerId = invoice.getSellerId();
        entity.agentId = invoice.getAgentId();
        entity.amount = invoice.getTotalAmount();
        entity.currency = invoice.getCurrency();
        entity.status = PaymentRecordStatus.PENDING;
        if (invoice.getStatus() == InvoiceStatus.PAID) {
            entity.status = PaymentRecordStatus.COMPLETED;
            entity.completedAt = invoice.getUpdatedAt() != null ? invoice.getUpdatedAt() : Instant.now();
        }
        entity.invoiceNumber = invoice.getInvoiceNumber();
        entity.commissionAmount = invoice.getCommissionAmount();
        entity.gstAmount = invoice.getGstAmount();
        entity.totalAmount = invoice.getTotalAmount();
        entity.dueDate = invoice.getDueDate();
        return entity;
    }

    /**
     * @throws IllegalStateException if the record cannot move from its current status to {@code target}
     */
    void transitionTo(PaymentRecordStatus target, String reason, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Payment record %s cannot move from %s to %s", id, status, target));
        }
        switch (target) {
            case PROCESSING -> {
                if (initiatedAt == null) {
                    initiatedAt = at;
                }
            }
            case COMPLETED -> completedAt = at;
            case FAILED -> {
                failedAt = at;
                failureReason = reason;
            }
        }
        this.status = target;
    }

    PaymentRecord toDomain() {
        return new PaymentRecord(id, invoiceId, propertyId, sellerId, agentId, amount, currency, status,
                invoiceNumber, commissionAmount, gstAmount, totalAmount, dueDate,
                initiatedAt, completedAt, failedAt, failureReason, createdAt);
    }
}
