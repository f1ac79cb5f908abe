package com.flagship.property_settlement.invoice;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for invoices.
 *
 * Key design principles:
 * - No @Setter: status changes go through the lifecycle methods below
 * - Amounts (commission, tax, totals) are fixed at issue time and never updated
 * - Payments are append-only; {@link #recordPayment} derives the status from them
 * - Never hard-deleted; cancelled invoices keep their number
 *
 * At most one non-cancelled invoice exists per (property, counterparty, category).
 * The partial unique index {@code ux_invoices_active_key} enforces this in the database.
 */
@Entity
@Table(
    name = "invoices",
    indexes = {
        @Index(name = "idx_invoices_property", columnList = "property_id"),
        @Index(name = "idx_invoices_status_due", columnList = "status, due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, unique = true, updatable = false, length = 30)
    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private InvoiceCategory category;

    @Column(name = "property_id", nullable = false, updatable = false)
    private UUID propertyId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private UUID agentId;

    @Column(name = "seller_id", updatable = false)
    private UUID sellerId;

    @Column(name = "buyer_id", updatable = false)
    private UUID buyerId;

    @Column(name = "counterparty_id", nullable = false, updatable = false)
    private UUID counterpartyId;

    @Column(name = "invoice_date", nullable = false, updatable = false)
    private LocalDate invoiceDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "settlement_date", nullable = false)
    private LocalDate settlementDate;

    @Column(name = "property_value", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal propertyValue;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @ElementCollection
    @CollectionTable(name = "invoice_line_items", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "line_index")
    private List<InvoiceLineItem> lineItems = new ArrayList<>();

    @Column(name = "gst_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal gstRate;

    @Column(name = "gst_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal gstAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "total_tax", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalTax;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "payment_terms", nullable = false, length = 30)
    private String paymentTerms;

    @Column(name = "payment_reference", length = 30)
    private String paymentReference;

    @Column(name = "payee_account_name")
    private String payeeAccountName;

    @Column(name = "payee_account_number", length = 64)
    private String payeeAccountNumber;

    @Column(name = "public_notes", length = 1000)
    private String publicNotes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status;

    @ElementCollection
    @CollectionTable(name = "invoice_payments", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "payment_index")
    private List<InvoicePayment> payments = new ArrayList<>();

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "viewed_at")
    private Instant viewedAt;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

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
     * Creates a PENDING invoice from a fully computed draft.
     * Totals are derived from the line items and GST so they can never disagree.
     */
    static InvoiceEntity issue(InvoiceDraft draft, String invoiceNumber) {
        InvoiceEntity entity = new InvoiceEntity();
        entity.id = UUID.randomUUID();
        entity.invoiceNumber = invoiceNumber;
        entity.category = draft.getCategory();
        entity.propertyId = draft.getPropertyId();
        entity.agentId = draft.getAgentId();
        entity.counterpartyId = draft.getCounterpartyId();
        if (draft.getCounterpartyRole() == CounterpartyRole.BUYER) {
            entity.buyerId = draft.getCounterpartyId();
        } else {
            entity.sellerId = draft.getCounterpartyId();
        }
        entity.invoiceDate = draft.getInvoiceDate();
        entity.dueDate = draft.getDueDate();
        entity.settlementDate = draft.getSettlementDate();
        entity.propertyValue = draft.getPropertyValue();
        entity.commissionRate = draft.getCommissionRate();
        entity.commissionAmount = draft.getCommissionAmount();
        entity.lineItems.addAll(draft.getLineItems());
        entity.gstRate = draft.getGstRate();
        entity.gstAmount = draft.getGstAmount();
        entity.currency = draft.getCurrency();
        entity.paymentTerms = draft.getPaymentTerms();
        entity.paymentReference = draft.getPaymentReference();
        entity.payeeAccountName = draft.getPayeeAccountName();
        entity.payeeAccountNumber = draft.getPayeeAccountNumber();
        entity.publicNotes = draft.getPublicNotes();
        entity.status = InvoiceStatus.PENDING;
        entity.createdBy = draft.getCreatedBy();
        entity.recalculateTotals();
        return entity;
    }

    private void recalculateTotals() {
        this.subtotal = lineItems.stream()
                .map(InvoiceLineItem::getTotalPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        this.totalTax = gstAmount;
        this.totalAmount = subtotal.add(totalTax);
    }

    public BigDecimal amountPaid() {
        return payments.stream()
                .map(InvoicePayment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Appends a payment and advances the status to PARTIALLY_PAID or PAID.
     * The invoice total is never changed by a payment.
     */
    void recordPayment(InvoicePayment payment) {
        if (!status.acceptsPayments()) {
            throw new IllegalStateException(
                String.format("Cannot record payment on invoice %s in %s status", invoiceNumber, status));
        }
        if (payment.getAmount() == null || payment.getAmount().signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be greater than 0");
        }
        payments.add(payment);
        this.lastModifiedBy = payment.getRecordedBy();
        BigDecimal paid = amountPaid();
        if (paid.compareTo(totalAmount) >= 0) {
            this.status = InvoiceStatus.PAID;
        } else if (paid.signum() > 0) {
            this.status = InvoiceStatus.PARTIALLY_PAID;
        }
    }

    void markSent(UUID sentBy, Instant at) {
        if (status != InvoiceStatus.DRAFT && status != InvoiceStatus.PENDING && status != InvoiceStatus.SENT) {
            throw new IllegalStateException(
                String.format("Cannot send invoice %s in %s status", invoiceNumber, status));
        }
        this.status = InvoiceStatus.SENT;
        this.sentAt = at;
        this.lastModifiedBy = sentBy;
    }

    void markViewed(Instant at) {
        if (status != InvoiceStatus.SENT) {
            throw new IllegalStateException(
                String.format("Cannot mark invoice %s as viewed in %s status. Only SENT invoices can be viewed.",
                    invoiceNumber, status));
        }
        this.status = InvoiceStatus.VIEWED;
        this.viewedAt = at;
    }

    void cancel(String reason, UUID cancelledBy) {
        if (status == InvoiceStatus.PAID || status == InvoiceStatus.REFUNDED) {
            throw new IllegalStateException(
                String.format("Cannot cancel invoice %s in %s status", invoiceNumber, status));
        }
        this.status = InvoiceStatus.CANCELLED;
        this.cancellationReason = reason;
        this.lastModifiedBy = cancelledBy;
    }

    /**
     * Moves an unpaid invoice past its due date to OVERDUE.
     *
     * @return true if the status changed
     */
    boolean markOverdueIfPastDue(LocalDate today) {
        boolean eligible = status == InvoiceStatus.PENDING
                || status == InvoiceStatus.SENT
                || status == InvoiceStatus.VIEWED
                || status == InvoiceStatus.PARTIALLY_PAID;
        if (eligible && dueDate.isBefore(today)) {
            this.status = InvoiceStatus.OVERDUE;
            return true;
        }
        return false;
    }

    /**
     * Converts to an immutable snapshot. Must be called inside a transaction
     * because line items and payments load lazily.
     */
    public Invoice toDomain() {
        return new Invoice(
            id,
            invoiceNumber,
            category,
            propertyId,
            agentId,
            sellerId,
            buyerId,
            counterpartyId,
            invoiceDate,
            dueDate,
            settlementDate,
            propertyValue,
            commissionRate,
            commissionAmount,
            List.copyOf(lineItems),
            gstRate,
            gstAmount,
            subtotal,
            totalTax,
            totalAmount,
            currency,
            paymentTerms,
            paymentReference,
            payeeAccountName,
            payeeAccountNumber,
            publicNotes,
            status,
            List.copyOf(payments),
            cancellationReason,
            createdBy,
            createdAt,
            updatedAt
        );
    }
}
