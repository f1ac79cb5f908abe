package com.flagship.property_settlement.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Immutable invoice snapshot, read from the ledger. Notification code always
 * works from a freshly read snapshot rather than the object a creator returned.
 */
@Value
public class Invoice {
    UUID id;
    String invoiceNumber;
    InvoiceCategory category;
    UUID propertyId;
    UUID agentId;
    UUID sellerId;
    UUID buyerId;
    UUID counterpartyId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    LocalDate settlementDate;
    BigDecimal propertyValue;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    List<InvoiceLineItem> lineItems;
    BigDecimal gstRate;
    BigDecimal gstAmount;
    BigDecimal subtotal;
    BigDecimal totalTax;
    BigDecimal totalAmount;
    String currency;
    String paymentTerms;
    String paymentReference;
    String payeeAccountName;
    String payeeAccountNumber;
    String publicNotes;
    InvoiceStatus status;
    List<InvoicePayment> payments;
    String cancellationReason;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;

    public BigDecimal getAmountPaid() {
        return payments.stream()
                .map(InvoicePayment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getAmountDue() {
        return totalAmount.subtract(getAmountPaid());
    }

    public boolean isOverdue(LocalDate today) {
        return status != InvoiceStatus.PAID
                && status != InvoiceStatus.CANCELLED
                && status != InvoiceStatus.REFUNDED
                && dueDate.isBefore(today);
    }

    public long daysPastDue(LocalDate today) {
        return isOverdue(today) ? ChronoUnit.DAYS.between(dueDate, today) : 0;
    }

    public boolean isBuyerInvoice() {
        return category == InvoiceCategory.BUYER_PAYMENT;
    }
}
