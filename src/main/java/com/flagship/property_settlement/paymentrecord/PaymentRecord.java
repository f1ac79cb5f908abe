package com.flagship.property_settlement.paymentrecord;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class PaymentRecord {
    UUID id;
    UUID invoiceId;
    UUID propertyId;
    UUID sellerId;
    UUID agentId;
    BigDecimal amount;
    String currency;
    PaymentRecordStatus status;
    String invoiceNumber;
    BigDecimal commissionAmount;
    BigDecimal gstAmount;
    BigDecimal totalAmount;
    LocalDate dueDate;
    Instant initiatedAt;
    Instant completedAt;
    Instant failedAt;
    String failureReason;
    Instant createdAt;
}
