package com.flagship.property_settlement.history;

import com.flagship.property_settlement.property.SalesStatus;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable view of a history entry.
 */
@Value
public class StatusHistoryEntry {
    UUID id;
    UUID propertyId;
    SalesStatus previousStatus;
    SalesStatus newStatus;
    UUID changedBy;
    String changeReason;
    RequestMetadata metadata;
    SettlementDetails settlementDetails;
    UUID requestedSellerId;
    UUID requestedBuyerId;
    InvoiceOutcome invoice;
    InvoiceOutcome buyerInvoice;
    List<NotificationDelivery> notifications;
    ProcessingStatus processingStatus;
    List<HistoryError> errorLog;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasSellerInvoice() {
        return invoice != null && invoice.wasGenerated();
    }
}
