package com.flagship.property_settlement.transition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.property_settlement.invoice.InvoiceResult;
import com.flagship.property_settlement.property.ListingStatus;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * What a successful transition returns. Invoice summaries are absent when no
 * invoice of that kind was produced.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransitionResult {
    PropertySummary property;
    HistorySummary statusHistory;
    InvoiceSummary invoice;
    InvoiceSummary buyerInvoice;
    InvoiceSummary platformInvoice;

    @JsonIgnore
    String message;

    @Value
    public static class PropertySummary {
        UUID id;
        SalesStatus salesStatus;
        ListingStatus status;
        Instant lastModified;
    }

    @Value
    public static class HistorySummary {
        UUID id;
        SalesStatus previousStatus;
        SalesStatus newStatus;
        Instant changedAt;
    }

    @Value
    public static class InvoiceSummary {
        UUID invoiceId;
        String invoiceNumber;
        BigDecimal amount;
        LocalDate dueDate;
        boolean alreadyExisted;

        public static InvoiceSummary of(InvoiceResult result) {
            if (result == null) {
                return null;
            }
            return new InvoiceSummary(
                result.getInvoice().getId(),
                result.getInvoice().getInvoiceNumber(),
                result.getInvoice().getTotalAmount(),
                result.getInvoice().getDueDate(),
                result.isAlreadyExisted()
            );
        }
    }
}
