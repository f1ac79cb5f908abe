package com.flagship.property_settlement.notification.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Carries only the invoice id and number: the handler reads the invoice back
 * from the ledger before notifying anyone.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class InvoiceGeneratedEvent implements NotificationEvent {

    public static final String EVENT_TYPE = "InvoiceGenerated";

    UUID eventId;
    UUID historyId;
    UUID propertyId;
    String propertyTitle;
    UUID invoiceId;
    String invoiceNumber;
    InvoiceCategory category;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
