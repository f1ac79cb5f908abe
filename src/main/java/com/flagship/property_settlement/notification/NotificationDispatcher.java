package com.flagship.property_settlement.notification;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.notification.event.InvoiceGeneratedEvent;
import com.flagship.property_settlement.notification.event.InvoiceGenerationFailedEvent;
import com.flagship.property_settlement.notification.event.StatusChangedEvent;
import com.flagship.property_settlement.observability.CorrelationContext;
import com.flagship.property_settlement.outbox.OutboxService;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Enqueues notification tasks for a transition.
 *
 * Nothing is delivered here. Each method writes one task to the outbox inside the
 * caller's transaction (the one finalising the history entry); delivery happens
 * after the response, through the outbox publisher and {@link NotificationEventHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    static final String AGGREGATE_TYPE = "Property";

    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public StatusChangedEvent notifyStatusChange(PropertySnapshot property, SalesStatus previousStatus,
                                                 SalesStatus newStatus, DirectoryUser actor, UUID historyId) {
        StatusChangedEvent event = new StatusChangedEvent(
            UUID.randomUUID(),
            historyId,
            property.getId(),
            property.getTitle(),
            property.getOwnerId(),
            property.getContactEmail(),
            previousStatus,
            newStatus,
            actor.getId(),
            actor.getName(),
            CorrelationContext.getCorrelationId(),
            Instant.now(clock)
        );
        outboxService.saveEvent(AGGREGATE_TYPE, property.getId(), event.getEventType(), event);
        log.debug("Status change notification queued for property {}", property.getId());
        return event;
    }

    /**
     * Callers only invoke this for newly created invoices, never for reused ones.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceGeneratedEvent notifyInvoiceGenerated(Invoice invoice, PropertySnapshot property, UUID historyId) {
        InvoiceGeneratedEvent event = new InvoiceGeneratedEvent(
            UUID.randomUUID(),
            historyId,
            property.getId(),
            property.getTitle(),
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getCategory(),
            CorrelationContext.getCorrelationId(),
            Instant.now(clock)
        );
        outboxService.saveEvent(AGGREGATE_TYPE, property.getId(), event.getEventType(), event);
        log.debug("Invoice notification queued for invoice {}", invoice.getInvoiceNumber());
        return event;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceGenerationFailedEvent raiseInvoiceFailureAlert(PropertySnapshot property, DirectoryUser actor,
                                                                 String error, UUID historyId) {
        InvoiceGenerationFailedEvent event = new InvoiceGenerationFailedEvent(
            UUID.randomUUID(),
            historyId,
            property.getId(),
            property.getTitle(),
            actor.getId(),
            actor.getName(),
            error,
            CorrelationContext.getCorrelationId(),
            Instant.now(clock)
        );
        outboxService.saveEvent(AGGREGATE_TYPE, property.getId(), event.getEventType(), event);
        log.warn("Admin alert queued: invoice generation failed for property {}", property.getId());
        return event;
    }
}
