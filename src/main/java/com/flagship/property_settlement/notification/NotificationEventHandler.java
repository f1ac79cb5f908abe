package com.flagship.property_settlement.notification;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.directory.UserDirectory;
import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.DeliveryStatus;
import com.flagship.property_settlement.history.NotificationChannel;
import com.flagship.property_settlement.history.NotificationDelivery;
import com.flagship.property_settlement.history.RecipientType;
import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import com.flagship.property_settlement.invoice.InvoiceLedgerService;
import com.flagship.property_settlement.notification.event.InvoiceGeneratedEvent;
import com.flagship.property_settlement.notification.event.InvoiceGenerationFailedEvent;
import com.flagship.property_settlement.notification.event.StatusChangedEvent;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.paymentrecord.PaymentRecordService;
import com.flagship.property_settlement.property.SalesStatus;
import com.flagship.property_settlement.realtime.ConnectionRegistry;
import com.flagship.property_settlement.realtime.RoomNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fans a delivered notification task out to in-app, email and live-push channels,
 * and appends each delivery outcome to the originating history entry.
 *
 * In-app notifications and the payment record are required: a failure there
 * propagates so the record is redelivered. Email and live push are best effort
 * and their failures are recorded as FAILED deliveries. Email with no mail
 * transport configured is recorded as SKIPPED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationEventHandler {

    static final String STATUS_UPDATED_EVENT = "property-status-updated";
    static final String INVOICE_GENERATED_EVENT = "invoice-generated";

    private final NotificationService notificationService;
    private final EmailSender emailSender;
    private final ConnectionRegistry connectionRegistry;
    private final InvoiceLedgerService ledger;
    private final PaymentRecordService paymentRecordService;
    private final UserDirectory userDirectory;
    private final AuditTrailRecorder recorder;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public void onStatusChanged(StatusChangedEvent event) {
        UUID ownerId = event.getOwnerId();
        String title = "Property Status Updated: " + event.getPropertyTitle();
        String message = String.format("Your property status has been updated from %s to %s",
                SalesStatus.displayNameOf(event.getPreviousStatus()),
                SalesStatus.displayNameOf(event.getNewStatus()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("historyId", event.getHistoryId());
        data.put("previousStatus", event.getPreviousStatus());
        data.put("newStatus", event.getNewStatus());
        data.put("changedBy", event.getChangedBy());
        data.put("changedByName", event.getChangedByName());

        notificationService.createForUser(ownerId, NotificationType.STATUS_CHANGE, NotificationPriority.NORMAL,
                title, message, event.getPropertyId(), null, data);
        record(event.getHistoryId(), ownerId.toString(), NotificationChannel.IN_APP,
                RecipientType.SELLER, DeliveryStatus.SENT);

        if (event.getContactEmail() != null && !event.getContactEmail().isBlank()) {
            sendEmail(event.getHistoryId(), event.getContactEmail(), RecipientType.SELLER, title, message);
        }

        Map<String, Object> push = new LinkedHashMap<>(data);
        push.put("propertyId", event.getPropertyId());
        push.put("message", message);
        pushToRoom(event.getHistoryId(), RoomNames.seller(ownerId), STATUS_UPDATED_EVENT, push, RecipientType.SELLER);

        metrics.recordNotificationDispatched(NotificationType.STATUS_CHANGE.name(), "sent");
        log.info("Status change notifications delivered for property {}", event.getPropertyId());
    }

    /**
     * Works from the invoice as stored in the ledger, not from the event payload.
     */
    public void onInvoiceGenerated(InvoiceGeneratedEvent event) {
        Invoice invoice = ledger.findById(event.getInvoiceId());
        boolean buyer = invoice.isBuyerInvoice();
        UUID recipientId = invoice.getCounterpartyId();
        RecipientType recipientType = buyer ? RecipientType.BUYER : RecipientType.SELLER;

        String title = "Invoice Generated: " + invoice.getInvoiceNumber();
        String message = buyer
                ? String.format("A deposit invoice of %s %s has been issued for %s. %s",
                        invoice.getTotalAmount(), invoice.getCurrency(), event.getPropertyTitle(),
                        invoice.getPublicNotes())
                : String.format("Invoice %s for %s %s has been issued for %s and is due by %s",
                        invoice.getInvoiceNumber(), invoice.getTotalAmount(), invoice.getCurrency(),
                        event.getPropertyTitle(), invoice.getDueDate());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("historyId", event.getHistoryId());
        data.put("invoiceNumber", invoice.getInvoiceNumber());
        data.put("category", invoice.getCategory());
        data.put("totalAmount", invoice.getTotalAmount());
        data.put("dueDate", invoice.getDueDate().toString());

        notificationService.createForUser(recipientId, NotificationType.INVOICE_GENERATED,
                NotificationPriority.NORMAL, title, message, invoice.getPropertyId(), invoice.getId(), data);
        record(event.getHistoryId(), recipientId.toString(), NotificationChannel.IN_APP,
                recipientType, DeliveryStatus.SENT);

        Map<String, Object> push = new LinkedHashMap<>(data);
        push.put("invoiceId", invoice.getId());
        push.put("propertyId", invoice.getPropertyId());
        String counterpartyRoom = buyer ? RoomNames.buyer(recipientId) : RoomNames.seller(recipientId);
        pushToRoom(event.getHistoryId(), counterpartyRoom, INVOICE_GENERATED_EVENT, push, recipientType);
        pushToRoom(event.getHistoryId(), RoomNames.agent(invoice.getAgentId()), INVOICE_GENERATED_EVENT, push,
                RecipientType.AGENT);

        if (invoice.getCategory() == InvoiceCategory.SETTLEMENT_COMMISSION) {
            paymentRecordService.snapshot(invoice);
        }

        metrics.recordNotificationDispatched(NotificationType.INVOICE_GENERATED.name(), "sent");
        log.info("Invoice {} notifications delivered to {} {}",
                invoice.getInvoiceNumber(), recipientType, recipientId);
    }

    public void onInvoiceGenerationFailed(InvoiceGenerationFailedEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("historyId", event.getHistoryId());
        data.put("error", event.getError());
        data.put("actorId", event.getActorId());
        data.put("actorName", event.getActorName());
        data.put("requiresManualAction", true);

        String title = "Invoice Generation Failed";
        String message = "Failed to generate invoice for settled property: " + event.getPropertyTitle();

        notificationService.createAdminAlert(NotificationType.SYSTEM_ERROR, NotificationPriority.HIGH,
                title, message, event.getPropertyId(), data);
        record(event.getHistoryId(), "admins", NotificationChannel.IN_APP, RecipientType.ADMIN, DeliveryStatus.SENT);

        for (DirectoryUser admin : userDirectory.findAdmins()) {
            if (admin.getEmail() != null && !admin.getEmail().isBlank()) {
                sendEmail(event.getHistoryId(), admin.getEmail(), RecipientType.ADMIN, title,
                        message + ". Error: " + event.getError());
            }
        }

        metrics.recordNotificationDispatched(NotificationType.SYSTEM_ERROR.name(), "sent");
        log.warn("Admin alert delivered for failed invoice on property {}", event.getPropertyId());
    }

    private void sendEmail(UUID historyId, String to, RecipientType recipientType, String subject, String body) {
        try {
            emailSender.send(to, subject, body);
            record(historyId, to, NotificationChannel.EMAIL, recipientType, DeliveryStatus.SENT);
        } catch (EmailNotConfiguredException e) {
            log.debug("Email to {} skipped: {}", to, e.getMessage());
            record(historyId, to, NotificationChannel.EMAIL, recipientType, DeliveryStatus.SKIPPED);
            metrics.recordNotificationDispatched("EMAIL", "skipped");
        } catch (RuntimeException e) {
            log.warn("Email to {} failed: {}", to, e.getMessage());
            record(historyId, to, NotificationChannel.EMAIL, recipientType, DeliveryStatus.FAILED);
            metrics.recordNotificationDispatched("EMAIL", "failed");
        }
    }

    private void pushToRoom(UUID historyId, String room, String eventName, Object payload,
                            RecipientType recipientType) {
        int delivered = connectionRegistry.publishToRoom(room, eventName, payload);
        if (delivered > 0) {
            record(historyId, room, NotificationChannel.PUSH, recipientType, DeliveryStatus.DELIVERED);
        }
    }

    private void record(UUID historyId, String recipient, NotificationChannel channel,
                        RecipientType recipientType, DeliveryStatus status) {
        recorder.recordNotification(historyId,
                new NotificationDelivery(recipient, channel, recipientType, Instant.now(clock), status));
    }
}
