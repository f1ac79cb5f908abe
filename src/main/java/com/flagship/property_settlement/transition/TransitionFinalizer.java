package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.StatusHistoryEntry;
import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.notification.NotificationDispatcher;
import com.flagship.property_settlement.property.PropertySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Closes a history entry and queues its notifications in one transaction, so an
 * entry leaves PROCESSING exactly when its notification tasks are in the outbox.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionFinalizer {

    private final AuditTrailRecorder recorder;
    private final NotificationDispatcher dispatcher;

    @Transactional
    public StatusHistoryEntry finalizeTransition(StatusHistoryEntry entry, PropertySnapshot property,
                                                 DirectoryUser actor, SettlementInvoices invoices) {
        if (invoices.sellerFailed()) {
            recorder.markFailed(entry.getId(), invoices.getSellerFailure());
            dispatcher.raiseInvoiceFailureAlert(property, actor, invoices.getSellerFailure(), entry.getId());
        }

        dispatcher.notifyStatusChange(property, entry.getPreviousStatus(), entry.getNewStatus(), actor, entry.getId());
        for (Invoice invoice : invoices.getToAnnounce()) {
            dispatcher.notifyInvoiceGenerated(invoice, property, entry.getId());
        }

        StatusHistoryEntry finalized = recorder.markProcessed(entry.getId());
        log.debug("History entry {} finalised as {}", entry.getId(), finalized.getProcessingStatus());
        return finalized;
    }
}
