package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.DepositTerms;
import com.flagship.property_settlement.history.SettlementDetails;
import com.flagship.property_settlement.history.StatusHistoryEntry;
import com.flagship.property_settlement.history.TransitionRecord;
import com.flagship.property_settlement.observability.CorrelationContext;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Applies a sales status change to a property.
 *
 * The write sequence is: property update, history entry (PROCESSING), invoices for
 * SETTLED, then finalisation with the notification tasks. Each step commits on its
 * own; an entry left in PROCESSING by a crash is resumed by
 * {@link StalledTransitionRecovery}. Billing failures after the status write are
 * recorded on the entry and never fail the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusTransitionEngine {

    private final TransitionGate gate;
    private final PropertyPersistenceService propertyService;
    private final AuditTrailRecorder recorder;
    private final SettlementInvoiceCoordinator invoiceCoordinator;
    private final TransitionFinalizer finalizer;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public TransitionResult transition(TransitionCommand command, DirectoryUser actor) {
        Instant started = Instant.now(clock);

        AdmittedTransition admitted;
        try {
            admitted = gate.admit(command, actor);
        } catch (RuntimeException e) {
            metrics.recordTransition(command.getStatus(), "rejected");
            throw e;
        }

        PropertySnapshot before = admitted.getProperty();
        SalesStatus target = admitted.getTarget();
        SettlementDetails details = admitted.getSettlementDetails();
        CorrelationContext.tagProperty(before.getId());

        LocalDate requestedSettlementDate = details != null ? details.getSettlementDate() : null;
        PropertySnapshot after = propertyService.applySalesStatus(before.getId(), target, actor.getId(),
                target == SalesStatus.SETTLED ? requestedSettlementDate : null);

        if (target == SalesStatus.SETTLED) {
            SettlementDetails base = details != null ? details : SettlementDetails.empty();
            details = base.withDeposit(DepositTerms.offPlatform(after.getPrice(), Instant.now(clock)));
        }

        RequestContext context = command.getRequestContext() != null
                ? command.getRequestContext()
                : RequestContext.system(CorrelationContext.getCorrelationId());

        StatusHistoryEntry entry = recorder.record(TransitionRecord.builder()
                .propertyId(after.getId())
                .previousStatus(before.getSalesStatus())
                .newStatus(target)
                .changedBy(actor.getId())
                .changeReason(admitted.getChangeReason())
                .metadata(context.toMetadata(started))
                .settlementDetails(details)
                .requestedSellerId(admitted.getSellerId())
                .requestedBuyerId(admitted.getBuyerId())
                .build());

        SettlementInvoices invoices = SettlementInvoices.none();
        if (target == SalesStatus.SETTLED) {
            UUID sellerId = admitted.getSellerId() != null ? admitted.getSellerId() : after.getOwnerId();
            LocalDate settlementDate = requestedSettlementDate != null ? requestedSettlementDate : after.getSettlementDate();
            invoices = invoiceCoordinator.settle(entry, after, sellerId, admitted.getBuyerId(),
                    details.hasLegalRelease(), actor.getId(), settlementDate);
        }

        try {
            finalizer.finalizeTransition(entry, after, actor, invoices);
        } catch (RuntimeException e) {
            // Entry stays PROCESSING and is picked up by the recovery job
            log.error("Failed to finalise history entry {} for property {}", entry.getId(), after.getId(), e);
        }

        metrics.recordTransition(target.getWireValue(), invoices.sellerFailed() ? "invoice_failed" : "success");
        metrics.recordTransitionDuration(Duration.between(started, Instant.now(clock)));
        log.info("Sales status updated: {} -> {} for property {} by {}",
                SalesStatus.displayNameOf(before.getSalesStatus()), target.getDisplayName(), after.getId(), actor.getId());

        return new TransitionResult(
            new TransitionResult.PropertySummary(after.getId(), after.getSalesStatus(), after.getStatus(),
                    after.getUpdatedAt()),
            new TransitionResult.HistorySummary(entry.getId(), entry.getPreviousStatus(), entry.getNewStatus(),
                    entry.getCreatedAt()),
            TransitionResult.InvoiceSummary.of(invoices.getSeller()),
            TransitionResult.InvoiceSummary.of(invoices.getBuyer()),
            TransitionResult.InvoiceSummary.of(invoices.getPlatform()),
            message(target, invoices)
        );
    }

    static String message(SalesStatus target, SettlementInvoices invoices) {
        StringBuilder message = new StringBuilder("Property sales status successfully updated to ")
                .append(target.getDisplayName());
        if (invoices.getSeller() != null) {
            message.append(" and invoice ")
                    .append(invoices.getSeller().getInvoice().getInvoiceNumber())
                    .append(invoices.getSeller().isAlreadyExisted() ? " reused" : " generated");
        }
        return message.toString();
    }
}
