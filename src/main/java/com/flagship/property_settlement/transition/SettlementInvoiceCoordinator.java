package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.InvoiceOutcome;
import com.flagship.property_settlement.history.StatusHistoryEntry;
import com.flagship.property_settlement.invoice.CounterpartyRole;
import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import com.flagship.property_settlement.invoice.InvoiceLedgerService;
import com.flagship.property_settlement.invoice.InvoiceResult;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.property.PropertySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates the invoices a settlement owes and attaches them to the history entry.
 *
 * Every ledger call is idempotent, so running this twice for the same entry (a
 * request followed by the recovery job) yields the same invoices. Only the seller
 * commission invoice is critical; buyer and platform failures are logged on the
 * entry and otherwise ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementInvoiceCoordinator {

    private final InvoiceLedgerService ledger;
    private final AuditTrailRecorder recorder;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public SettlementInvoices settle(StatusHistoryEntry entry, PropertySnapshot property, UUID sellerId,
                                     UUID buyerId, boolean legalRelease, UUID actorId, LocalDate settlementDate) {
        UUID agentId = property.getActiveAgentId() != null ? property.getActiveAgentId() : actorId;
        List<Invoice> toAnnounce = new ArrayList<>();

        InvoiceResult seller = null;
        String sellerFailure = null;
        try {
            seller = ledger.getOrCreate(InvoiceCategory.SETTLEMENT_COMMISSION, property,
                    CounterpartyRole.SELLER, sellerId, agentId, settlementDate);
            if (entry.getInvoice() == null || !seller.getInvoice().getId().equals(entry.getInvoice().getInvoiceId())) {
                recorder.attachInvoice(entry.getId(), InvoiceOutcome.of(seller, Instant.now(clock)));
            }
            if (isNew(seller, entry.getInvoice())) {
                toAnnounce.add(seller.getInvoice());
            }
            log.info("Invoice {} {} for settled property: {}", seller.getInvoice().getInvoiceNumber(),
                    seller.isAlreadyExisted() ? "(existing)" : "generated", property.getTitle());
        } catch (RuntimeException e) {
            sellerFailure = "Invoice generation failed: " + e.getMessage();
            metrics.recordInvoiceGenerationFailed(InvoiceCategory.SETTLEMENT_COMMISSION.name());
            log.error("Invoice generation failed for property {}", property.getId(), e);
        }

        InvoiceResult buyer = null;
        if (buyerId != null) {
            try {
                buyer = ledger.getOrCreate(InvoiceCategory.BUYER_PAYMENT, property,
                        CounterpartyRole.BUYER, buyerId, agentId, settlementDate);
                if (entry.getBuyerInvoice() == null
                        || !buyer.getInvoice().getId().equals(entry.getBuyerInvoice().getInvoiceId())) {
                    recorder.attachBuyerInvoice(entry.getId(), InvoiceOutcome.of(buyer, Instant.now(clock)));
                }
                if (isNew(buyer, entry.getBuyerInvoice())) {
                    toAnnounce.add(buyer.getInvoice());
                }
            } catch (RuntimeException e) {
                metrics.recordInvoiceGenerationFailed(InvoiceCategory.BUYER_PAYMENT.name());
                recorder.appendError(entry.getId(), "Buyer invoice generation failed: " + e.getMessage());
                log.warn("Buyer invoice generation failed for property {}: {}", property.getId(), e.getMessage());
            }
        } else {
            log.debug("No buyer id supplied, skipping buyer invoice for property {}", property.getId());
        }

        InvoiceResult platform = null;
        if (legalRelease) {
            try {
                platform = ledger.getOrCreate(InvoiceCategory.PLATFORM_COMMISSION, property,
                        CounterpartyRole.SELLER, sellerId, agentId, settlementDate);
            } catch (RuntimeException e) {
                metrics.recordInvoiceGenerationFailed(InvoiceCategory.PLATFORM_COMMISSION.name());
                recorder.appendError(entry.getId(), "Platform invoice generation failed: " + e.getMessage());
                log.warn("Platform invoice generation failed for property {}: {}", property.getId(), e.getMessage());
            }
        }

        return new SettlementInvoices(seller, buyer, platform, sellerFailure, List.copyOf(toAnnounce));
    }

    /**
     * True when this run created the invoice, or an earlier run of the same entry
     * created it and stopped before announcing it.
     */
    static boolean isNew(InvoiceResult result, InvoiceOutcome recorded) {
        if (!result.isAlreadyExisted()) {
            return true;
        }
        return recorded != null
                && result.getInvoice().getId().equals(recorded.getInvoiceId())
                && Boolean.FALSE.equals(recorded.getAlreadyExisted());
    }
}
