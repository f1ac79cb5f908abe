package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.directory.UserDirectory;
import com.flagship.property_settlement.directory.UserRole;
import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.SettlementDetails;
import com.flagship.property_settlement.history.StatusHistoryEntry;
import com.flagship.property_settlement.observability.CorrelationContext;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Resumes transitions whose history entry stayed in PROCESSING, typically after a
 * crash between the status write and finalisation. For SETTLED entries the
 * invoice step is re-run (it is idempotent) before the entry is finalised.
 */
@Component
@ConditionalOnProperty(name = "sales.recovery.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class StalledTransitionRecovery {

    static final int BATCH_SIZE = 20;

    private final AuditTrailRecorder recorder;
    private final PropertyPersistenceService propertyService;
    private final UserDirectory userDirectory;
    private final SettlementInvoiceCoordinator invoiceCoordinator;
    private final TransitionFinalizer finalizer;
    private final SettlementMetrics metrics;
    private final Clock clock;
    private final Duration staleAfter;

    public StalledTransitionRecovery(AuditTrailRecorder recorder,
                                     PropertyPersistenceService propertyService,
                                     UserDirectory userDirectory,
                                     SettlementInvoiceCoordinator invoiceCoordinator,
                                     TransitionFinalizer finalizer,
                                     SettlementMetrics metrics,
                                     Clock clock,
                                     @Value("${sales.recovery.stale-after:PT10M}") Duration staleAfter) {
        this.recorder = recorder;
        this.propertyService = propertyService;
        this.userDirectory = userDirectory;
        this.invoiceCoordinator = invoiceCoordinator;
        this.finalizer = finalizer;
        this.metrics = metrics;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @Scheduled(fixedDelayString = "${sales.recovery.poll-interval-ms:60000}")
    public void recoverStalled() {
        List<StatusHistoryEntry> stalled;
        try {
            stalled = recorder.findStalled(Instant.now(clock).minus(staleAfter), BATCH_SIZE);
        } catch (RuntimeException e) {
            log.error("Failed to query stalled transitions", e);
            return;
        }
        if (stalled.isEmpty()) {
            return;
        }
        log.warn("Found {} stalled transitions, resuming", stalled.size());

        for (StatusHistoryEntry entry : stalled) {
            String correlationId = entry.getMetadata() != null ? entry.getMetadata().getCorrelationId() : null;
            CorrelationContext.runWith(correlationId, () -> resumeQuietly(entry));
        }
    }

    private void resumeQuietly(StatusHistoryEntry entry) {
        try {
            resume(entry);
            metrics.incrementRecoveredTransitions();
        } catch (RuntimeException e) {
            log.error("Failed to resume history entry {} for property {}", entry.getId(), entry.getPropertyId(), e);
        }
    }

    void resume(StatusHistoryEntry entry) {
        CorrelationContext.tagProperty(entry.getPropertyId());
        PropertySnapshot property = propertyService.requireSnapshot(entry.getPropertyId());
        DirectoryUser actor = userDirectory.findById(entry.getChangedBy())
                .orElseGet(() -> unknownActor(entry.getChangedBy()));

        SettlementInvoices invoices = SettlementInvoices.none();
        if (entry.getNewStatus() == SalesStatus.SETTLED) {
            SettlementDetails details = entry.getSettlementDetails() != null
                    ? entry.getSettlementDetails()
                    : SettlementDetails.empty();
            UUID sellerId = entry.getRequestedSellerId() != null ? entry.getRequestedSellerId() : property.getOwnerId();
            LocalDate settlementDate = details.getSettlementDate() != null
                    ? details.getSettlementDate()
                    : property.getSettlementDate();
            invoices = invoiceCoordinator.settle(entry, property, sellerId, entry.getRequestedBuyerId(),
                    details.hasLegalRelease(), entry.getChangedBy(), settlementDate);
        }

        StatusHistoryEntry finalized = finalizer.finalizeTransition(entry, property, actor, invoices);
        log.info("Resumed stalled transition {} for property {} ({})",
                entry.getId(), entry.getPropertyId(), finalized.getProcessingStatus());
    }

    private static DirectoryUser unknownActor(UUID id) {
        return new DirectoryUser(id, "Unknown user", null, UserRole.AGENT, null);
    }
}
