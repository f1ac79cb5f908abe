package com.flagship.property_settlement.invoice;

import com.flagship.property_settlement.commission.CommissionBreakdown;
import com.flagship.property_settlement.commission.CommissionCalculator;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.directory.UserDirectory;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.paymentrecord.PaymentRecordService;
import com.flagship.property_settlement.property.PropertySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice ledger: idempotent invoice creation plus the invoice lifecycle.
 *
 * {@link #getOrCreate} is deliberately not transactional. The lookup, the insert
 * (REQUIRES_NEW) and the conflict re-read each run in their own transaction, so
 * a losing concurrent insert can see the winner's committed row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceLedgerService {

    static final String CURRENCY = "AUD";
    static final int STANDARD_DUE_DAYS = 30;
    static final int PLATFORM_DUE_DAYS = 14;

    private static final EnumSet<InvoiceStatus> OVERDUE_CANDIDATES = EnumSet.of(
        InvoiceStatus.PENDING, InvoiceStatus.SENT, InvoiceStatus.VIEWED, InvoiceStatus.PARTIALLY_PAID);

    private final InvoicePersistenceService persistenceService;
    private final InvoiceRepository repository;
    private final CommissionCalculator commissionCalculator;
    private final UserDirectory userDirectory;
    private final PaymentRecordService paymentRecordService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Returns the active invoice for (property, counterparty, category), creating it
     * if none exists.
     *
     * @throws IllegalArgumentException if the agent or counterparty is unknown
     */
    public InvoiceResult getOrCreate(InvoiceCategory category, PropertySnapshot property,
                                     CounterpartyRole counterpartyRole, UUID counterpartyId,
                                     UUID agentId, LocalDate settlementDate) {
        if (category == null || property == null || counterpartyRole == null) {
            throw new IllegalArgumentException("Category, property and counterparty role are required");
        }
        if (counterpartyId == null) {
            throw new IllegalArgumentException(counterpartyRole == CounterpartyRole.BUYER
                ? "Buyer id is required for a buyer invoice"
                : "Seller id is required for a commission invoice");
        }
        if (agentId == null) {
            throw new IllegalArgumentException("Agent id is required");
        }

        Optional<Invoice> existing = persistenceService.findActive(property.getId(), counterpartyId, category);
        if (existing.isPresent()) {
            metrics.recordInvoiceIdempotentHit(category.name());
            log.info("Existing {} invoice reused: {} for property={}",
                    category, existing.get().getInvoiceNumber(), property.getId());
            return InvoiceResult.existing(existing.get());
        }

        DirectoryUser agent = userDirectory.findById(agentId)
                .orElseThrow(() -> new IllegalArgumentException("Agent not found: " + agentId));
        userDirectory.findById(counterpartyId)
                .orElseThrow(() -> new IllegalArgumentException(
                    (counterpartyRole == CounterpartyRole.BUYER ? "Buyer" : "Seller") + " not found: " + counterpartyId));

        InvoiceDraft draft = draft(category, property, counterpartyRole, counterpartyId, agent, settlementDate);

        try {
            Invoice created = persistenceService.insert(draft);
            metrics.recordInvoiceCreated(category.name());
            log.info("New {} invoice created: {} ({}% on {}) total={}",
                    category, created.getInvoiceNumber(), created.getCommissionRate(),
                    property.getPrice(), created.getTotalAmount());
            return InvoiceResult.created(created);

        } catch (DataIntegrityViolationException e) {
            // Lost the race on ux_invoices_active_key: the winner's row is committed by now
            Invoice winner = persistenceService.findActive(property.getId(), counterpartyId, category)
                    .orElseThrow(() -> e);
            metrics.recordInvoiceIdempotentHit(category.name());
            log.warn("Concurrent {} invoice creation for property={} resolved to existing invoice {}",
                    category, property.getId(), winner.getInvoiceNumber());
            return InvoiceResult.existing(winner);
        }
    }

    private InvoiceDraft draft(InvoiceCategory category, PropertySnapshot property,
                               CounterpartyRole counterpartyRole, UUID counterpartyId,
                               DirectoryUser agent, LocalDate settlementDate) {
        CommissionBreakdown breakdown = commissionCalculator.calculate(category, property.getPrice());
        LocalDate today = LocalDate.now(clock);
        int dueDays = category == InvoiceCategory.PLATFORM_COMMISSION ? PLATFORM_DUE_DAYS : STANDARD_DUE_DAYS;

        InvoiceDraft.InvoiceDraftBuilder builder = InvoiceDraft.builder()
                .category(category)
                .propertyId(property.getId())
                .agentId(agent.getId())
                .counterpartyRole(counterpartyRole)
                .counterpartyId(counterpartyId)
                .invoiceDate(today)
                .dueDate(today.plusDays(dueDays))
                .settlementDate(settlementDate != null ? settlementDate : today)
                .propertyValue(breakdown.getPropertyValue())
                .commissionRate(breakdown.getRatePercent())
                .commissionAmount(breakdown.getCommission())
                .lineItem(InvoiceLineItem.single(lineItemDescription(category, property.getTitle()),
                        breakdown.getCommission()))
                .gstRate(breakdown.getGstRatePercent())
                .gstAmount(breakdown.getGst())
                .currency(CURRENCY)
                .paymentTerms("Net " + dueDays + " days")
                .createdBy(agent.getId());

        if (category == InvoiceCategory.BUYER_PAYMENT) {
            String reference = "PROP-" + property.shortReference();
            builder.paymentReference(reference)
                    .payeeAccountName(agent.getName())
                    .payeeAccountNumber(agent.getBankAccountNumber())
                    .publicNotes("Please transfer the deposit amount to the agent's trust account using the reference: "
                            + reference);
        }
        return builder.build();
    }

    static String lineItemDescription(InvoiceCategory category, String propertyTitle) {
        return switch (category) {
            case SETTLEMENT_COMMISSION -> "Real Estate Commission - " + propertyTitle;
            case PLATFORM_COMMISSION -> "Platform Commission (0.55%) - " + propertyTitle;
            case BUYER_PAYMENT -> "Property Purchase Payment (10%) - " + propertyTitle;
            case OTHER -> "Invoice - " + propertyTitle;
        };
    }

    @Transactional(readOnly = true)
    public Invoice findById(UUID invoiceId) {
        return repository.findById(invoiceId)
                .map(InvoiceEntity::toDomain)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceId.toString()));
    }

    @Transactional(readOnly = true)
    public Invoice findByNumber(String invoiceNumber) {
        return repository.findByInvoiceNumber(invoiceNumber)
                .map(InvoiceEntity::toDomain)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceNumber));
    }

    @Transactional(readOnly = true)
    public List<Invoice> listForProperty(UUID propertyId) {
        return repository.findByPropertyIdOrderByCreatedAtDesc(propertyId).stream()
                .map(InvoiceEntity::toDomain)
                .toList();
    }

    /**
     * Appends a payment. Moves the invoice to PARTIALLY_PAID or PAID; the total is unchanged.
     * Paying in full completes the invoice's payment record in the same transaction.
     */
    @Transactional
    public Invoice recordPayment(UUID invoiceId, BigDecimal amount, PaymentMethod method,
                                 String reference, UUID recordedBy) {
        if (method == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        InvoiceEntity entity = load(invoiceId);
        entity.recordPayment(new InvoicePayment(
            amount,
            LocalDate.now(clock),
            method,
            null,
            reference,
            null,
            recordedBy,
            Instant.now(clock)
        ));
        InvoiceEntity saved = repository.save(entity);
        log.info("Recorded payment of {} on invoice {}: status={} amountDue={}",
                amount, saved.getInvoiceNumber(), saved.getStatus(),
                saved.getTotalAmount().subtract(saved.amountPaid()));
        if (saved.getStatus() == InvoiceStatus.PAID) {
            paymentRecordService.completeForInvoice(saved.getId());
        }
        return saved.toDomain();
    }

    @Transactional
    public Invoice markSent(UUID invoiceId, UUID sentBy) {
        InvoiceEntity entity = load(invoiceId);
        entity.markSent(sentBy, Instant.now(clock));
        log.info("Invoice {} marked as sent", entity.getInvoiceNumber());
        return repository.save(entity).toDomain();
    }

    @Transactional
    public Invoice markViewed(UUID invoiceId) {
        InvoiceEntity entity = load(invoiceId);
        entity.markViewed(Instant.now(clock));
        return repository.save(entity).toDomain();
    }

    @Transactional
    public Invoice cancel(UUID invoiceId, String reason, UUID cancelledBy) {
        InvoiceEntity entity = load(invoiceId);
        entity.cancel(reason, cancelledBy);
        log.info("Invoice {} cancelled: {}", entity.getInvoiceNumber(), reason);
        return repository.save(entity).toDomain();
    }

    /**
     * Moves every unpaid invoice past its due date to OVERDUE.
     *
     * @return number of invoices updated
     */
    @Transactional
    public int markOverdue() {
        LocalDate today = LocalDate.now(clock);
        int updated = 0;
        for (InvoiceEntity entity : repository.findPastDue(OVERDUE_CANDIDATES, today)) {
            if (entity.markOverdueIfPastDue(today)) {
                updated++;
            }
        }
        if (updated > 0) {
            log.info("Marked {} invoices as overdue", updated);
        }
        return updated;
    }

    private InvoiceEntity load(UUID invoiceId) {
        return repository.findById(invoiceId)
                .orElseThrow(() -> new InvoiceNotFoundException(invoiceId.toString()));
    }
}
