package com.flagship.property_settlement.paymentrecord;

import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Admin-facing payment records for seller commission invoices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentRecordService {

    private static final EnumSet<PaymentRecordStatus> OPEN = EnumSet.of(
        PaymentRecordStatus.PENDING, PaymentRecordStatus.PROCESSING);

    private final PaymentRecordRepository repository;
    private final Clock clock;

    /**
     * Takes the snapshot for a settlement commission invoice. A second call for the
     * same invoice returns the existing record.
     */
    @Transactional
    public PaymentRecord snapshot(Invoice invoice) {
        if (invoice.getCategory() != InvoiceCategory.SETTLEMENT_COMMISSION) {
            throw new IllegalArgumentException("Payment records are only kept for settlement commission invoices");
        }
        return repository.findByInvoiceId(invoice.getId())
                .map(PaymentRecordEntity::toDomain)
                .orElseGet(() -> {
                    PaymentRecord created = repository.save(PaymentRecordEntity.snapshotOf(invoice)).toDomain();
                    log.info("Payment record {} created for invoice {} ({} {})",
                            created.getId(), invoice.getInvoiceNumber(), created.getAmount(), created.getCurrency());
                    return created;
                });
    }

    /**
     * Completes the record of a fully paid invoice. Joins the caller's transaction so
     * the record and the invoice commit together. Returns empty when no record has
     * been snapshotted yet; the snapshot then starts out COMPLETED.
     */
    @Transactional
    public Optional<PaymentRecord> completeForInvoice(UUID invoiceId) {
        return repository.findByInvoiceId(invoiceId)
                .map(entity -> {
                    if (entity.getStatus() == PaymentRecordStatus.COMPLETED) {
                        return entity.toDomain();
                    }
                    entity.transitionTo(PaymentRecordStatus.COMPLETED, null, Instant.now(clock));
                    PaymentRecord completed = repository.save(entity).toDomain();
                    log.info("Payment record {} completed for invoice {}",
                            completed.getId(), completed.getInvoiceNumber());
                    return completed;
                });
    }

    /**
     * Admin status change, for payments reconciled outside the invoice flow.
     *
     * @throws PaymentRecordNotFoundException if no record has this id
     * @throws IllegalStateException if the transition is not allowed
     */
    @Transactional
    public PaymentRecord updateStatus(UUID id, PaymentRecordStatus status, String reason) {
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        PaymentRecordEntity entity = repository.findById(id)
                .orElseThrow(() -> new PaymentRecordNotFoundException(id));
        PaymentRecordStatus previous = entity.getStatus();
        entity.transitionTo(status, reason, Instant.now(clock));
        PaymentRecord updated = repository.save(entity).toDomain();
        log.info("Payment record {} moved from {} to {}", id, previous, status);
        return updated;
    }

    @Transactional(readOnly = true)
    public List<PaymentRecord> list(PaymentRecordStatus status) {
        List<PaymentRecordEntity> records = status == null
                ? repository.findAllByOrderByCreatedAtDesc()
                : repository.findByStatusOrderByCreatedAtDesc(status);
        return records.stream().map(PaymentRecordEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentRecord> overdue() {
        return repository.findOverdue(OPEN, LocalDate.now(clock)).stream()
                .map(PaymentRecordEntity::toDomain)
                .toList();
    }
}
