package com.flagship.property_settlement.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the ledger and the invoices table.
 *
 * The insert runs in its own transaction and flushes immediately, so a
 * violation of the active-key unique index surfaces here as a
 * {@link org.springframework.dao.DataIntegrityViolationException} that the
 * ledger can resolve by re-reading the winning row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePersistenceService {

    private final InvoiceRepository repository;
    private final InvoiceNumberService invoiceNumberService;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Invoice insert(InvoiceDraft draft) {
        String invoiceNumber = invoiceNumberService.assignNumber(draft.getInvoiceDate().getYear());
        InvoiceEntity saved = repository.saveAndFlush(InvoiceEntity.issue(draft, invoiceNumber));
        log.debug("Inserted invoice {} category={} property={}",
                saved.getInvoiceNumber(), saved.getCategory(), saved.getPropertyId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Invoice> findActive(UUID propertyId, UUID counterpartyId, InvoiceCategory category) {
        return repository
                .findFirstByPropertyIdAndCounterpartyIdAndCategoryAndStatusNotOrderByCreatedAtDesc(
                    propertyId, counterpartyId, category, InvoiceStatus.CANCELLED)
                .map(InvoiceEntity::toDomain);
    }
}
