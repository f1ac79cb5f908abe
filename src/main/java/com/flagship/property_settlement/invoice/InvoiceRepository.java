package com.flagship.property_settlement.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    /**
     * Newest non-cancelled invoice for the idempotency key.
     */
    Optional<InvoiceEntity> findFirstByPropertyIdAndCounterpartyIdAndCategoryAndStatusNotOrderByCreatedAtDesc(
        UUID propertyId, UUID counterpartyId, InvoiceCategory category, InvoiceStatus status);

    Optional<InvoiceEntity> findByInvoiceNumber(String invoiceNumber);

    List<InvoiceEntity> findByPropertyIdOrderByCreatedAtDesc(UUID propertyId);

    @Query("""
        SELECT i FROM InvoiceEntity i
        WHERE i.status IN :statuses
        AND i.dueDate < :today
        ORDER BY i.dueDate ASC
        """)
    List<InvoiceEntity> findPastDue(@Param("statuses") Collection<InvoiceStatus> statuses,
                                    @Param("today") LocalDate today);

    /**
     * Active invoices by key, used by tests and diagnostics to assert uniqueness.
     */
    long countByPropertyIdAndCounterpartyIdAndCategoryAndStatusNot(
        UUID propertyId, UUID counterpartyId, InvoiceCategory category, InvoiceStatus status);
}
