package com.flagship.property_settlement.paymentrecord;

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
public interface PaymentRecordRepository extends JpaRepository<PaymentRecordEntity, UUID> {

    Optional<PaymentRecordEntity> findByInvoiceId(UUID invoiceId);

    List<PaymentRecordEntity> findByStatusOrderByCreatedAtDesc(PaymentRecordStatus status);

    List<PaymentRecordEntity> findAllByOrderByCreatedAtDesc();

    @Query("""
        SELECT p FROM PaymentRecordEntity p
        WHERE p.status IN :statuses AND p.dueDate < :today
        ORDER BY p.dueDate ASC
        """)
    List<PaymentRecordEntity> findOverdue(@Param("statuses") Collection<PaymentRecordStatus> statuses,
                                          @Param("today") LocalDate today);
}
