package com.flagship.property_settlement.history;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface StatusHistoryRepository extends JpaRepository<PropertyStatusHistoryEntity, UUID> {

    List<PropertyStatusHistoryEntity> findByPropertyIdOrderByCreatedAtDesc(UUID propertyId);

    List<PropertyStatusHistoryEntity> findByChangedByOrderByCreatedAtDesc(UUID changedBy, Pageable pageable);

    List<PropertyStatusHistoryEntity> findByProcessingStatusOrderByCreatedAtDesc(
        ProcessingStatus processingStatus, Pageable pageable);

    long countByProcessingStatus(ProcessingStatus processingStatus);

    long countByProcessingStatusAndCreatedAtBefore(ProcessingStatus processingStatus, Instant cutoff);

    /**
     * Entries still PROCESSING after the cutoff: the request that created them
     * crashed or was interrupted before finalising.
     */
    @Query("""
        SELECT h FROM PropertyStatusHistoryEntity h
        WHERE h.processingStatus = com.flagship.property_settlement.history.ProcessingStatus.PROCESSING
        AND h.createdAt < :cutoff
        ORDER BY h.createdAt ASC
        """)
    List<PropertyStatusHistoryEntity> findStalled(@Param("cutoff") Instant cutoff, Pageable pageable);
}
