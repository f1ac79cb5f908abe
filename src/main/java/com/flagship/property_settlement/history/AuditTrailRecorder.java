package com.flagship.property_settlement.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes and reads the property status audit trail.
 *
 * Every method runs in its own transaction unless the caller already has one,
 * so the entry written by {@link #record} survives a later invoice failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailRecorder {

    static final int AGENT_HISTORY_LIMIT = 50;

    private final StatusHistoryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Inserts a new entry in PROCESSING state.
     */
    @Transactional
    public StatusHistoryEntry record(TransitionRecord transition) {
        if (transition.getPropertyId() == null || transition.getNewStatus() == null
                || transition.getChangedBy() == null || transition.getMetadata() == null) {
            throw new IllegalArgumentException("Property, new status, actor and request metadata are required");
        }
        String reason = transition.getChangeReason();
        if (reason != null && reason.length() > 500) {
            throw new IllegalArgumentException("Change reason cannot exceed 500 characters");
        }
        PropertyStatusHistoryEntity entity = PropertyStatusHistoryEntity.processing(
            transition, serialize(transition.getSettlementDetails()));
        PropertyStatusHistoryEntity saved = repository.save(entity);

        log.info("Status change recorded: {} -> {} for property {}",
                transition.getPreviousStatus() == null ? "null" : transition.getPreviousStatus(),
                transition.getNewStatus(), transition.getPropertyId());
        return toEntry(saved);
    }

    @Transactional
    public StatusHistoryEntry attachInvoice(UUID entryId, InvoiceOutcome outcome) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.attachInvoice(outcome);
        return toEntry(repository.save(entity));
    }

    @Transactional
    public StatusHistoryEntry attachBuyerInvoice(UUID entryId, InvoiceOutcome outcome) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.attachBuyerInvoice(outcome);
        return toEntry(repository.save(entity));
    }

    /**
     * Appends to the error log without changing the processing status.
     */
    @Transactional
    public StatusHistoryEntry appendError(UUID entryId, String error) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.appendError(error, Instant.now(clock));
        return toEntry(repository.save(entity));
    }

    @Transactional
    public StatusHistoryEntry markProcessed(UUID entryId) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.markProcessed();
        return toEntry(repository.save(entity));
    }

    @Transactional
    public StatusHistoryEntry markFailed(UUID entryId, String error) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.markFailed(error, Instant.now(clock));
        log.warn("History entry {} marked as failed: {}", entryId, error);
        return toEntry(repository.save(entity));
    }

    @Transactional
    public void recordNotification(UUID entryId, NotificationDelivery delivery) {
        PropertyStatusHistoryEntity entity = load(entryId);
        entity.addNotification(delivery);
        repository.save(entity);
    }

    @Transactional(readOnly = true)
    public StatusHistoryEntry findById(UUID entryId) {
        return toEntry(load(entryId));
    }

    @Transactional(readOnly = true)
    public List<StatusHistoryEntry> historyForProperty(UUID propertyId) {
        return repository.findByPropertyIdOrderByCreatedAtDesc(propertyId).stream()
                .map(this::toEntry)
                .toList();
    }

    /**
     * Latest 50 entries created by the agent.
     */
    @Transactional(readOnly = true)
    public List<StatusHistoryEntry> historyForAgent(UUID agentId) {
        return repository.findByChangedByOrderByCreatedAtDesc(agentId, PageRequest.of(0, AGENT_HISTORY_LIMIT))
                .stream()
                .map(this::toEntry)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<StatusHistoryEntry> findByProcessingStatus(ProcessingStatus status, int limit) {
        return repository.findByProcessingStatusOrderByCreatedAtDesc(status, PageRequest.of(0, limit)).stream()
                .map(this::toEntry)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<StatusHistoryEntry> findStalled(Instant cutoff, int limit) {
        return repository.findStalled(cutoff, PageRequest.of(0, limit)).stream()
                .map(this::toEntry)
                .toList();
    }

    private PropertyStatusHistoryEntity load(UUID entryId) {
        return repository.findById(entryId)
                .orElseThrow(() -> new IllegalArgumentException("Status history entry not found: " + entryId));
    }

    private StatusHistoryEntry toEntry(PropertyStatusHistoryEntity entity) {
        return new StatusHistoryEntry(
            entity.getId(),
            entity.getPropertyId(),
            entity.getPreviousStatus(),
            entity.getNewStatus(),
            entity.getChangedBy(),
            entity.getChangeReason(),
            entity.getMetadata(),
            deserialize(entity.getSettlementDetails()),
            entity.getRequestedSellerId(),
            entity.getRequestedBuyerId(),
            entity.getInvoice(),
            entity.getBuyerInvoice(),
            List.copyOf(entity.getNotifications()),
            entity.getProcessingStatus(),
            List.copyOf(entity.getErrorLog()),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    private String serialize(SettlementDetails details) {
        if (details == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize settlement details", e);
        }
    }

    private SettlementDetails deserialize(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SettlementDetails.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored settlement details are not readable", e);
        }
    }
}
