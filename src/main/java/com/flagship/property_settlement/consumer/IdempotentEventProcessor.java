package com.flagship.property_settlement.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a handler at most once per (event id, consumer group).
 *
 * The handler's writes and the processed marker commit together. If the handler
 * throws, both roll back and the exception reaches the listener container, which
 * redelivers the record and eventually dead-letters it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, UUID propertyId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, propertyId, consumerGroup)));

        log.debug("Successfully processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event this consumer does not handle, so a replay does not look at it again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, UUID propertyId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, propertyId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
