package com.flagship.property_settlement.outbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox bookkeeping.
 *
 * Verifies that:
 * - tasks are only written inside a caller transaction and roll back with it
 * - deliverable tasks come back in sequence order
 * - published and dead-lettered tasks are no longer polled
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("property_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("sales.recovery.enabled", () -> "false");
        registry.add("invoice.overdue-sweep.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID propertyId;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        propertyId = UUID.randomUUID();
    }

    private OutboxEvent save(String eventType) {
        return transactionTemplate.execute(status -> outboxService.saveEvent("Property", propertyId, eventType,
                Map.of("propertyId", propertyId.toString(), "eventType", eventType)));
    }

    @Test
    @DisplayName("Saved task carries the serialized payload and starts unpublished")
    void saveEvent_storesPayload() {
        OutboxEvent event = save("StatusChanged");

        assertEquals("Property", event.getAggregateType());
        assertEquals(propertyId, event.getAggregateId());
        assertEquals("StatusChanged", event.getEventType());
        assertTrue(event.getPayload().contains(propertyId.toString()));
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void saveEvent_requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent("Property", propertyId, "StatusChanged", Map.of()));
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Tasks roll back with the caller's transaction")
    void saveEvent_rollsBackWithCaller() {
        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent("Property", propertyId, "StatusChanged", Map.of());
            throw new IllegalStateException("finalisation failed");
        }));

        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Deliverable tasks come back in sequence order")
    void deliverable_inSequenceOrder() {
        save("InvoiceGenerationFailed");
        save("StatusChanged");
        save("InvoiceGenerated");

        List<String> types = outboxService.findDeliverableEvents(10, 5).stream()
                .map(OutboxEvent::getEventType)
                .toList();

        assertEquals(List.of("InvoiceGenerationFailed", "StatusChanged", "InvoiceGenerated"), types);
    }

    @Test
    @DisplayName("Published tasks are not polled again")
    void published_notPolled() {
        OutboxEvent first = save("StatusChanged");
        save("InvoiceGenerated");

        outboxService.markPublished(first.getId());

        List<OutboxEvent> deliverable = outboxService.findDeliverableEvents(10, 5);
        assertEquals(1, deliverable.size());
        assertEquals("InvoiceGenerated", deliverable.get(0).getEventType());
        assertEquals(1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Failures count retries until the task is dead-lettered")
    void failures_deadLetterAtMaxRetries() {
        OutboxEvent event = save("StatusChanged");

        assertEquals(1, outboxService.markFailed(event.getId(), "broker unavailable"));
        assertEquals(2, outboxService.markFailed(event.getId(), "broker unavailable"));
        assertEquals(1, outboxService.findDeliverableEvents(10, 3).size());

        assertEquals(3, outboxService.markFailed(event.getId(), "broker unavailable"));
        assertTrue(outboxService.findDeliverableEvents(10, 3).isEmpty());

        OutboxEvent stored = outboxService.getEventsForAggregate("Property", propertyId).get(0);
        assertTrue(stored.isDeadLettered(3));
        assertEquals("broker unavailable", stored.getLastError());
    }
}
