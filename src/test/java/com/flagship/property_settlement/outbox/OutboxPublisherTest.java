package com.flagship.property_settlement.outbox;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox delivery to Kafka.
 *
 * Verifies that:
 * - tasks reach the notifications topic keyed by property id, in order
 * - delivered tasks are marked published and not sent twice
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("property_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean is needed but passes are triggered by the test
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("consumer.enabled", () -> "false");
        registry.add("sales.recovery.enabled", () -> "false");
        registry.add("invoice.overdue-sweep.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Value("${kafka.topic.notifications:property-notifications}")
    private String notificationsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        repository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(notificationsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private OutboxEvent save(UUID propertyId, String eventType) {
        return transactionTemplate.execute(status -> outboxService.saveEvent("Property", propertyId, eventType,
                Map.of("eventType", eventType, "propertyId", propertyId.toString())));
    }

    private List<ConsumerRecord<String, String>> pollFor(UUID propertyId, int expected, Duration timeout) {
        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (received.size() < expected && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (propertyId.toString().equals(record.key())) {
                    received.add(record);
                }
            });
        }
        return received;
    }

    @Test
    @DisplayName("Tasks are delivered keyed by property in sequence order")
    void publish_sendsInOrder() {
        UUID propertyId = UUID.randomUUID();
        save(propertyId, "StatusChanged");
        save(propertyId, "InvoiceGenerated");

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = pollFor(propertyId, 2, Duration.ofSeconds(20));
        assertEquals(2, records.size());
        assertTrue(records.get(0).value().contains("StatusChanged"));
        assertTrue(records.get(1).value().contains("InvoiceGenerated"));
        assertEquals(records.get(0).partition(), records.get(1).partition());
    }

    @Test
    @DisplayName("Delivered tasks are marked published and not sent again")
    void publish_marksPublished() {
        UUID propertyId = UUID.randomUUID();
        OutboxEvent event = save(propertyId, "StatusChanged");

        outboxPublisher.triggerPublish();
        assertEquals(1, pollFor(propertyId, 1, Duration.ofSeconds(20)).size());

        OutboxEvent stored = outboxService.getEventsForAggregate("Property", propertyId).get(0);
        assertEquals(event.getId(), stored.getId());
        assertTrue(stored.isPublished());
        assertEquals(0, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();
        assertTrue(pollFor(propertyId, 1, Duration.ofSeconds(3)).isEmpty());
    }
}
