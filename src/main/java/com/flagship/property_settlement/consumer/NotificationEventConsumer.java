package com.flagship.property_settlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_settlement.notification.NotificationEventHandler;
import com.flagship.property_settlement.notification.event.InvoiceGeneratedEvent;
import com.flagship.property_settlement.notification.event.InvoiceGenerationFailedEvent;
import com.flagship.property_settlement.notification.event.StatusChangedEvent;
import com.flagship.property_settlement.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes notification tasks and routes them to {@link NotificationEventHandler}.
 *
 * Offsets are acknowledged only after the handler and the processed-event marker
 * have committed. A handler failure propagates to the container's error handler,
 * which retries and then publishes the record to the dead-letter topic.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationEventConsumer {

    static final String CONSUMER_GROUP = "property-notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.notifications:property-notifications}",
        groupId = "${spring.kafka.consumer.group-id:property-settlement-notifications}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());

        CorrelationContext.runWith(envelope.correlationId(), () -> {
            boolean processed = route(envelope, record.value());
            if (processed) {
                log.info("Processed notification: type={}, eventId={}, propertyId={}",
                        envelope.eventType(), envelope.eventId(), envelope.propertyId());
            }
        });
        ack.acknowledge();
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case StatusChangedEvent.EVENT_TYPE -> process(envelope,
                    () -> eventHandler.onStatusChanged(deserialize(rawPayload, StatusChangedEvent.class)));
            case InvoiceGeneratedEvent.EVENT_TYPE -> process(envelope,
                    () -> eventHandler.onInvoiceGenerated(deserialize(rawPayload, InvoiceGeneratedEvent.class)));
            case InvoiceGenerationFailedEvent.EVENT_TYPE -> process(envelope,
                    () -> eventHandler.onInvoiceGenerationFailed(
                            deserialize(rawPayload, InvoiceGenerationFailedEvent.class)));
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.propertyId(),
                        CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(), envelope.propertyId(),
                CONSUMER_GROUP, handler);
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            UUID propertyId = UUID.fromString(node.get("propertyId").asText());
            String eventType = node.path("eventType").asText("Unknown");
            String correlationId = node.path("correlationId").asText(null);
            return new EventEnvelope(eventId, propertyId, eventType, correlationId);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new MalformedEventException("Failed to parse notification envelope: " + e.getMessage(), e);
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID propertyId, String eventType, String correlationId) {
    }
}
