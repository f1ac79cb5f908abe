package com.flagship.property_settlement.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_settlement.config.JacksonConfig;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import com.flagship.property_settlement.notification.NotificationEventHandler;
import com.flagship.property_settlement.notification.event.InvoiceGeneratedEvent;
import com.flagship.property_settlement.notification.event.StatusChangedEvent;
import com.flagship.property_settlement.property.SalesStatus;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NotificationEventConsumerTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private IdempotentEventProcessor eventProcessor;
    private NotificationEventHandler eventHandler;
    private Acknowledgment ack;
    private NotificationEventConsumer consumer;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        eventHandler = mock(NotificationEventHandler.class);
        ack = mock(Acknowledgment.class);
        consumer = new NotificationEventConsumer(eventProcessor, eventHandler, objectMapper);

        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any())).thenAnswer(invocation -> {
            Runnable handler = invocation.getArgument(4);
            handler.run();
            return true;
        });
    }

    private ConsumerRecord<String, String> record(UUID propertyId, String json) {
        return new ConsumerRecord<>("property-notifications", 0, 42L, propertyId.toString(), json);
    }

    @Test
    @DisplayName("Status change is routed to the handler and acknowledged")
    void statusChanged_routed() throws Exception {
        UUID propertyId = UUID.randomUUID();
        StatusChangedEvent event = new StatusChangedEvent(UUID.randomUUID(), UUID.randomUUID(), propertyId,
                "12 Harbour Street", UUID.randomUUID(), "sam@example.test", null, SalesStatus.SETTLED,
                UUID.randomUUID(), "Alex Agent", "corr-1", Instant.parse("2026-03-01T10:00:00Z"));

        consumer.consume(record(propertyId, objectMapper.writeValueAsString(event)), ack);

        ArgumentCaptor<StatusChangedEvent> captor = ArgumentCaptor.forClass(StatusChangedEvent.class);
        verify(eventHandler).onStatusChanged(captor.capture());
        assertEquals(event, captor.getValue());
        verify(eventProcessor).processEvent(eq(event.getEventId()), eq(StatusChangedEvent.EVENT_TYPE),
                eq(propertyId), eq(NotificationEventConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Invoice announcement is routed to the invoice handler")
    void invoiceGenerated_routed() throws Exception {
        UUID propertyId = UUID.randomUUID();
        InvoiceGeneratedEvent event = new InvoiceGeneratedEvent(UUID.randomUUID(), UUID.randomUUID(), propertyId,
                "12 Harbour Street", UUID.randomUUID(), "INV-2026-000001", InvoiceCategory.SETTLEMENT_COMMISSION,
                "corr-2", Instant.parse("2026-03-01T10:00:00Z"));

        consumer.consume(record(propertyId, objectMapper.writeValueAsString(event)), ack);

        verify(eventHandler).onInvoiceGenerated(event);
        verify(eventHandler, never()).onStatusChanged(any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown task types are marked skipped")
    void unknownType_skipped() {
        UUID propertyId = UUID.randomUUID();
        UUID eventId = UUID.randomUUID();
        String json = "{\"eventId\":\"" + eventId + "\",\"propertyId\":\"" + propertyId + "\",\"eventType\":\"Archived\"}";

        consumer.consume(record(propertyId, json), ack);

        verify(eventProcessor).skipEvent(eventId, "Archived", propertyId,
                NotificationEventConsumer.CONSUMER_GROUP, "Unknown event type");
        verifyNoInteractions(eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Malformed payload is rejected without acknowledging")
    void malformedPayload_notAcknowledged() {
        UUID propertyId = UUID.randomUUID();

        assertThrows(MalformedEventException.class, () -> consumer.consume(record(propertyId, "{not json"), ack));

        verifyNoInteractions(eventHandler);
        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Handler failure propagates to the container and the offset is kept")
    void handlerFailure_propagates() throws Exception {
        UUID propertyId = UUID.randomUUID();
        StatusChangedEvent event = new StatusChangedEvent(UUID.randomUUID(), UUID.randomUUID(), propertyId,
                "12 Harbour Street", UUID.randomUUID(), null, SalesStatus.CONTRACT_EXCHANGED, SalesStatus.UNCONDITIONAL,
                UUID.randomUUID(), "Alex Agent", null, Instant.parse("2026-03-01T10:00:00Z"));
        doThrow(new IllegalStateException("database unavailable")).when(eventHandler).onStatusChanged(any());

        assertThrows(IllegalStateException.class, () ->
                consumer.consume(record(propertyId, objectMapper.writeValueAsString(event)), ack));

        verify(ack, never()).acknowledge();
    }
}
