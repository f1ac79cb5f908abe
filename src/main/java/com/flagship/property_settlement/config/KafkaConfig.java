package com.flagship.property_settlement.config;

import com.flagship.property_settlement.consumer.MalformedEventException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Notifications topic, its dead-letter topic and the listener error handling.
 *
 * A record whose handler keeps failing is retried with a fixed back-off and then
 * published to {@code <topic>.DLT} on the same partition, so both topics share a
 * partition count.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    static final int PARTITIONS = 3;

    @Value("${kafka.topic.notifications:property-notifications}")
    private String notificationsTopic;

    @Value("${consumer.retry.interval-ms:1000}")
    private long retryIntervalMs;

    @Value("${consumer.retry.max-attempts:3}")
    private long retryMaxAttempts;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic notificationsDeadLetterTopic() {
        return TopicBuilder.name(notificationsTopic + ".DLT")
                .partitions(PARTITIONS)
                .replicas(1)
                .build();
    }

    @Bean
    public DefaultErrorHandler kafkaErrorHandler(KafkaTemplate<String, String> kafkaTemplate) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate);
        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer,
                new FixedBackOff(retryIntervalMs, retryMaxAttempts));
        handler.addNotRetryableExceptions(MalformedEventException.class);
        handler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Notification delivery attempt {} failed for offset {}: {}",
                        deliveryAttempt, record.offset(), ex.getMessage()));
        return handler;
    }
}
