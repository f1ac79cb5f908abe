package com.flagship.property_settlement.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the settlement workflow.
 *
 * The correlation id flows from the HTTP request into every log line, into the
 * history entry's request metadata and into outbox payloads, so a notification
 * delivered minutes later can still be traced back to the request that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PROPERTY_ID_MDC_KEY = "propertyId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Runs with the given correlation id in both the thread-local and the MDC,
     * restoring a clean state afterwards. Used by background consumers that pick
     * up work carrying the id of the request that produced it.
     */
    public static void runWith(String id, Runnable action) {
        setCorrelationId(id);
        MDC.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
        try {
            action.run();
        } finally {
            clear();
            MDC.remove(CORRELATION_ID_MDC_KEY);
            MDC.remove(PROPERTY_ID_MDC_KEY);
            MDC.remove(INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Tags subsequent log lines on this thread with the property being worked on.
     */
    public static void tagProperty(UUID propertyId) {
        if (propertyId != null) {
            MDC.put(PROPERTY_ID_MDC_KEY, propertyId.toString());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
