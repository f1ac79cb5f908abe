package com.flagship.property_settlement.consumer;

/**
 * A record on the notifications topic that cannot be parsed. Not retried:
 * the error handler sends it straight to the dead-letter topic.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
