package com.flagship.property_settlement.exception;

/**
 * Base type for lookups that found nothing. Mapped to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
