package com.flagship.property_settlement.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller lacks the role or assignment needed for the operation. Mapped to 403.
 */
public class ForbiddenOperationException extends RuntimeException {

    private final Map<String, String> details;

    public ForbiddenOperationException(String message, Map<String, String> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ForbiddenOperationException(String message) {
        this(message, Map.of());
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
