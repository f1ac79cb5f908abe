package com.flagship.property_settlement.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error envelope: {@code {success:false, message, statusCode, details, timestamp}}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    @Builder.Default
    boolean success = false;
    String error;
    String message;
    int statusCode;
    Map<String, ?> details;
    Instant timestamp;
}
