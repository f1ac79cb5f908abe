package com.flagship.property_settlement.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Success envelope shared by all endpoints: {@code {success, message, data}}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    boolean success;
    String message;
    T data;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }
}
