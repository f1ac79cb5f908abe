package com.flagship.property_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_settlement.invoice.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RecordPaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @Size(max = 100, message = "Reference cannot exceed 100 characters")
    @JsonProperty("reference")
    String reference;
}
