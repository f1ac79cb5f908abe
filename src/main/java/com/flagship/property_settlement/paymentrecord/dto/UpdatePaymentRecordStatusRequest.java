package com.flagship.property_settlement.paymentrecord.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_settlement.paymentrecord.PaymentRecordStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class UpdatePaymentRecordStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    PaymentRecordStatus status;

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    @JsonProperty("reason")
    String reason;
}
