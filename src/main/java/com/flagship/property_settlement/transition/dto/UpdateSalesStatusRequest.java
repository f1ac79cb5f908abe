package com.flagship.property_settlement.transition.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_settlement.history.SettlementDetails;
import lombok.Value;

import java.util.UUID;

/**
 * Body of a sales status update. Field rules are enforced by the transition gate so
 * they apply to every caller, not only HTTP.
 */
@Value
public class UpdateSalesStatusRequest {

    @JsonProperty("status")
    String status;

    @JsonProperty("changeReason")
    String changeReason;

    @JsonProperty("settlementDetails")
    SettlementDetails settlementDetails;

    @JsonProperty("sellerId")
    @JsonAlias("sellerID")
    UUID sellerId;

    @JsonProperty("buyerId")
    UUID buyerId;
}
