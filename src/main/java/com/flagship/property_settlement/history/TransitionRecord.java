package com.flagship.property_settlement.history;

import com.flagship.property_settlement.property.SalesStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * The facts of a transition, as handed to the recorder.
 */
@Value
@Builder
public class TransitionRecord {
    UUID propertyId;
    SalesStatus previousStatus;
    SalesStatus newStatus;
    UUID changedBy;
    String changeReason;
    RequestMetadata metadata;
    SettlementDetails settlementDetails;
    UUID requestedSellerId;
    UUID requestedBuyerId;
}
