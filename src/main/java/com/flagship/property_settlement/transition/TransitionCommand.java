package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.history.SettlementDetails;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A requested sales status change, before validation. {@code status} is the raw
 * value the client sent.
 */
@Value
@Builder
public class TransitionCommand {
    String propertyIdOrSlug;
    String status;
    String changeReason;
    SettlementDetails settlementDetails;
    UUID sellerId;
    UUID buyerId;
    RequestContext requestContext;
}
