package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.history.SettlementDetails;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.Value;

import java.util.UUID;

/**
 * A transition that passed every check, with its inputs normalised.
 */
@Value
public class AdmittedTransition {
    PropertySnapshot property;
    SalesStatus target;
    String changeReason;
    SettlementDetails settlementDetails;
    UUID sellerId;
    UUID buyerId;
}
