package com.flagship.property_settlement.property;

public enum AgentRole {
    LISTING,
    SELLING,
    CO_LISTING
}
