package com.flagship.property_settlement.history;

public enum RecipientType {
    AGENT,
    BUYER,
    SELLER,
    ADMIN
}
