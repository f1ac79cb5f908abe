package com.flagship.property_settlement.history;

public enum DeliveryStatus {
    SENT,
    DELIVERED,
    FAILED,
    SKIPPED
}
