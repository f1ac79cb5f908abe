package com.flagship.property_settlement.notification;

public enum NotificationType {
    STATUS_CHANGE,
    INVOICE_GENERATED,
    SYSTEM_ERROR
}
