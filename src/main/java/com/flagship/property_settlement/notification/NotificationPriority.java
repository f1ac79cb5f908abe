package com.flagship.property_settlement.notification;

public enum NotificationPriority {
    NORMAL,
    HIGH
}
