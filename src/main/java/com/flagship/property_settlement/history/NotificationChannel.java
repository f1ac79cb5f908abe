package com.flagship.property_settlement.history;

public enum NotificationChannel {
    IN_APP,
    EMAIL,
    PUSH
}
