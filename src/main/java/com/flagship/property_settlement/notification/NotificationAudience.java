package com.flagship.property_settlement.notification;

/**
 * USER notifications have a single recipient; ADMIN notifications are visible to every admin.
 */
public enum NotificationAudience {
    USER,
    ADMIN
}
