package com.flagship.property_settlement.notification;

/**
 * Outbound email delivery. Implementations throw on failure so the caller can
 * record a FAILED delivery, and throw {@link EmailNotConfiguredException} when no
 * mail transport is available.
 */
public interface EmailSender {

    void send(String to, String subject, String body);
}
