package com.flagship.property_settlement.notification;

public class EmailNotConfiguredException extends IllegalStateException {

    public EmailNotConfiguredException() {
        super("No mail transport configured (spring.mail.host is not set)");
    }
}
