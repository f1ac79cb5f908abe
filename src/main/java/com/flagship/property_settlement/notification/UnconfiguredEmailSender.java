package com.flagship.property_settlement.notification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Active when {@code spring.mail.host} is not set. Refuses every message so the
 * delivery is recorded as skipped rather than sent.
 */
@Component
@ConditionalOnExpression("'${spring.mail.host:}'.isEmpty()")
public class UnconfiguredEmailSender implements EmailSender {

    @Override
    public void send(String to, String subject, String body) {
        throw new EmailNotConfiguredException();
    }
}
