package com.flagship.property_settlement.invoice;

/**
 * Invoice lifecycle status.
 *
 * Valid transitions:
 * - DRAFT/PENDING -> SENT -> VIEWED
 * - any open status -> PARTIALLY_PAID -> PAID (driven by recorded payments)
 * - PENDING/SENT/VIEWED/PARTIALLY_PAID -> OVERDUE (due date passed)
 * - any status except PAID/REFUNDED -> CANCELLED
 */
public enum InvoiceStatus {
    DRAFT,
    PENDING,
    SENT,
    VIEWED,
    PARTIALLY_PAID,
    PAID,
    OVERDUE,
    CANCELLED,
    REFUNDED;

    public boolean acceptsPayments() {
        return this != CANCELLED && this != REFUNDED && this != PAID;
    }

    public boolean isSettled() {
        return this == PAID || this == CANCELLED || this == REFUNDED;
    }
}
