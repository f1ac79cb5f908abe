package com.flagship.property_settlement.paymentrecord;

/**
 * Reconciliation state of a seller's commission payment.
 *
 * CANCELLED and REFUNDED are terminal. A COMPLETED record can only be refunded;
 * a FAILED record can be retried.
 */
public enum PaymentRecordStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    REFUNDED;

    public boolean canTransitionTo(PaymentRecordStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case PENDING, PROCESSING -> target != REFUNDED;
            case FAILED -> target == PENDING || target == PROCESSING || target == COMPLETED
                    || target == CANCELLED;
            case COMPLETED -> target == REFUNDED;
            case CANCELLED, REFUNDED -> false;
        };
    }
}
