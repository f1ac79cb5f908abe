package com.flagship.property_settlement.history;

/**
 * Step marker of a transition. An entry is created PROCESSING and finalised to
 * COMPLETED or FAILED; an entry stuck in PROCESSING is resumed by recovery.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
