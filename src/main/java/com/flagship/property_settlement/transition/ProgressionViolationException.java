package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.property.SalesStatus;

/**
 * Raised for a non-canonical status move when strict progression is enabled.
 */
public class ProgressionViolationException extends RuntimeException {

    private final SalesStatus from;
    private final SalesStatus to;

    public ProgressionViolationException(SalesStatus from, SalesStatus to) {
        super(String.format("Invalid sales status progression from %s to %s",
            SalesStatus.displayNameOf(from), SalesStatus.displayNameOf(to)));
        this.from = from;
        this.to = to;
    }

    public SalesStatus getFrom() {
        return from;
    }

    public SalesStatus getTo() {
        return to;
    }
}
