package com.flagship.property_settlement.property;

/**
 * Listing lifecycle status, independent of the sales pipeline.
 */
public enum ListingStatus {
    DRAFT,
    PENDING,
    REVIEW,
    ACTIVE,
    SOLD,
    WITHDRAWN,
    REJECTED
}
