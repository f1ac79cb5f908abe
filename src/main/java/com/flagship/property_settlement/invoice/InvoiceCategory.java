package com.flagship.property_settlement.invoice;

/**
 * What an invoice bills for. Together with the property and counterparty it forms
 * the idempotency key of an invoice.
 */
public enum InvoiceCategory {
    SETTLEMENT_COMMISSION,
    PLATFORM_COMMISSION,
    BUYER_PAYMENT,
    OTHER
}
