package com.flagship.property_settlement.invoice;

/**
 * The party an invoice is addressed to.
 */
public enum CounterpartyRole {
    SELLER,
    BUYER
}
