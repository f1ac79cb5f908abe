package com.flagship.property_settlement.invoice;

public enum PaymentMethod {
    BANK_TRANSFER,
    CREDIT_CARD,
    PAYPAL,
    CHECK,
    CASH,
    STRIPE,
    STRIPE_CHECKOUT
}
