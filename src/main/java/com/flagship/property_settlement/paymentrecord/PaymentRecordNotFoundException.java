package com.flagship.property_settlement.paymentrecord;

import com.flagship.property_settlement.exception.ResourceNotFoundException;

import java.util.UUID;

public class PaymentRecordNotFoundException extends ResourceNotFoundException {

    public PaymentRecordNotFoundException(UUID id) {
        super("Payment record not found: " + id);
    }
}
