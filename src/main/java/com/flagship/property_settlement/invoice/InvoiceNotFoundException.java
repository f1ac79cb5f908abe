package com.flagship.property_settlement.invoice;

import com.flagship.property_settlement.exception.ResourceNotFoundException;

public class InvoiceNotFoundException extends ResourceNotFoundException {

    public InvoiceNotFoundException(String idOrNumber) {
        super("Invoice not found: " + idOrNumber);
    }
}
