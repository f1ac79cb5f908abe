package com.flagship.property_settlement.invoice;

import lombok.Value;

/**
 * Outcome of a get-or-create call. {@code alreadyExisted} is true when the
 * returned invoice was created by an earlier (or concurrent) request.
 */
@Value
public class InvoiceResult {
    Invoice invoice;
    boolean alreadyExisted;

    public static InvoiceResult created(Invoice invoice) {
        return new InvoiceResult(invoice, false);
    }

    public static InvoiceResult existing(Invoice invoice) {
        return new InvoiceResult(invoice, true);
    }
}
