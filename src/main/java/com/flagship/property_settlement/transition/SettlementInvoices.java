package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceResult;
import lombok.Value;

import java.util.List;

/**
 * Invoices produced while settling. Any of the results may be null; a null seller
 * result with {@code sellerFailure} set means the commission invoice could not be
 * created. {@code toAnnounce} holds newly created invoices only.
 */
@Value
public class SettlementInvoices {
    InvoiceResult seller;
    InvoiceResult buyer;
    InvoiceResult platform;
    String sellerFailure;
    List<Invoice> toAnnounce;

    public static SettlementInvoices none() {
        return new SettlementInvoices(null, null, null, null, List.of());
    }

    public boolean sellerFailed() {
        return sellerFailure != null;
    }
}
