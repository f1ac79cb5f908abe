package com.flagship.property_settlement.invoice;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Fully computed invoice content, ready to be numbered and inserted.
 */
@Value
@Builder
public class InvoiceDraft {
    InvoiceCategory category;
    UUID propertyId;
    UUID agentId;
    CounterpartyRole counterpartyRole;
    UUID counterpartyId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    LocalDate settlementDate;
    BigDecimal propertyValue;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    @Singular
    List<InvoiceLineItem> lineItems;
    BigDecimal gstRate;
    BigDecimal gstAmount;
    String currency;
    String paymentTerms;
    String paymentReference;
    String payeeAccountName;
    String payeeAccountNumber;
    String publicNotes;
    UUID createdBy;
}
