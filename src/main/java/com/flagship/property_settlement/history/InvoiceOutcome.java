package com.flagship.property_settlement.history;

import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceResult;
import com.flagship.property_settlement.invoice.InvoiceStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Invoice produced (or reused) by a transition, as recorded on the history entry.
 * Column names are supplied by attribute overrides on the owning entity.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class InvoiceOutcome {

    @Column(name = "generated")
    private Boolean generated;

    @Column(name = "invoice_id")
    private UUID invoiceId;

    @Column(name = "invoice_number", length = 30)
    private String invoiceNumber;

    @Column(name = "generated_at")
    private Instant generatedAt;

    @Column(name = "amount", precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20)
    private InvoiceStatus status;

    @Column(name = "already_existed")
    private Boolean alreadyExisted;

    public static InvoiceOutcome of(InvoiceResult result, Instant at) {
        Invoice invoice = result.getInvoice();
        return new InvoiceOutcome(
            true,
            invoice.getId(),
            invoice.getInvoiceNumber(),
            at,
            invoice.getTotalAmount(),
            invoice.getStatus(),
            result.isAlreadyExisted()
        );
    }

    public boolean wasGenerated() {
        return Boolean.TRUE.equals(generated);
    }
}
