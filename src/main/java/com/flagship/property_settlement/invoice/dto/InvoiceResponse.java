package com.flagship.property_settlement.invoice.dto;

import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import com.flagship.property_settlement.invoice.InvoiceLineItem;
import com.flagship.property_settlement.invoice.InvoicePayment;
import com.flagship.property_settlement.invoice.InvoiceStatus;
import com.flagship.property_settlement.invoice.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {
    UUID id;
    String invoiceNumber;
    InvoiceCategory category;
    UUID propertyId;
    UUID agentId;
    UUID sellerId;
    UUID buyerId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    LocalDate settlementDate;
    BigDecimal propertyValue;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    List<LineItem> lineItems;
    BigDecimal gstRate;
    BigDecimal gstAmount;
    BigDecimal subtotal;
    BigDecimal totalTax;
    BigDecimal totalAmount;
    BigDecimal amountPaid;
    BigDecimal amountDue;
    String currency;
    String paymentTerms;
    String paymentReference;
    String publicNotes;
    InvoiceStatus status;
    boolean overdue;
    long daysPastDue;
    List<Payment> payments;
    Instant createdAt;

    @Value
    public static class LineItem {
        String description;
        int quantity;
        BigDecimal unitPrice;
        BigDecimal totalPrice;
        boolean taxable;

        static LineItem from(InvoiceLineItem item) {
            return new LineItem(item.getDescription(), item.getQuantity(), item.getUnitPrice(),
                    item.getTotalPrice(), item.isTaxable());
        }
    }

    @Value
    public static class Payment {
        BigDecimal amount;
        LocalDate paymentDate;
        PaymentMethod method;
        String reference;
        UUID recordedBy;
        Instant recordedAt;

        static Payment from(InvoicePayment payment) {
            return new Payment(payment.getAmount(), payment.getPaymentDate(), payment.getMethod(),
                    payment.getReference(), payment.getRecordedBy(), payment.getRecordedAt());
        }
    }

    public static InvoiceResponse from(Invoice invoice, LocalDate today) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .category(invoice.getCategory())
            .propertyId(invoice.getPropertyId())
            .agentId(invoice.getAgentId())
            .sellerId(invoice.getSellerId())
            .buyerId(invoice.getBuyerId())
            .invoiceDate(invoice.getInvoiceDate())
            .dueDate(invoice.getDueDate())
            .settlementDate(invoice.getSettlementDate())
            .propertyValue(invoice.getPropertyValue())
            .commissionRate(invoice.getCommissionRate())
            .commissionAmount(invoice.getCommissionAmount())
            .lineItems(invoice.getLineItems().stream().map(LineItem::from).toList())
            .gstRate(invoice.getGstRate())
            .gstAmount(invoice.getGstAmount())
            .subtotal(invoice.getSubtotal())
            .totalTax(invoice.getTotalTax())
            .totalAmount(invoice.getTotalAmount())
            .amountPaid(invoice.getAmountPaid())
            .amountDue(invoice.getAmountDue())
            .currency(invoice.getCurrency())
            .paymentTerms(invoice.getPaymentTerms())
            .paymentReference(invoice.getPaymentReference())
            .publicNotes(invoice.getPublicNotes())
            .status(invoice.getStatus())
            .overdue(invoice.isOverdue(today))
            .daysPastDue(invoice.daysPastDue(today))
            .payments(invoice.getPayments().stream().map(Payment::from).toList())
            .createdAt(invoice.getCreatedAt())
            .build();
    }
}
