package com.flagship.property_settlement.commission;

import com.flagship.property_settlement.invoice.InvoiceCategory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure amount computation per invoice category.
 *
 * Rates are fixed: callers cannot override them. The commission is rounded
 * HALF_UP to cents before GST is derived from it, so
 * {@code total == commission + gst} always holds exactly.
 */
@Component
public class CommissionCalculator {

    public static final BigDecimal SETTLEMENT_COMMISSION_RATE = new BigDecimal("1.1");
    public static final BigDecimal PLATFORM_COMMISSION_RATE = new BigDecimal("0.55");
    public static final BigDecimal BUYER_PAYMENT_RATE = new BigDecimal("10");
    public static final BigDecimal GST_RATE = new BigDecimal("10");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public CommissionBreakdown calculate(InvoiceCategory category, BigDecimal propertyValue) {
        if (category == null) {
            throw new IllegalArgumentException("Invoice category is required");
        }
        if (propertyValue == null || propertyValue.signum() < 0) {
            throw new IllegalArgumentException("Property value must be zero or positive");
        }
        BigDecimal rate = rateFor(category);
        BigDecimal commission = percentOf(propertyValue, rate);
        BigDecimal gst = percentOf(commission, GST_RATE);
        return new CommissionBreakdown(
            propertyValue.setScale(2, RoundingMode.HALF_UP),
            rate,
            commission,
            GST_RATE,
            gst,
            commission.add(gst)
        );
    }

    public BigDecimal rateFor(InvoiceCategory category) {
        return switch (category) {
            case SETTLEMENT_COMMISSION -> SETTLEMENT_COMMISSION_RATE;
            case PLATFORM_COMMISSION -> PLATFORM_COMMISSION_RATE;
            case BUYER_PAYMENT -> BUYER_PAYMENT_RATE;
            case OTHER -> throw new IllegalArgumentException("No fixed rate for category OTHER");
        };
    }

    static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent)
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }
}
