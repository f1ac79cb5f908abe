package com.flagship.property_settlement.commission;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a commission calculation. All amounts are in AUD at scale 2.
 */
@Value
public class CommissionBreakdown {
    BigDecimal propertyValue;
    /** Percentage, e.g. 1.1 for 1.1% */
    BigDecimal ratePercent;
    BigDecimal commission;
    /** Percentage, e.g. 10 for 10% */
    BigDecimal gstRatePercent;
    BigDecimal gst;
    BigDecimal total;
}
