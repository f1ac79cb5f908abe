package com.flagship.property_settlement.history;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * How the buyer's deposit was handled. Deposits are held off-platform in the
 * agent's trust account and released once the solicitor confirms settlement.
 */
@Value
@Builder
@Jacksonized
public class DepositTerms {

    static final BigDecimal DEFAULT_PERCENTAGE = new BigDecimal("10");
    static final String OFF_PLATFORM_NOTE =
        "Deposit handled off-platform via agent trust account after solicitor confirmation.";

    BigDecimal percentage;
    BigDecimal expectedAmount;
    Handler handler;
    String currency;
    ReleaseStatus releaseStatus;
    Instant releasedAt;
    Boolean commissionDeducted;
    String notes;

    public enum Handler {
        AGENT_TRUST_ACCOUNT,
        OTHER;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum ReleaseStatus {
        PENDING,
        ELIGIBLE,
        RELEASED;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Terms recorded for every settlement: 10% of the price, already released.
     */
    public static DepositTerms offPlatform(BigDecimal price, Instant releasedAt) {
        BigDecimal expected = price == null
            ? BigDecimal.ZERO.setScale(2)
            : price.multiply(DEFAULT_PERCENTAGE).divide(new BigDecimal("100"), 2, RoundingMode.HALF_UP);
        return DepositTerms.builder()
            .percentage(DEFAULT_PERCENTAGE)
            .expectedAmount(expected)
            .handler(Handler.AGENT_TRUST_ACCOUNT)
            .currency("AUD")
            .releaseStatus(ReleaseStatus.RELEASED)
            .releasedAt(releasedAt)
            .commissionDeducted(true)
            .notes(OFF_PLATFORM_NOTE)
            .build();
    }
}
