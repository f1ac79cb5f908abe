package com.flagship.property_settlement.history;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Settlement information supplied with a status change, stored verbatim on the
 * history entry (plus deposit terms for SETTLED).
 *
 * {@code commissionRate} is accepted and range-checked for compatibility with
 * older clients but never used: commission rates are fixed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SettlementDetails {
    LocalDate settlementDate;
    BigDecimal settlementAmount;
    String solicitorName;
    String solicitorEmail;
    String conveyancerName;
    String conveyancerEmail;
    BankDetails bankDetails;
    BigDecimal commissionRate;
    Boolean legalReleaseConfirmed;
    DepositTerms deposit;

    public static SettlementDetails empty() {
        return SettlementDetails.builder().build();
    }

    public boolean hasLegalRelease() {
        return Boolean.TRUE.equals(legalReleaseConfirmed);
    }

    /**
     * Trims names and lower-cases emails.
     */
    public SettlementDetails sanitized() {
        return toBuilder()
            .solicitorName(trim(solicitorName))
            .solicitorEmail(email(solicitorEmail))
            .conveyancerName(trim(conveyancerName))
            .conveyancerEmail(email(conveyancerEmail))
            .build();
    }

    public SettlementDetails withDeposit(DepositTerms terms) {
        return toBuilder().deposit(terms).build();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static String email(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
