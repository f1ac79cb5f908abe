package com.flagship.property_settlement.history;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class BankDetails {
    String accountName;
    String bsb;
    String accountNumber;
}
