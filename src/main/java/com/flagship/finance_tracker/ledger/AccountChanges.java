package com.flagship.finance_tracker.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial account update. Null fields are left unchanged.
 */
@Value
@Builder
public class AccountChanges {
    String name;
    BigDecimal balance;
    AccountCategory category;
    BigDecimal creditLimit;
    BigDecimal annualPercentageRate;
    BigDecimal minimumPayment;
    BigDecimal startingBalance;
}
