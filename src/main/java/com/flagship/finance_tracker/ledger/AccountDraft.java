package com.flagship.finance_tracker.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Input for creating an account. Debt-only fields are ignored for assets.
 */
@Value
@Builder
public class AccountDraft {
    String name;
    BigDecimal balance;
    AccountCategory category;
    BigDecimal creditLimit;
    BigDecimal annualPercentageRate;
    BigDecimal minimumPayment;
    BigDecimal startingBalance;
}
