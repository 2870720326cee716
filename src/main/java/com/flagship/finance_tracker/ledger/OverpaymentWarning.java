package com.flagship.finance_tracker.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A debt account that an operation would push above zero.
 * Carries enough detail for the caller to decide and re-issue the operation with the guard bypassed.
 */
@Value
public class OverpaymentWarning {
    String accountId;
    String accountName;
    BigDecimal currentBalance;
    BigDecimal delta;
    BigDecimal resultingBalance;
}
