package com.flagship.finance_tracker.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial transaction update. Null fields are left unchanged.
 */
@Value
@Builder
public class TransactionChanges {
    BigDecimal amount;
    LocalDate date;
    String description;
}
