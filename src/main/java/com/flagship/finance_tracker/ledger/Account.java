package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * A tracked account.
 *
 * Balances are materialized running totals: every change to {@code balance}
 * goes through the ledger together with a transaction record. Debt balances
 * are stored as non-positive numbers, so paying a debt down moves it toward zero.
 *
 * Instances are immutable; the ledger replaces them on every change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Account {
    String id;
    String name;
    BigDecimal balance;

    @JsonProperty("accountCategory")
    AccountCategory category;

    // Debt-only attributes
    BigDecimal creditLimit;

    @JsonProperty("apr")
    BigDecimal annualPercentageRate;

    BigDecimal minimumPayment;

    /**
     * Balance magnitude when tracking began, used to measure payoff progress.
     */
    BigDecimal startingBalance;

    @JsonIgnore
    public boolean isDebt() {
        return category == AccountCategory.DEBT;
    }

    /**
     * Returns a copy with {@code delta} added to the balance.
     */
    public Account applyDelta(BigDecimal delta) {
        return toBuilder().balance(balance.add(delta)).build();
    }
}
