package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.AccountCategory;
import com.flagship.finance_tracker.ledger.AccountChanges;
import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request DTO for editing an account. Absent fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateAccountRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("account_category")
    AccountCategory category;

    @DecimalMin(value = "0", message = "Credit limit cannot be negative")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @DecimalMin(value = "0", message = "APR cannot be negative")
    @JsonProperty("apr")
    BigDecimal apr;

    @DecimalMin(value = "0", message = "Minimum payment cannot be negative")
    @JsonProperty("minimum_payment")
    BigDecimal minimumPayment;

    @DecimalMin(value = "0", message = "Starting balance cannot be negative")
    @JsonProperty("starting_balance")
    BigDecimal startingBalance;

    public AccountChanges toChanges() {
        return AccountChanges.builder()
            .name(name)
            .balance(balance)
            .category(category)
            .creditLimit(creditLimit)
            .annualPercentageRate(apr)
            .minimumPayment(minimumPayment)
            .startingBalance(startingBalance)
            .build();
    }
}
