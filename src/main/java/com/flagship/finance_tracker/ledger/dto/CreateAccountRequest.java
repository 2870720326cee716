package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.AccountCategory;
import com.flagship.finance_tracker.ledger.AccountDraft;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request DTO for opening an account.
 */
@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Balance is required")
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

    public AccountDraft toDraft() {
        return AccountDraft.builder()
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
