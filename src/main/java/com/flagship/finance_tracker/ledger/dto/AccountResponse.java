package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.Account;
import com.flagship.finance_tracker.ledger.AccountCategory;
import com.flagship.finance_tracker.ledger.MoneyFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO for an account.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("display_balance")
    String displayBalance;

    @JsonProperty("account_category")
    AccountCategory category;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("apr")
    BigDecimal apr;

    @JsonProperty("minimum_payment")
    BigDecimal minimumPayment;

    @JsonProperty("starting_balance")
    BigDecimal startingBalance;

    public static AccountResponse from(Account account, boolean hideMoney) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .balance(account.getBalance())
            .displayBalance(MoneyFormat.format(account.getBalance(), hideMoney))
            .category(account.getCategory())
            .creditLimit(account.getCreditLimit())
            .apr(account.getAnnualPercentageRate())
            .minimumPayment(account.getMinimumPayment())
            .startingBalance(account.getStartingBalance())
            .build();
    }
}
