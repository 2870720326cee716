package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single balance movement on one account.
 *
 * Positive amounts are inflows, negative amounts are outflows. Transfer legs
 * share a {@code transferGroupId} with exactly one partner of opposite sign.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Transaction {
    String id;
    String accountId;
    BigDecimal amount;
    LocalDate date;
    String description;
    TransactionKind kind;
    String transferGroupId;

    @JsonIgnore
    public boolean isTransferKind() {
        return kind == TransactionKind.TRANSFER_LEG;
    }
}
