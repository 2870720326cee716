package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A recurring or one-time bill drawn from an account.
 * {@code amount} is a positive magnitude; paying it produces a negative transaction.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Bill {
    String id;
    String name;
    BigDecimal amount;
    LocalDate dueDate;
    String accountId;
    BillFrequency frequency;

    @JsonProperty("isPaid")
    boolean paid;
}
