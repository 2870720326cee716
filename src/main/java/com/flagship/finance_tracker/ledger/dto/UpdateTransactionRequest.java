package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.TransactionChanges;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class UpdateTransactionRequest {

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    public TransactionChanges toChanges() {
        return TransactionChanges.builder()
            .amount(amount)
            .date(date)
            .description(description)
            .build();
    }
}
