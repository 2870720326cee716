package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for recording a transaction. Positive amounts are inflows,
 * negative amounts are outflows. The date defaults to today.
 */
@Value
@Builder
@Jacksonized
public class CreateTransactionRequest {

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;
}
