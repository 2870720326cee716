package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for moving money between two accounts.
 */
@Value
@Builder
@Jacksonized
public class TransferRequest {

    @NotBlank(message = "From account ID is required")
    @JsonProperty("from_account_id")
    String fromAccountId;

    @NotBlank(message = "To account ID is required")
    @JsonProperty("to_account_id")
    String toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("note")
    String note;
}
