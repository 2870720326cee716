package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.Bill;
import com.flagship.finance_tracker.ledger.BillFrequency;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for creating or replacing a bill.
 */
@Value
@Builder
@Jacksonized
public class BillRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("frequency")
    BillFrequency frequency;

    @JsonProperty("is_paid")
    boolean paid;

    public Bill toBill() {
        return Bill.builder()
            .name(name)
            .amount(amount)
            .dueDate(dueDate)
            .accountId(accountId)
            .frequency(frequency)
            .paid(paid)
            .build();
    }
}
