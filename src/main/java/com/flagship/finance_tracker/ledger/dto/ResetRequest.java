package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for a reset: transactions, transfers, transactions-transfers or all.
 */
@Value
@Builder
@Jacksonized
public class ResetRequest {

    @NotBlank(message = "Scope is required")
    @JsonProperty("scope")
    String scope;
}
