package com.flagship.finance_tracker.payoff.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.payoff.DebtPayoffMode;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request DTO for the payoff planner settings. A negative allocation is
 * accepted and stored as zero.
 */
@Value
@Builder
@Jacksonized
public class DebtPayoffSettingsRequest {

    @NotNull(message = "Mode is required")
    @JsonProperty("mode")
    DebtPayoffMode mode;

    @NotNull(message = "Monthly allocation is required")
    @JsonProperty("monthly_allocation")
    BigDecimal monthlyAllocation;

    @JsonProperty("show_interest")
    boolean showInterest;

    public DebtPayoffSettings toSettings() {
        return DebtPayoffSettings.builder()
            .mode(mode)
            .monthlyAllocation(monthlyAllocation)
            .showInterest(showInterest)
            .build();
    }
}
