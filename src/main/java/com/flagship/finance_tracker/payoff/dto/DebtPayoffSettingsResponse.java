package com.flagship.finance_tracker.payoff.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.payoff.DebtPayoffMode;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DebtPayoffSettingsResponse {

    @JsonProperty("mode")
    DebtPayoffMode mode;

    @JsonProperty("monthly_allocation")
    BigDecimal monthlyAllocation;

    @JsonProperty("show_interest")
    boolean showInterest;

    public static DebtPayoffSettingsResponse from(DebtPayoffSettings settings) {
        return DebtPayoffSettingsResponse.builder()
            .mode(settings.getMode())
            .monthlyAllocation(settings.getMonthlyAllocation())
            .showInterest(settings.isShowInterest())
            .build();
    }
}
