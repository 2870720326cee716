package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PreferencesRequest {

    @JsonProperty("net_worth_view_mode")
    String netWorthViewMode;

    @JsonProperty("hide_money")
    Boolean hideMoney;
}
