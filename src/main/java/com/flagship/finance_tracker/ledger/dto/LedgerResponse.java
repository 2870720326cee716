package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.payoff.dto.DebtPayoffSettingsResponse;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for the whole ledger of the active profile.
 */
@Value
@Builder
public class LedgerResponse {

    @JsonProperty("profile_id")
    String profileId;

    @JsonProperty("accounts")
    List<AccountResponse> accounts;

    @JsonProperty("deleted_accounts")
    List<AccountResponse> deletedAccounts;

    @JsonProperty("selected_account_id")
    String selectedAccountId;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("bills")
    List<BillResponse> bills;

    @JsonProperty("net_worth")
    NetWorthResponse netWorth;

    @JsonProperty("hide_money")
    boolean hideMoney;

    @JsonProperty("debt_payoff_settings")
    DebtPayoffSettingsResponse debtPayoffSettings;
}
