package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.MutationResult;
import com.flagship.finance_tracker.ledger.OverpaymentWarning;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Envelope for every mutating endpoint.
 *
 * A pending outcome lists the debt accounts that would be overpaid; the
 * client re-sends the same request with {@code ?confirm=true} to apply it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class MutationResponse<T> {

    @JsonProperty("outcome")
    MutationResult.Outcome outcome;

    @JsonProperty("result")
    T result;

    @JsonProperty("warnings")
    List<Warning> warnings;

    @JsonProperty("reason")
    String reason;

    public static <S, T> MutationResponse<T> from(MutationResult<S> mutation, Function<S, T> mapper) {
        return MutationResponse.<T>builder()
            .outcome(mutation.getOutcome())
            .result(mutation.isApplied() ? mapper.apply(mutation.getValue()) : null)
            .warnings(mutation.getWarnings().stream().map(Warning::from).toList())
            .reason(mutation.getReason())
            .build();
    }

    @Value
    @Builder
    public static class Warning {

        @JsonProperty("account_id")
        String accountId;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("current_balance")
        BigDecimal currentBalance;

        @JsonProperty("delta")
        BigDecimal delta;

        @JsonProperty("resulting_balance")
        BigDecimal resultingBalance;

        static Warning from(OverpaymentWarning warning) {
            return Warning.builder()
                .accountId(warning.getAccountId())
                .accountName(warning.getAccountName())
                .currentBalance(warning.getCurrentBalance())
                .delta(warning.getDelta())
                .resultingBalance(warning.getResultingBalance())
                .build();
        }
    }
}
