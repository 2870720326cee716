package com.flagship.finance_tracker.payoff.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.payoff.DebtPayoffMode;
import com.flagship.finance_tracker.payoff.DebtPayoffResult;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import com.flagship.finance_tracker.payoff.DebtProjection;
import com.flagship.finance_tracker.payoff.PayoffMonth;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a payoff projection together with the settings that produced it.
 */
@Value
@Builder
public class DebtPayoffResponse {

    @JsonProperty("settings")
    DebtPayoffSettingsResponse settings;

    @JsonProperty("mode")
    DebtPayoffMode mode;

    @JsonProperty("insufficient_allocation")
    boolean insufficientAllocation;

    @JsonProperty("total_minimum_payments")
    double totalMinimumPayments;

    @JsonProperty("next_debt_id")
    String nextDebtId;

    @JsonProperty("next_debt_estimated_payoff_date")
    LocalDate nextDebtEstimatedPayoffDate;

    @JsonProperty("overall_estimated_debt_free_date")
    LocalDate overallEstimatedDebtFreeDate;

    @JsonProperty("progress_to_next_debt")
    double progressToNextDebt;

    @JsonProperty("progress_total_paid")
    double progressTotalPaid;

    @JsonProperty("debts")
    List<Debt> debts;

    @JsonProperty("schedule")
    List<Month> schedule;

    public static DebtPayoffResponse from(DebtPayoffResult result, DebtPayoffSettings settings) {
        return DebtPayoffResponse.builder()
            .settings(DebtPayoffSettingsResponse.from(settings))
            .mode(result.getMode())
            .insufficientAllocation(result.isInsufficientAllocation())
            .totalMinimumPayments(result.getTotalMinimumPayments())
            .nextDebtId(result.getNextDebtId())
            .nextDebtEstimatedPayoffDate(result.getNextDebtEstimatedPayoffDate())
            .overallEstimatedDebtFreeDate(result.getOverallEstimatedDebtFreeDate())
            .progressToNextDebt(result.getProgressToNextDebt())
            .progressTotalPaid(result.getProgressTotalPaid())
            .debts(result.getDebts().stream().map(Debt::from).toList())
            .schedule(result.getSchedule().stream().map(Month::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Debt {

        @JsonProperty("id")
        String id;

        @JsonProperty("name")
        String name;

        @JsonProperty("balance")
        double balance;

        @JsonProperty("minimum_payment")
        double minimumPayment;

        @JsonProperty("apr")
        double apr;

        @JsonProperty("starting_balance")
        double startingBalance;

        @JsonProperty("estimated_monthly_interest")
        double estimatedMonthlyInterest;

        @JsonProperty("estimated_payoff_date")
        LocalDate estimatedPayoffDate;

        static Debt from(DebtProjection projection) {
            return Debt.builder()
                .id(projection.getId())
                .name(projection.getName())
                .balance(projection.getBalance())
                .minimumPayment(projection.getMinimumPayment())
                .apr(projection.getApr())
                .startingBalance(projection.getStartingBalance())
                .estimatedMonthlyInterest(projection.getEstimatedMonthlyInterest())
                .estimatedPayoffDate(projection.getEstimatedPayoffDate())
                .build();
        }
    }

    @Value
    @Builder
    public static class Month {

        @JsonProperty("month")
        int month;

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("balances")
        Map<String, Double> balances;

        @JsonProperty("total_remaining")
        double totalRemaining;

        static Month from(PayoffMonth month) {
            return Month.builder()
                .month(month.getMonth())
                .date(month.getDate())
                .balances(month.getBalances())
                .totalRemaining(month.getTotalRemaining())
                .build();
        }
    }
}
