package com.flagship.finance_tracker.payoff;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of a payoff projection.
 *
 * When {@code insufficientAllocation} is set the simulation did not run:
 * there are no payoff dates and no schedule, and progress is measured from
 * current balances against starting balances.
 */
@Value
@Builder
public class DebtPayoffResult {
    DebtPayoffMode mode;

    /**
     * Debts in priority order.
     */
    @Singular
    List<DebtProjection> debts;

    @Singular("month")
    List<PayoffMonth> schedule;

    String nextDebtId;
    LocalDate nextDebtEstimatedPayoffDate;
    LocalDate overallEstimatedDebtFreeDate;
    double progressToNextDebt;
    double progressTotalPaid;
    double totalMinimumPayments;
    boolean insufficientAllocation;
}
