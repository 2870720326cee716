package com.flagship.finance_tracker.payoff;

import lombok.Value;

import java.time.LocalDate;

/**
 * Projected outcome for one debt. {@code estimatedPayoffDate} is null when the
 * debt is not cleared within the simulation horizon, or when the simulation did not run.
 */
@Value
public class DebtProjection {
    String id;
    String name;
    double balance;
    double minimumPayment;
    double apr;
    double startingBalance;
    double estimatedMonthlyInterest;
    LocalDate estimatedPayoffDate;
}
