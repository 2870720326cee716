package com.flagship.finance_tracker.payoff;

import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Balances owed at the end of one simulated month, keyed by debt id in priority order.
 */
@Value
public class PayoffMonth {
    int month;
    LocalDate date;
    Map<String, Double> balances;
    double totalRemaining;
}
