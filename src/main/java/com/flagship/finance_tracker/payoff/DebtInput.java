package com.flagship.finance_tracker.payoff;

import lombok.Value;

/**
 * A debt as seen by the simulator. {@code balance} is the amount owed as a
 * positive number; {@code apr} is a fraction (0.1999 for 19.99%).
 */
@Value
public class DebtInput {
    String id;
    String name;
    double balance;
    double minimumPayment;
    double apr;
    double startingBalance;
}
