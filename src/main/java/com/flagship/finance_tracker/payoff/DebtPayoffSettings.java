package com.flagship.finance_tracker.payoff;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DebtPayoffSettings {
    DebtPayoffMode mode;
    BigDecimal monthlyAllocation;

    /**
     * Display flag only; has no effect on the projection.
     */
    boolean showInterest;

    public static DebtPayoffSettings defaults() {
        return new DebtPayoffSettings(DebtPayoffMode.SNOWBALL, BigDecimal.ZERO, false);
    }

    /**
     * Fills missing fields and clamps a negative allocation to zero.
     */
    public DebtPayoffSettings normalized() {
        BigDecimal allocation = monthlyAllocation == null || monthlyAllocation.signum() < 0
            ? BigDecimal.ZERO
            : monthlyAllocation;
        return new DebtPayoffSettings(mode != null ? mode : DebtPayoffMode.SNOWBALL, allocation, showInterest);
    }
}
