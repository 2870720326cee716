package com.flagship.finance_tracker.networth;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Net worth as of one calendar day.
 */
@Value
@Builder
@Jacksonized
public class NetWorthSnapshot {
    LocalDate date;
    BigDecimal value;
    BigDecimal totalAssets;
    BigDecimal totalDebts;

    public static NetWorthSnapshot of(LocalDate date, NetWorthSummary summary) {
        return NetWorthSnapshot.builder()
            .date(date)
            .value(summary.getNetWorth())
            .totalAssets(summary.getTotalAssets())
            .totalDebts(summary.getTotalDebts())
            .build();
    }
}
