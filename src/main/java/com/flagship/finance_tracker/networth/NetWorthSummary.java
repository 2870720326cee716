package com.flagship.finance_tracker.networth;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class NetWorthSummary {
    BigDecimal netWorth;
    BigDecimal totalAssets;
    BigDecimal totalDebts;
}
