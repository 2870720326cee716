package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.MoneyFormat;
import com.flagship.finance_tracker.ledger.NetWorthViewMode;
import com.flagship.finance_tracker.networth.NetWorthSnapshot;
import com.flagship.finance_tracker.networth.NetWorthSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Response DTO for the net worth summary and its daily history.
 */
@Value
@Builder
public class NetWorthResponse {

    @JsonProperty("net_worth")
    BigDecimal netWorth;

    @JsonProperty("total_assets")
    BigDecimal totalAssets;

    @JsonProperty("total_debts")
    BigDecimal totalDebts;

    @JsonProperty("display_net_worth")
    String displayNetWorth;

    @JsonProperty("view_mode")
    NetWorthViewMode viewMode;

    @JsonProperty("history")
    List<Point> history;

    public static NetWorthResponse from(NetWorthSummary summary, List<NetWorthSnapshot> history,
                                        NetWorthViewMode viewMode, boolean hideMoney) {
        return NetWorthResponse.builder()
            .netWorth(summary.getNetWorth())
            .totalAssets(summary.getTotalAssets())
            .totalDebts(summary.getTotalDebts())
            .displayNetWorth(MoneyFormat.format(summary.getNetWorth(), hideMoney))
            .viewMode(viewMode)
            .history(history.stream().map(Point::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Point {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("value")
        BigDecimal value;

        @JsonProperty("total_assets")
        BigDecimal totalAssets;

        @JsonProperty("total_debts")
        BigDecimal totalDebts;

        static Point from(NetWorthSnapshot snapshot) {
            return Point.builder()
                .date(snapshot.getDate())
                .value(snapshot.getValue())
                .totalAssets(snapshot.getTotalAssets())
                .totalDebts(snapshot.getTotalDebts())
                .build();
        }
    }
}
