package com.flagship.finance_tracker.networth;

import com.flagship.finance_tracker.ledger.Account;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Aggregates account balances into net worth.
 *
 * Asset balances and any positive (overpaid) debt balances count as assets.
 * Negative debt balances count toward total debts by magnitude.
 * All three figures are rounded half-up to cents.
 */
public final class NetWorthCalculator {

    private NetWorthCalculator() {
        // Utility class
    }

    public static NetWorthSummary calculate(Collection<Account> accounts) {
        BigDecimal totalAssets = BigDecimal.ZERO;
        BigDecimal totalDebts = BigDecimal.ZERO;

        for (Account account : accounts) {
            BigDecimal balance = account.getBalance() != null ? account.getBalance() : BigDecimal.ZERO;
            if (account.isDebt() && balance.signum() < 0) {
                totalDebts = totalDebts.add(balance.abs());
            } else {
                totalAssets = totalAssets.add(balance);
            }
        }

        BigDecimal netWorth = totalAssets.subtract(totalDebts);
        return new NetWorthSummary(round(netWorth), round(totalAssets), round(totalDebts));
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
