package com.flagship.finance_tracker.ledger;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Display formatting for money amounts: Canadian dollars, two decimals.
 */
public final class MoneyFormat {

    public static final String HIDDEN = "••••";

    private static final Locale LOCALE = Locale.CANADA;
    private static final Currency CURRENCY = Currency.getInstance("CAD");

    private MoneyFormat() {
        // Utility class
    }

    public static String format(BigDecimal value, boolean hide) {
        if (hide) {
            return HIDDEN;
        }
        // NumberFormat is not thread-safe
        NumberFormat format = NumberFormat.getCurrencyInstance(LOCALE);
        format.setCurrency(CURRENCY);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return format.format(value != null ? value : BigDecimal.ZERO);
    }
}
