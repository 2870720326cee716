package com.flagship.finance_tracker.payoff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which debt receives the money left over after minimum payments.
 */
public enum DebtPayoffMode {
    /**
     * Smallest balance first.
     */
    SNOWBALL("snowball"),

    /**
     * Highest interest rate first.
     */
    AVALANCHE("avalanche");

    private final String code;

    DebtPayoffMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DebtPayoffMode fromCode(String code) {
        return AVALANCHE.code.equalsIgnoreCase(code) || AVALANCHE.name().equalsIgnoreCase(code)
            ? AVALANCHE
            : SNOWBALL;
    }
}
