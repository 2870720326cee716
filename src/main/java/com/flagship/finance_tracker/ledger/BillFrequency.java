package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;

/**
 * How often a bill recurs. One-time bills never advance their due date.
 */
public enum BillFrequency {
    ONCE("once"),
    WEEKLY("weekly"),
    BIWEEKLY("biweekly"),
    MONTHLY("monthly");

    private final String code;

    BillFrequency(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static BillFrequency fromCode(String code) {
        if (code == null) {
            return ONCE;
        }
        for (BillFrequency frequency : values()) {
            if (frequency.code.equalsIgnoreCase(code) || frequency.name().equalsIgnoreCase(code)) {
                return frequency;
            }
        }
        return ONCE;
    }

    public boolean isRecurring() {
        return this != ONCE;
    }

    /**
     * Moves a due date forward by one interval.
     */
    public LocalDate advance(LocalDate date) {
        return switch (this) {
            case WEEKLY -> date.plusDays(7);
            case BIWEEKLY -> date.plusDays(14);
            case MONTHLY, ONCE -> date.plusMonths(1);
        };
    }
}
