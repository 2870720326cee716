package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a reset clears.
 *
 * The first three scopes keep accounts and roll the removed amounts back onto
 * their balances. {@link #EVERYTHING} discards accounts outright.
 */
public enum ResetScope {
    TRANSACTIONS("transactions"),
    TRANSFERS("transfers"),
    TRANSACTIONS_AND_TRANSFERS("transactions-transfers"),
    EVERYTHING("all");

    private final String code;

    ResetScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ResetScope fromCode(String code) {
        for (ResetScope scope : values()) {
            if (scope.code.equalsIgnoreCase(code) || scope.name().equalsIgnoreCase(code)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown reset scope: " + code);
    }

    boolean removesPlainTransactions() {
        return this == TRANSACTIONS || this == TRANSACTIONS_AND_TRANSFERS;
    }

    boolean removesTransfers() {
        return this == TRANSFERS || this == TRANSACTIONS_AND_TRANSFERS;
    }
}
