package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Account category. Debt accounts carry a non-positive balance.
 */
public enum AccountCategory {
    ASSET("asset"),
    DEBT("debt");

    private final String code;

    AccountCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Anything that is not explicitly "debt" is an asset, including missing values.
     */
    @JsonCreator
    public static AccountCategory fromCode(String code) {
        return DEBT.code.equalsIgnoreCase(code) || DEBT.name().equalsIgnoreCase(code) ? DEBT : ASSET;
    }
}
