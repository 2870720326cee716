package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionKind {
    PLAIN("plain"),
    TRANSFER_LEG("transfer");

    private final String code;

    TransactionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TransactionKind fromCode(String code) {
        return TRANSFER_LEG.code.equalsIgnoreCase(code) || TRANSFER_LEG.name().equalsIgnoreCase(code)
            ? TRANSFER_LEG
            : PLAIN;
    }
}
