package com.flagship.finance_tracker.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NetWorthViewMode {
    MINIMAL("minimal"),
    DETAILED("detailed");

    private final String code;

    NetWorthViewMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Unknown values read as absent rather than failing the whole snapshot.
     */
    @JsonCreator
    public static NetWorthViewMode fromCode(String code) {
        for (NetWorthViewMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                return mode;
            }
        }
        return null;
    }
}
