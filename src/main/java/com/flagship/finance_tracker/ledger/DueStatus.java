package com.flagship.finance_tracker.ledger;

import lombok.Value;

@Value
public class DueStatus {

    public enum Tone {
        MUTED,
        WARNING,
        DANGER
    }

    String label;
    Tone tone;
}
