package com.flagship.finance_tracker.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a ledger mutation.
 *
 * APPLIED: the ledger changed and {@code value} holds the result.
 * PENDING_CONFIRMATION: nothing changed; the operation would overpay one or
 * more debt accounts and must be re-invoked with the guard bypassed.
 * REJECTED: nothing changed; the input was structurally invalid.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationResult<T> {

    public enum Outcome {
        APPLIED,
        PENDING_CONFIRMATION,
        REJECTED
    }

    Outcome outcome;
    T value;
    List<OverpaymentWarning> warnings;
    String reason;

    public static <T> MutationResult<T> applied(T value) {
        return new MutationResult<>(Outcome.APPLIED, value, List.of(), null);
    }

    public static <T> MutationResult<T> pending(List<OverpaymentWarning> warnings) {
        return new MutationResult<>(Outcome.PENDING_CONFIRMATION, null, List.copyOf(warnings), null);
    }

    public static <T> MutationResult<T> rejected(String reason) {
        return new MutationResult<>(Outcome.REJECTED, null, List.of(), reason);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public boolean isPending() {
        return outcome == Outcome.PENDING_CONFIRMATION;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }
}
