package com.flagship.finance_tracker.ledger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the other leg of a transfer.
 *
 * Transfers created by the ledger always carry a shared transfer group id.
 * Older data may not, so a transaction whose description mentions a transfer
 * is also treated as a leg, and its partner is matched on same date, equal
 * absolute amount and a different account. When several candidates match,
 * the earliest one in ledger order wins.
 */
public final class TransferPairing {

    private static final String TRANSFER_MARKER = "transfer";

    private TransferPairing() {
        // Utility class
    }

    public static boolean isTransferLeg(Transaction transaction) {
        if (transaction.isTransferKind()) {
            return true;
        }
        String description = transaction.getDescription();
        return description != null && description.toLowerCase(Locale.ROOT).contains(TRANSFER_MARKER);
    }

    /**
     * @param transaction the leg whose partner is wanted
     * @param transactions all transactions, in ledger order
     */
    public static Optional<Transaction> findPartner(Transaction transaction, List<Transaction> transactions) {
        if (!isTransferLeg(transaction)) {
            return Optional.empty();
        }

        String groupId = transaction.getTransferGroupId();
        if (groupId != null) {
            return transactions.stream()
                .filter(candidate -> !candidate.getId().equals(transaction.getId()))
                .filter(candidate -> groupId.equals(candidate.getTransferGroupId()))
                .findFirst();
        }

        return transactions.stream()
            .filter(candidate -> !candidate.getId().equals(transaction.getId()))
            .filter(candidate -> candidate.getTransferGroupId() == null)
            .filter(TransferPairing::isTransferLeg)
            .filter(candidate -> !candidate.getAccountId().equals(transaction.getAccountId()))
            .filter(candidate -> candidate.getDate() != null && candidate.getDate().equals(transaction.getDate()))
            .filter(candidate -> candidate.getAmount().abs().compareTo(transaction.getAmount().abs()) == 0)
            .findFirst();
    }
}
