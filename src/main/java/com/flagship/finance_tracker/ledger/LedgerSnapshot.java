package com.flagship.finance_tracker.ledger;

import com.flagship.finance_tracker.networth.NetWorthSnapshot;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * The persisted unit of ledger state for one profile.
 *
 * Serialized and deserialized opaquely by the snapshot store. List fields are
 * never null after {@link #normalized()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerSnapshot {

    @Builder.Default
    List<Account> accounts = List.of();

    @Builder.Default
    List<Account> deletedAccounts = List.of();

    @Builder.Default
    List<Transaction> transactions = List.of();

    @Builder.Default
    List<Bill> bills = List.of();

    @Builder.Default
    List<NetWorthSnapshot> netWorthHistory = List.of();

    NetWorthViewMode netWorthViewMode;
    Boolean hideMoney;
    DebtPayoffSettings debtPayoffSettings;

    public static LedgerSnapshot empty() {
        return LedgerSnapshot.builder().build();
    }

    /**
     * Replaces absent collections with empty ones and fills default settings.
     * Records without an id, transactions and bills without an account, and
     * history points without a date are dropped. Preferences stay absent when
     * they were absent.
     */
    public LedgerSnapshot normalized() {
        return toBuilder()
            .accounts(orEmpty(accounts).stream()
                .filter(account -> account.getId() != null)
                .map(LedgerSnapshot::normalizeAccount)
                .toList())
            .deletedAccounts(orEmpty(deletedAccounts).stream()
                .filter(account -> account.getId() != null)
                .map(LedgerSnapshot::normalizeAccount)
                .toList())
            .transactions(orEmpty(transactions).stream()
                .filter(transaction -> transaction.getId() != null && transaction.getAccountId() != null)
                .map(LedgerSnapshot::normalizeTransaction)
                .toList())
            .bills(orEmpty(bills).stream()
                .filter(bill -> bill.getId() != null && bill.getAccountId() != null)
                .map(LedgerSnapshot::normalizeBill)
                .toList())
            .netWorthHistory(orEmpty(netWorthHistory).stream()
                .filter(point -> point.getDate() != null)
                .toList())
            .debtPayoffSettings(debtPayoffSettings != null
                ? debtPayoffSettings.normalized()
                : DebtPayoffSettings.defaults())
            .build();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list.stream().filter(Objects::nonNull).toList() : List.of();
    }

    private static Account normalizeAccount(Account account) {
        if (account.getCategory() != null && account.getBalance() != null) {
            return account;
        }
        return account.toBuilder()
            .category(account.getCategory() != null ? account.getCategory() : AccountCategory.ASSET)
            .balance(account.getBalance() != null ? account.getBalance() : BigDecimal.ZERO)
            .build();
    }

    private static Transaction normalizeTransaction(Transaction transaction) {
        if (transaction.getKind() != null && transaction.getAmount() != null) {
            return transaction;
        }
        return transaction.toBuilder()
            .kind(transaction.getKind() != null ? transaction.getKind() : TransactionKind.PLAIN)
            .amount(transaction.getAmount() != null ? transaction.getAmount() : BigDecimal.ZERO)
            .build();
    }

    private static Bill normalizeBill(Bill bill) {
        return bill.getFrequency() != null ? bill : bill.toBuilder().frequency(BillFrequency.ONCE).build();
    }
}
