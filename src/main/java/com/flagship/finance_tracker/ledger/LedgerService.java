package com.flagship.finance_tracker.ledger;

import com.flagship.finance_tracker.networth.NetWorthSnapshot;
import com.flagship.finance_tracker.networth.NetWorthSummary;
import com.flagship.finance_tracker.observability.CorrelationContext;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.payoff.DebtPayoffResult;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import com.flagship.finance_tracker.payoff.DebtPayoffSimulator;
import com.flagship.finance_tracker.store.LedgerSnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns the active profile's {@link Ledger} and keeps storage in step with it.
 *
 * This service enforces:
 * 1. A single writer: every public method is synchronized, so engine
 *    operations never interleave
 * 2. Write-through persistence: every applied mutation is saved immediately;
 *    pending and rejected outcomes change nothing and save nothing
 * 3. Profile isolation: switching profile discards the in-memory ledger and
 *    reloads from storage. Without a profile the ledger is empty and never saved.
 *    Concurrent callers go through {@link #withProfile}, which activates the
 *    profile and runs the work under one lock.
 *
 * A failed save is logged and counted but does not undo the mutation.
 */
@Service
@Slf4j
public class LedgerService {

    private final LedgerSnapshotStore store;
    private final DebtPayoffSimulator simulator;
    private final LedgerMetrics metrics;
    private final Clock clock;

    private String activeProfileId;
    private Ledger ledger;

    public LedgerService(LedgerSnapshotStore store, DebtPayoffSimulator simulator,
                         LedgerMetrics metrics, Clock clock) {
        this.store = store;
        this.simulator = simulator;
        this.metrics = metrics;
        this.clock = clock;
        this.ledger = Ledger.empty(clock);
    }

    // ==================== Profile ====================

    /**
     * Activates a profile, reloading from storage if it differs from the
     * active one. Re-opening the active profile keeps the in-memory ledger.
     */
    public synchronized void openProfile(String profileId) {
        String normalized = profileId == null || profileId.isBlank() ? null : profileId;
        if (normalized != null && normalized.equals(activeProfileId)) {
            return;
        }

        activeProfileId = normalized;
        if (normalized == null) {
            ledger = Ledger.empty(clock);
            log.info("No profile selected, using an empty ledger");
        } else {
            Optional<LedgerSnapshot> stored = store.load(normalized);
            ledger = new Ledger(stored.orElseGet(LedgerSnapshot::empty), clock);
            log.info("Opened profile: profileId={}, stored={}, accounts={}",
                    normalized, stored.isPresent(), ledger.getAccounts().size());
        }
        metrics.updateNetWorth(ledger.netWorth().getNetWorth());
    }

    /**
     * Activates {@code profileId} and runs {@code work} while holding the
     * service lock, so no other caller can switch profile in between.
     * The profile id is also placed in the logging MDC.
     */
    public synchronized <T> T withProfile(String profileId, Supplier<T> work) {
        MDC.put(CorrelationContext.PROFILE_ID_MDC_KEY, profileId);
        openProfile(profileId);
        return work.get();
    }

    public synchronized Optional<String> getActiveProfileId() {
        return Optional.ofNullable(activeProfileId);
    }

    // ==================== Accounts ====================

    public synchronized MutationResult<Account> addAccount(AccountDraft draft) {
        return apply("add_account", () -> ledger.addAccount(draft));
    }

    public synchronized MutationResult<Account> editAccount(String accountId, AccountChanges changes,
                                                            boolean skipGuard) {
        return apply("edit_account", () -> ledger.editAccount(accountId, changes, skipGuard));
    }

    public synchronized MutationResult<Account> deleteAccount(String accountId) {
        return apply("delete_account", () -> ledger.deleteAccount(accountId));
    }

    public synchronized MutationResult<Account> restoreAccount(String accountId) {
        return apply("restore_account", () -> ledger.restoreAccount(accountId));
    }

    /**
     * Selection is session state and is not persisted.
     */
    public synchronized MutationResult<Account> selectAccount(String accountId) {
        return ledger.selectAccount(accountId);
    }

    // ==================== Transactions ====================

    public synchronized MutationResult<Transaction> addTransaction(String accountId, BigDecimal amount,
                                                                   LocalDate date, String description,
                                                                   boolean skipGuard) {
        return apply("add_transaction",
                () -> ledger.addTransaction(accountId, amount, date, description, skipGuard));
    }

    public synchronized MutationResult<Transaction> updateTransaction(String transactionId,
                                                                      TransactionChanges changes,
                                                                      boolean skipGuard) {
        return apply("update_transaction", () -> ledger.updateTransaction(transactionId, changes, skipGuard));
    }

    public synchronized MutationResult<List<Transaction>> deleteTransaction(String transactionId) {
        return apply("delete_transaction", () -> ledger.deleteTransaction(transactionId));
    }

    public synchronized MutationResult<List<Transaction>> transfer(String fromAccountId, String toAccountId,
                                                                   BigDecimal amount, LocalDate date,
                                                                   String note, boolean skipGuard) {
        return apply("transfer",
                () -> ledger.transfer(fromAccountId, toAccountId, amount, date, note, skipGuard));
    }

    public synchronized MutationResult<Integer> reset(ResetScope scope) {
        MutationResult<Integer> result = apply("reset", () -> ledger.reset(scope));
        if (result.isApplied()) {
            log.info("Ledger reset: scope={}, transactionsRemoved={}", scope.getCode(), result.getValue());
        }
        return result;
    }

    // ==================== Bills ====================

    public synchronized MutationResult<Bill> addBill(Bill draft) {
        return apply("add_bill", () -> ledger.addBill(draft));
    }

    public synchronized MutationResult<Bill> updateBill(String billId, Bill changes) {
        return apply("update_bill", () -> ledger.updateBill(billId, changes));
    }

    public synchronized MutationResult<Bill> deleteBill(String billId) {
        return apply("delete_bill", () -> ledger.deleteBill(billId));
    }

    public synchronized MutationResult<Transaction> markBillPaid(String billId) {
        return apply("mark_bill_paid", () -> ledger.markBillPaid(billId));
    }

    // ==================== Preferences ====================

    /**
     * Null arguments leave the corresponding preference unchanged.
     */
    public synchronized void updatePreferences(NetWorthViewMode viewMode, Boolean hideMoney) {
        if (viewMode != null) {
            ledger.setNetWorthViewMode(viewMode);
        }
        if (hideMoney != null) {
            ledger.setHideMoney(hideMoney);
        }
        persist("update_preferences");
    }

    public synchronized DebtPayoffSettings updateDebtPayoffSettings(DebtPayoffSettings settings) {
        DebtPayoffSettings updated = ledger.updateDebtPayoffSettings(settings);
        persist("update_debt_payoff_settings");
        return updated;
    }

    // ==================== Views ====================

    public synchronized LedgerSnapshot snapshot() {
        return ledger.snapshot();
    }

    public synchronized NetWorthSummary netWorth() {
        return ledger.netWorth();
    }

    public synchronized List<NetWorthSnapshot> netWorthHistory() {
        return ledger.getNetWorthHistory();
    }

    public synchronized List<Account> accounts() {
        return ledger.getAccounts();
    }

    public synchronized List<Transaction> transactionsFor(String accountId) {
        return ledger.transactionsFor(accountId);
    }

    public synchronized List<Bill> unpaidBills() {
        return ledger.unpaidBills();
    }

    public synchronized Optional<Account> selectedAccount() {
        return ledger.selectedAccount();
    }

    public synchronized NetWorthViewMode netWorthViewMode() {
        return ledger.getNetWorthViewMode();
    }

    public synchronized boolean isHideMoney() {
        return ledger.isHideMoney();
    }

    public synchronized DebtPayoffSettings debtPayoffSettings() {
        return ledger.getDebtPayoffSettings();
    }

    /**
     * Projects payoff of the active profile's debts using its saved settings.
     * Month 1 of the projection is the month after the current one.
     */
    public synchronized DebtPayoffResult projectDebtPayoff() {
        DebtPayoffSettings settings = ledger.getDebtPayoffSettings();
        LocalDate startMonth = LocalDate.now(clock).withDayOfMonth(1);
        return metrics.timeSimulation(() -> simulator.simulate(
                ledger.debtInputs(),
                settings.getMode(),
                settings.getMonthlyAllocation().doubleValue(),
                startMonth));
    }

    // ==================== Internals ====================

    private <T> MutationResult<T> apply(String operation, Supplier<MutationResult<T>> mutation) {
        MutationResult<T> result = mutation.get();
        metrics.recordMutation(operation, result.getOutcome().name());

        switch (result.getOutcome()) {
            case APPLIED -> {
                log.debug("Mutation applied: operation={}", operation);
                persist(operation);
                metrics.updateNetWorth(ledger.netWorth().getNetWorth());
            }
            case PENDING_CONFIRMATION -> log.info("Mutation awaiting confirmation: operation={}, warnings={}",
                    operation, result.getWarnings().size());
            case REJECTED -> log.warn("Mutation rejected: operation={}, reason={}", operation, result.getReason());
        }
        return result;
    }

    private void persist(String operation) {
        if (activeProfileId == null) {
            return;
        }
        if (!store.save(activeProfileId, ledger.snapshot())) {
            log.warn("Change kept in memory only: operation={}, profileId={}", operation, activeProfileId);
        }
    }
}
