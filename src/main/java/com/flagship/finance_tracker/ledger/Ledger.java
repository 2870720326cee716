package com.flagship.finance_tracker.ledger;

import com.flagship.finance_tracker.networth.NetWorthCalculator;
import com.flagship.finance_tracker.networth.NetWorthHistory;
import com.flagship.finance_tracker.networth.NetWorthSnapshot;
import com.flagship.finance_tracker.networth.NetWorthSummary;
import com.flagship.finance_tracker.payoff.DebtInput;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Authoritative in-memory ledger for one profile.
 *
 * This class enforces the core invariants:
 * 1. An account's balance equals its opening balance plus the sum of its
 *    transactions. Every balance change is paired with a transaction change.
 * 2. Both legs of a transfer always carry opposite amounts of equal magnitude.
 * 3. A debt account is never pushed from zero-or-below to above zero unless
 *    the caller explicitly bypasses the overpayment guard.
 *
 * Operations never throw for domain outcomes. Each returns a
 * {@link MutationResult} that is either applied in full, pending confirmation
 * (nothing changed), or rejected (nothing changed).
 *
 * Not thread-safe: callers must serialize access.
 */
public class Ledger {

    static final BigDecimal DEFAULT_MINIMUM_PAYMENT_RATE = new BigDecimal("0.03");
    static final String TRANSFER_OUT_DESCRIPTION = "Transfer out";
    static final String TRANSFER_IN_DESCRIPTION = "Transfer in";
    static final String ADJUSTMENT_INCREASE_DESCRIPTION = "Balance adjustment (increase)";
    static final String ADJUSTMENT_DECREASE_DESCRIPTION = "Balance adjustment (decrease)";
    static final String BILL_PAYMENT_DESCRIPTION = "Bill payment";

    private final Clock clock;

    private final List<Account> accounts;
    private final List<Account> deletedAccounts;
    private final List<Transaction> transactions;
    private final List<Bill> bills;
    private List<NetWorthSnapshot> netWorthHistory;

    private NetWorthViewMode netWorthViewMode;
    private Boolean hideMoney;
    private DebtPayoffSettings debtPayoffSettings;
    private String selectedAccountId;

    public Ledger(LedgerSnapshot snapshot, Clock clock) {
        LedgerSnapshot normalized = snapshot.normalized();
        this.clock = clock;
        this.accounts = new ArrayList<>(normalized.getAccounts());
        this.deletedAccounts = new ArrayList<>(normalized.getDeletedAccounts());
        this.transactions = new ArrayList<>(normalized.getTransactions());
        this.bills = new ArrayList<>(normalized.getBills());
        this.netWorthHistory = new ArrayList<>(normalized.getNetWorthHistory());
        this.netWorthViewMode = normalized.getNetWorthViewMode();
        this.hideMoney = normalized.getHideMoney();
        this.debtPayoffSettings = normalized.getDebtPayoffSettings();
        this.selectedAccountId = accounts.isEmpty() ? null : accounts.get(0).getId();
    }

    public static Ledger empty(Clock clock) {
        return new Ledger(LedgerSnapshot.empty(), clock);
    }

    // ==================== Accounts ====================

    /**
     * Creates an account and selects it.
     *
     * Debt accounts default their starting balance to the magnitude of the
     * opening balance and their minimum payment to 3% of it. A debt account
     * cannot open with a positive balance.
     */
    public MutationResult<Account> addAccount(AccountDraft draft) {
        if (draft == null || isBlank(draft.getName())) {
            return MutationResult.rejected("Account name is required");
        }

        BigDecimal balance = draft.getBalance() != null ? draft.getBalance() : BigDecimal.ZERO;
        AccountCategory category = draft.getCategory() != null ? draft.getCategory() : AccountCategory.ASSET;

        if (category == AccountCategory.DEBT && balance.signum() > 0) {
            return MutationResult.rejected("Debt account balance must be zero or negative");
        }

        Account account = Account.builder()
            .id(newId())
            .name(draft.getName().trim())
            .balance(balance)
            .category(category)
            .creditLimit(draft.getCreditLimit())
            .annualPercentageRate(draft.getAnnualPercentageRate())
            .minimumPayment(draft.getMinimumPayment())
            .startingBalance(draft.getStartingBalance())
            .build();

        account = normalizeCategoryFields(account);

        accounts.add(account);
        selectedAccountId = account.getId();
        recordNetWorth();
        return MutationResult.applied(account);
    }

    public MutationResult<Account> editAccount(String accountId, AccountChanges changes) {
        return editAccount(accountId, changes, false);
    }

    /**
     * Updates account fields. A balance change is recorded as a single
     * adjustment transaction for the difference, so the transaction history
     * keeps explaining every balance change.
     */
    public MutationResult<Account> editAccount(String accountId, AccountChanges changes, boolean skipGuard) {
        Optional<Account> found = findAccount(accountId);
        if (found.isEmpty()) {
            return MutationResult.rejected("Account not found: " + accountId);
        }
        if (changes == null) {
            return MutationResult.rejected("No changes supplied");
        }
        Account original = found.get();

        AccountCategory category = changes.getCategory() != null ? changes.getCategory() : original.getCategory();
        BigDecimal balance = changes.getBalance() != null ? changes.getBalance() : original.getBalance();
        BigDecimal delta = balance.subtract(original.getBalance());

        Account updated = original.toBuilder()
            .name(isBlank(changes.getName()) ? original.getName() : changes.getName().trim())
            .category(category)
            .balance(balance)
            .creditLimit(orElse(changes.getCreditLimit(), original.getCreditLimit()))
            .annualPercentageRate(orElse(changes.getAnnualPercentageRate(), original.getAnnualPercentageRate()))
            .minimumPayment(orElse(changes.getMinimumPayment(), original.getMinimumPayment()))
            .startingBalance(orElse(changes.getStartingBalance(), original.getStartingBalance()))
            .build();
        updated = normalizeCategoryFields(updated);

        if (!skipGuard && updated.isDebt() && wouldLeaveDebtPositive(original, updated, delta)) {
            return MutationResult.pending(List.of(warning(updated, original.getBalance(), delta)));
        }

        replaceAccount(updated);

        if (delta.signum() != 0) {
            transactions.add(Transaction.builder()
                .id(newId())
                .accountId(accountId)
                .amount(delta)
                .date(today())
                .description(delta.signum() > 0 ? ADJUSTMENT_INCREASE_DESCRIPTION : ADJUSTMENT_DECREASE_DESCRIPTION)
                .kind(TransactionKind.PLAIN)
                .build());
        }

        recordNetWorth();
        return MutationResult.applied(updated);
    }

    /**
     * Moves an account to the deleted set and drops its transactions and bills.
     * Transfer legs on other accounts are kept since they still explain those balances.
     */
    public MutationResult<Account> deleteAccount(String accountId) {
        int index = indexOfAccount(accountId);
        if (index < 0) {
            return MutationResult.rejected("Account not found: " + accountId);
        }

        Account removed = accounts.remove(index);
        deletedAccounts.removeIf(account -> account.getId().equals(accountId));
        deletedAccounts.add(removed);

        transactions.removeIf(tx -> accountId.equals(tx.getAccountId()));
        bills.removeIf(bill -> accountId.equals(bill.getAccountId()));

        if (accountId.equals(selectedAccountId)) {
            selectedAccountId = accounts.isEmpty()
                ? null
                : accounts.get(Math.min(index, accounts.size() - 1)).getId();
        }

        recordNetWorth();
        return MutationResult.applied(removed);
    }

    /**
     * Brings a deleted account back. Restoring an account that is already
     * active is a no-op that reports the active account.
     */
    public MutationResult<Account> restoreAccount(String accountId) {
        Optional<Account> deleted = deletedAccounts.stream()
            .filter(account -> account.getId().equals(accountId))
            .findFirst();
        Optional<Account> active = findAccount(accountId);

        if (deleted.isEmpty() && active.isEmpty()) {
            return MutationResult.rejected("No deleted account with id: " + accountId);
        }

        deletedAccounts.removeIf(account -> account.getId().equals(accountId));
        if (active.isPresent()) {
            return MutationResult.applied(active.get());
        }

        accounts.add(deleted.get());
        if (selectedAccountId == null) {
            selectedAccountId = accountId;
        }
        recordNetWorth();
        return MutationResult.applied(deleted.get());
    }

    public MutationResult<Account> selectAccount(String accountId) {
        Optional<Account> account = findAccount(accountId);
        if (account.isEmpty()) {
            return MutationResult.rejected("Account not found: " + accountId);
        }
        selectedAccountId = accountId;
        return MutationResult.applied(account.get());
    }

    // ==================== Transactions ====================

    public MutationResult<Transaction> addTransaction(String accountId, BigDecimal amount, LocalDate date,
                                                      String description) {
        return addTransaction(accountId, amount, date, description, false);
    }

    /**
     * Records a plain transaction and applies it to the account balance.
     *
     * @param skipGuard true to apply even if it pays a debt account past zero
     */
    public MutationResult<Transaction> addTransaction(String accountId, BigDecimal amount, LocalDate date,
                                                      String description, boolean skipGuard) {
        Optional<Account> found = findAccount(accountId);
        if (found.isEmpty()) {
            return MutationResult.rejected("Account not found: " + accountId);
        }
        if (amount == null || amount.signum() == 0) {
            return MutationResult.rejected("Transaction amount must be non-zero");
        }
        Account account = found.get();

        if (!skipGuard && account.isDebt() && wouldOverpay(account.getBalance(), amount)) {
            return MutationResult.pending(List.of(warning(account, account.getBalance(), amount)));
        }

        Transaction transaction = Transaction.builder()
            .id(newId())
            .accountId(accountId)
            .amount(amount)
            .date(date != null ? date : today())
            .description(description != null ? description.trim() : "")
            .kind(TransactionKind.PLAIN)
            .build();

        transactions.add(transaction);
        replaceAccount(account.applyDelta(amount));
        recordNetWorth();
        return MutationResult.applied(transaction);
    }

    public MutationResult<Transaction> updateTransaction(String transactionId, TransactionChanges changes) {
        return updateTransaction(transactionId, changes, false);
    }

    /**
     * Edits a transaction and re-applies the amount difference to its account.
     *
     * For a transfer leg the partner leg is kept in step: its amount becomes
     * the negation of the new amount, and any changed date or description is
     * copied over. A legacy pair matched by heuristics is stamped with a
     * shared transfer group id so it stays linked after the edit.
     */
    public MutationResult<Transaction> updateTransaction(String transactionId, TransactionChanges changes,
                                                         boolean skipGuard) {
        int index = indexOfTransaction(transactionId);
        if (index < 0) {
            return MutationResult.rejected("Transaction not found: " + transactionId);
        }
        if (changes == null) {
            return MutationResult.rejected("No changes supplied");
        }

        Transaction original = transactions.get(index);
        Optional<Transaction> partner = TransferPairing.findPartner(original, transactions);

        BigDecimal newAmount = changes.getAmount() != null ? changes.getAmount() : original.getAmount();
        if (newAmount.signum() == 0) {
            return MutationResult.rejected("Transaction amount must be non-zero");
        }
        BigDecimal delta = newAmount.subtract(original.getAmount());

        Transaction.TransactionBuilder updatedBuilder = original.toBuilder()
            .amount(newAmount)
            .date(changes.getDate() != null ? changes.getDate() : original.getDate())
            .description(changes.getDescription() != null ? changes.getDescription().trim() : original.getDescription());

        List<OverpaymentWarning> warnings = new ArrayList<>();
        findAccount(original.getAccountId())
            .filter(Account::isDebt)
            .filter(account -> wouldOverpay(account.getBalance(), delta))
            .ifPresent(account -> warnings.add(warning(account, account.getBalance(), delta)));

        Transaction updatedPartner = null;
        BigDecimal partnerDelta = BigDecimal.ZERO;
        if (partner.isPresent()) {
            Transaction other = partner.get();
            String groupId = original.getTransferGroupId() != null ? original.getTransferGroupId() : newId();
            updatedBuilder.kind(TransactionKind.TRANSFER_LEG).transferGroupId(groupId);

            BigDecimal partnerAmount = newAmount.negate();
            partnerDelta = partnerAmount.subtract(other.getAmount());
            updatedPartner = other.toBuilder()
                .amount(partnerAmount)
                .date(changes.getDate() != null ? changes.getDate() : other.getDate())
                .description(changes.getDescription() != null ? changes.getDescription().trim() : other.getDescription())
                .kind(TransactionKind.TRANSFER_LEG)
                .transferGroupId(groupId)
                .build();

            BigDecimal finalPartnerDelta = partnerDelta;
            findAccount(other.getAccountId())
                .filter(Account::isDebt)
                .filter(account -> wouldOverpay(account.getBalance(), finalPartnerDelta))
                .ifPresent(account -> warnings.add(warning(account, account.getBalance(), finalPartnerDelta)));
        }

        if (!skipGuard && !warnings.isEmpty()) {
            return MutationResult.pending(warnings);
        }

        Transaction updated = updatedBuilder.build();
        transactions.set(index, updated);
        applyDelta(original.getAccountId(), delta);

        if (updatedPartner != null) {
            transactions.set(indexOfTransaction(updatedPartner.getId()), updatedPartner);
            applyDelta(updatedPartner.getAccountId(), partnerDelta);
        }

        recordNetWorth();
        return MutationResult.applied(updated);
    }

    /**
     * Deletes a transaction and reverses its effect. Both legs of a transfer
     * are deleted and reversed together.
     *
     * @return the removed transactions
     */
    public MutationResult<List<Transaction>> deleteTransaction(String transactionId) {
        int index = indexOfTransaction(transactionId);
        if (index < 0) {
            return MutationResult.rejected("Transaction not found: " + transactionId);
        }

        Transaction transaction = transactions.get(index);
        List<Transaction> removed = new ArrayList<>();
        removed.add(transaction);
        TransferPairing.findPartner(transaction, transactions).ifPresent(removed::add);

        for (Transaction tx : removed) {
            transactions.removeIf(candidate -> candidate.getId().equals(tx.getId()));
            applyDelta(tx.getAccountId(), tx.getAmount().negate());
        }

        recordNetWorth();
        return MutationResult.applied(List.copyOf(removed));
    }

    public MutationResult<List<Transaction>> transfer(String fromAccountId, String toAccountId, BigDecimal amount,
                                                      LocalDate date, String note) {
        return transfer(fromAccountId, toAccountId, amount, date, note, false);
    }

    /**
     * Moves money between two accounts as a linked pair of transactions:
     * {@code -amount} on the source and {@code +amount} on the destination.
     *
     * Only the destination can be overpaid, so only it is guarded.
     *
     * @return the source and destination legs, in that order
     */
    public MutationResult<List<Transaction>> transfer(String fromAccountId, String toAccountId, BigDecimal amount,
                                                      LocalDate date, String note, boolean skipGuard) {
        if (fromAccountId == null || fromAccountId.equals(toAccountId)) {
            return MutationResult.rejected("Source and destination accounts must be different");
        }
        if (amount == null || amount.signum() <= 0) {
            return MutationResult.rejected("Transfer amount must be positive");
        }

        Optional<Account> from = findAccount(fromAccountId);
        Optional<Account> to = findAccount(toAccountId);
        if (from.isEmpty() || to.isEmpty()) {
            return MutationResult.rejected("Transfer accounts not found");
        }

        Account destination = to.get();
        if (!skipGuard && destination.isDebt() && wouldOverpay(destination.getBalance(), amount)) {
            return MutationResult.pending(List.of(warning(destination, destination.getBalance(), amount)));
        }

        String groupId = newId();
        LocalDate effectiveDate = date != null ? date : today();
        String trimmedNote = isBlank(note) ? null : note.trim();

        Transaction out = Transaction.builder()
            .id(newId())
            .accountId(fromAccountId)
            .amount(amount.negate())
            .date(effectiveDate)
            .description(trimmedNote != null ? trimmedNote : TRANSFER_OUT_DESCRIPTION)
            .kind(TransactionKind.TRANSFER_LEG)
            .transferGroupId(groupId)
            .build();

        Transaction in = Transaction.builder()
            .id(newId())
            .accountId(toAccountId)
            .amount(amount)
            .date(effectiveDate)
            .description(trimmedNote != null ? trimmedNote : TRANSFER_IN_DESCRIPTION)
            .kind(TransactionKind.TRANSFER_LEG)
            .transferGroupId(groupId)
            .build();

        transactions.add(out);
        transactions.add(in);
        replaceAccount(from.get().applyDelta(out.getAmount()));
        replaceAccount(destination.applyDelta(in.getAmount()));

        recordNetWorth();
        return MutationResult.applied(List.of(out, in));
    }

    // ==================== Reset ====================

    /**
     * Clears ledger data.
     *
     * For the transaction and transfer scopes the removed amounts are rolled
     * back onto the accounts, which stay. {@link ResetScope#EVERYTHING} drops
     * accounts, deleted accounts, transactions, bills and net worth history.
     *
     * @return number of transactions removed
     */
    public MutationResult<Integer> reset(ResetScope scope) {
        if (scope == null) {
            return MutationResult.rejected("Reset scope is required");
        }

        if (scope == ResetScope.EVERYTHING) {
            int removed = transactions.size();
            accounts.clear();
            deletedAccounts.clear();
            transactions.clear();
            bills.clear();
            netWorthHistory = new ArrayList<>();
            selectedAccountId = null;
            return MutationResult.applied(removed);
        }

        Predicate<Transaction> removes = tx -> TransferPairing.isTransferLeg(tx)
            ? scope.removesTransfers()
            : scope.removesPlainTransactions();

        Map<String, BigDecimal> rollback = new HashMap<>();
        List<Transaction> kept = new ArrayList<>();
        int removed = 0;
        for (Transaction tx : transactions) {
            if (removes.test(tx)) {
                rollback.merge(tx.getAccountId(), tx.getAmount(), BigDecimal::add);
                removed++;
            } else {
                kept.add(tx);
            }
        }

        transactions.clear();
        transactions.addAll(kept);
        rollback.forEach((accountId, total) -> applyDelta(accountId, total.negate()));

        recordNetWorth();
        return MutationResult.applied(removed);
    }

    // ==================== Bills ====================

    public MutationResult<Bill> addBill(Bill draft) {
        MutationResult<Bill> invalid = validateBill(draft);
        if (invalid != null) {
            return invalid;
        }
        Bill bill = draft.toBuilder()
            .id(newId())
            .name(draft.getName().trim())
            .amount(draft.getAmount().abs())
            .frequency(draft.getFrequency() != null ? draft.getFrequency() : BillFrequency.ONCE)
            .paid(false)
            .build();
        bills.add(bill);
        return MutationResult.applied(bill);
    }

    public MutationResult<Bill> updateBill(String billId, Bill changes) {
        int index = indexOfBill(billId);
        if (index < 0) {
            return MutationResult.rejected("Bill not found: " + billId);
        }
        MutationResult<Bill> invalid = validateBill(changes);
        if (invalid != null) {
            return invalid;
        }
        Bill updated = changes.toBuilder()
            .id(billId)
            .name(changes.getName().trim())
            .amount(changes.getAmount().abs())
            .frequency(changes.getFrequency() != null ? changes.getFrequency() : BillFrequency.ONCE)
            .build();
        bills.set(index, updated);
        return MutationResult.applied(updated);
    }

    public MutationResult<Bill> deleteBill(String billId) {
        int index = indexOfBill(billId);
        if (index < 0) {
            return MutationResult.rejected("Bill not found: " + billId);
        }
        return MutationResult.applied(bills.remove(index));
    }

    /**
     * Pays a bill from its account today. One-time bills are flagged paid;
     * recurring bills move to their next due date and stay unpaid.
     *
     * @return the payment transaction
     */
    public MutationResult<Transaction> markBillPaid(String billId) {
        int index = indexOfBill(billId);
        if (index < 0) {
            return MutationResult.rejected("Bill not found: " + billId);
        }
        Bill bill = bills.get(index);
        if (bill.isPaid() && !bill.getFrequency().isRecurring()) {
            return MutationResult.rejected("Bill is already paid: " + billId);
        }

        Optional<Account> account = findAccount(bill.getAccountId());
        if (account.isEmpty()) {
            return MutationResult.rejected("Account not found: " + bill.getAccountId());
        }

        LocalDate paidOn = today();
        BigDecimal amount = bill.getAmount().abs().negate();

        Transaction payment = Transaction.builder()
            .id(newId())
            .accountId(bill.getAccountId())
            .amount(amount)
            .date(paidOn)
            .description(isBlank(bill.getName()) ? BILL_PAYMENT_DESCRIPTION : bill.getName())
            .kind(TransactionKind.PLAIN)
            .build();

        transactions.add(payment);
        replaceAccount(account.get().applyDelta(amount));

        Bill next = bill.getFrequency().isRecurring()
            ? bill.toBuilder().dueDate(BillSchedule.nextDueDate(bill, paidOn)).paid(false).build()
            : bill.toBuilder().paid(true).build();
        bills.set(index, next);

        recordNetWorth();
        return MutationResult.applied(payment);
    }

    // ==================== Preferences ====================

    public void setNetWorthViewMode(NetWorthViewMode mode) {
        this.netWorthViewMode = mode;
    }

    public void setHideMoney(boolean hideMoney) {
        this.hideMoney = hideMoney;
    }

    public DebtPayoffSettings updateDebtPayoffSettings(DebtPayoffSettings settings) {
        this.debtPayoffSettings = settings != null ? settings.normalized() : DebtPayoffSettings.defaults();
        return debtPayoffSettings;
    }

    // ==================== Views ====================

    public List<Account> getAccounts() {
        return Collections.unmodifiableList(new ArrayList<>(accounts));
    }

    public List<Account> getDeletedAccounts() {
        return Collections.unmodifiableList(new ArrayList<>(deletedAccounts));
    }

    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(new ArrayList<>(transactions));
    }

    public List<Transaction> transactionsFor(String accountId) {
        return transactions.stream()
            .filter(tx -> accountId.equals(tx.getAccountId()))
            .toList();
    }

    public List<Bill> getBills() {
        return Collections.unmodifiableList(new ArrayList<>(bills));
    }

    public List<Bill> unpaidBills() {
        return bills.stream().filter(bill -> !bill.isPaid()).toList();
    }

    public List<NetWorthSnapshot> getNetWorthHistory() {
        return Collections.unmodifiableList(new ArrayList<>(netWorthHistory));
    }

    public NetWorthSummary netWorth() {
        return NetWorthCalculator.calculate(accounts);
    }

    public Optional<Account> findAccount(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return accounts.stream().filter(account -> account.getId().equals(accountId)).findFirst();
    }

    public Optional<Transaction> findTransaction(String transactionId) {
        return transactions.stream().filter(tx -> tx.getId().equals(transactionId)).findFirst();
    }

    /**
     * The selected account, falling back to the first account.
     */
    public Optional<Account> selectedAccount() {
        Optional<Account> selected = findAccount(selectedAccountId);
        return selected.isPresent() ? selected : accounts.stream().findFirst();
    }

    public NetWorthViewMode getNetWorthViewMode() {
        return netWorthViewMode != null ? netWorthViewMode : NetWorthViewMode.DETAILED;
    }

    public boolean isHideMoney() {
        return Boolean.TRUE.equals(hideMoney);
    }

    public DebtPayoffSettings getDebtPayoffSettings() {
        return debtPayoffSettings;
    }

    /**
     * Debt accounts as simulator input. Owed amounts are positive; an overpaid
     * account comes through with a negative balance and is ignored by the simulator.
     */
    public List<DebtInput> debtInputs() {
        return accounts.stream()
            .filter(Account::isDebt)
            .map(account -> {
                BigDecimal owed = account.getBalance().negate();
                BigDecimal starting = account.getStartingBalance() != null
                    ? account.getStartingBalance()
                    : owed.max(BigDecimal.ZERO);
                return new DebtInput(
                    account.getId(),
                    account.getName(),
                    owed.doubleValue(),
                    zeroIfNull(account.getMinimumPayment()).doubleValue(),
                    zeroIfNull(account.getAnnualPercentageRate()).doubleValue(),
                    starting.doubleValue());
            })
            .toList();
    }

    public LedgerSnapshot snapshot() {
        return LedgerSnapshot.builder()
            .accounts(List.copyOf(accounts))
            .deletedAccounts(List.copyOf(deletedAccounts))
            .transactions(List.copyOf(transactions))
            .bills(List.copyOf(bills))
            .netWorthHistory(List.copyOf(netWorthHistory))
            .netWorthViewMode(netWorthViewMode)
            .hideMoney(hideMoney)
            .debtPayoffSettings(debtPayoffSettings)
            .build();
    }

    // ==================== Internals ====================

    /**
     * True when {@code delta} would move a balance from zero-or-below to above zero.
     */
    static boolean wouldOverpay(BigDecimal balance, BigDecimal delta) {
        return delta.signum() > 0
            && balance.signum() <= 0
            && balance.add(delta).signum() > 0;
    }

    /**
     * An edit needs confirmation when it pushes a debt above zero, or when it
     * turns a positive non-debt account into a debt. A debt that is already
     * above zero keeps the override it was given.
     */
    private static boolean wouldLeaveDebtPositive(Account original, Account updated, BigDecimal delta) {
        if (original.isDebt()) {
            return wouldOverpay(original.getBalance(), delta);
        }
        return updated.getBalance().signum() > 0;
    }

    private static OverpaymentWarning warning(Account account, BigDecimal balance, BigDecimal delta) {
        return new OverpaymentWarning(account.getId(), account.getName(), balance, delta, balance.add(delta));
    }

    private static Account normalizeCategoryFields(Account account) {
        if (!account.isDebt()) {
            return account.toBuilder()
                .creditLimit(null)
                .annualPercentageRate(null)
                .minimumPayment(null)
                .startingBalance(null)
                .build();
        }
        BigDecimal magnitude = account.getBalance().abs();
        return account.toBuilder()
            .startingBalance(account.getStartingBalance() != null ? account.getStartingBalance() : magnitude)
            .minimumPayment(account.getMinimumPayment() != null
                ? account.getMinimumPayment()
                : magnitude.multiply(DEFAULT_MINIMUM_PAYMENT_RATE).setScale(2, RoundingMode.HALF_UP))
            .build();
    }

    private MutationResult<Bill> validateBill(Bill bill) {
        if (bill == null || isBlank(bill.getName())) {
            return MutationResult.rejected("Bill name is required");
        }
        if (bill.getAmount() == null || bill.getAmount().signum() == 0) {
            return MutationResult.rejected("Bill amount must be non-zero");
        }
        if (findAccount(bill.getAccountId()).isEmpty()) {
            return MutationResult.rejected("Account not found: " + bill.getAccountId());
        }
        return null;
    }

    private void recordNetWorth() {
        if (accounts.isEmpty()) {
            return;
        }
        NetWorthSnapshot snapshot = NetWorthSnapshot.of(today(), NetWorthCalculator.calculate(accounts));
        netWorthHistory = NetWorthHistory.upsert(netWorthHistory, snapshot);
    }

    private void applyDelta(String accountId, BigDecimal delta) {
        if (delta.signum() == 0) {
            return;
        }
        findAccount(accountId).ifPresent(account -> replaceAccount(account.applyDelta(delta)));
    }

    private void replaceAccount(Account account) {
        int index = indexOfAccount(account.getId());
        if (index >= 0) {
            accounts.set(index, account);
        }
    }

    private int indexOfAccount(String accountId) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).getId().equals(accountId)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfTransaction(String transactionId) {
        for (int i = 0; i < transactions.size(); i++) {
            if (transactions.get(i).getId().equals(transactionId)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfBill(String billId) {
        for (int i = 0; i < bills.size(); i++) {
            if (bills.get(i).getId().equals(billId)) {
                return i;
            }
        }
        return -1;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static BigDecimal orElse(BigDecimal value, BigDecimal fallback) {
        return value != null ? value : fallback;
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
