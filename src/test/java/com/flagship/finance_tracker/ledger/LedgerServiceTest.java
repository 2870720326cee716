package com.flagship.finance_tracker.ledger;

import com.flagship.finance_tracker.payoff.DebtPayoffMode;
import com.flagship.finance_tracker.payoff.DebtPayoffResult;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import com.flagship.finance_tracker.store.LedgerSnapshotStore;
import com.flagship.finance_tracker.store.SnapshotStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service tests: persistence and profile handling around the ledger.
 *
 * These tests verify that:
 * - Applied mutations are written through to storage immediately
 * - Pending and rejected mutations leave storage untouched
 * - Switching profile reloads state and keeps profiles isolated
 * - Without a profile nothing is persisted
 */
@SpringBootTest
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerSnapshotStore snapshotStore;

    @Autowired
    private SnapshotStorage storage;

    private String profileId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        // Unique profile per test so the shared context never leaks state
        profileId = "profile-" + UUID.randomUUID().toString().substring(0, 8);
        ledgerService.openProfile(profileId);
    }

    private Account addAccount(String name, String balance, AccountCategory category) {
        MutationResult<Account> result = ledgerService.addAccount(AccountDraft.builder()
            .name(name)
            .balance(new BigDecimal(balance))
            .category(category)
            .build());
        assertTrue(result.isApplied(), "account should be created: " + result.getReason());
        return result.getValue();
    }

    @Test
    @DisplayName("Applied mutations are saved immediately")
    void testWriteThrough() {
        printTestHeader("Write-through Persistence");
        printInput("Profile", profileId);

        Account checking = addAccount("Checking", "1000.00", AccountCategory.ASSET);
        ledgerService.addTransaction(checking.getId(), new BigDecimal("-42.50"), null, "Groceries", false);

        LedgerSnapshot stored = snapshotStore.load(profileId).orElseThrow();
        printOutput("Stored accounts", stored.getAccounts());

        assertEquals(1, stored.getAccounts().size());
        assertEquals(0, new BigDecimal("957.50").compareTo(stored.getAccounts().get(0).getBalance()));
        assertEquals(1, stored.getTransactions().size());
        assertEquals("Groceries", stored.getTransactions().get(0).getDescription());
        assertFalse(stored.getNetWorthHistory().isEmpty());

        printSuccess("Every applied change is in storage");
    }

    @Test
    @DisplayName("Pending and rejected mutations do not touch storage")
    void testPendingNotSaved() {
        printTestHeader("Pending Not Saved");

        Account card = addAccount("Visa", "-300.00", AccountCategory.DEBT);
        String before = storage.get(LedgerSnapshotStore.keyFor(profileId)).orElseThrow();

        MutationResult<Transaction> pending =
            ledgerService.addTransaction(card.getId(), new BigDecimal("400.00"), null, "Payment", false);
        MutationResult<Transaction> rejected =
            ledgerService.addTransaction(card.getId(), BigDecimal.ZERO, null, "Nothing", false);

        printOutput("Pending outcome", pending.getOutcome());
        printOutput("Rejected reason", rejected.getReason());

        assertTrue(pending.isPending());
        assertEquals(1, pending.getWarnings().size());
        assertTrue(rejected.isRejected());
        assertEquals(before, storage.get(LedgerSnapshotStore.keyFor(profileId)).orElseThrow());
        assertEquals(0, new BigDecimal("-300.00").compareTo(ledgerService.accounts().get(0).getBalance()));

        printSuccess("Storage unchanged until the change is confirmed");
    }

    @Test
    @DisplayName("Confirmed overpayment is applied and saved")
    void testConfirmedOverpayment() {
        printTestHeader("Confirmed Overpayment");

        Account card = addAccount("Visa", "-300.00", AccountCategory.DEBT);
        MutationResult<Transaction> result =
            ledgerService.addTransaction(card.getId(), new BigDecimal("400.00"), null, "Payment", true);

        assertTrue(result.isApplied());
        Account stored = snapshotStore.load(profileId).orElseThrow().getAccounts().get(0);
        printOutput("Stored balance", stored.getBalance());
        assertEquals(0, new BigDecimal("100.00").compareTo(stored.getBalance()));

        printSuccess("Overpayment applied after confirmation");
    }

    @Test
    @DisplayName("Switching profiles reloads state from storage")
    void testProfileSwitch() {
        printTestHeader("Profile Switch");

        addAccount("Checking", "250.00", AccountCategory.ASSET);
        String otherProfile = profileId + "-other";

        ledgerService.openProfile(otherProfile);
        printInput("Switched to", otherProfile);
        assertTrue(ledgerService.accounts().isEmpty());
        assertEquals(otherProfile, ledgerService.getActiveProfileId().orElseThrow());

        ledgerService.openProfile(profileId);
        printOutput("Accounts after switching back", ledgerService.accounts());
        assertEquals(1, ledgerService.accounts().size());
        assertEquals("Checking", ledgerService.accounts().get(0).getName());

        printSuccess("Profiles are isolated");
    }

    @Test
    @DisplayName("Work run for a profile sees that profile even when another was active")
    void testWithProfileActivatesAndRuns() {
        printTestHeader("Activate And Run");

        addAccount("Checking", "250.00", AccountCategory.ASSET);
        String otherProfile = profileId + "-other";

        MutationResult<Account> created = ledgerService.withProfile(otherProfile,
            () -> ledgerService.addAccount(AccountDraft.builder().name("Other").balance(BigDecimal.TEN).build()));
        printOutput("Active profile", ledgerService.getActiveProfileId().orElse(null));

        assertTrue(created.isApplied());
        assertEquals(otherProfile, ledgerService.getActiveProfileId().orElseThrow());
        assertEquals(List.of("Other"),
            snapshotStore.load(otherProfile).orElseThrow().getAccounts().stream().map(Account::getName).toList());
        assertEquals(List.of("Checking"),
            snapshotStore.load(profileId).orElseThrow().getAccounts().stream().map(Account::getName).toList());

        printSuccess("Activation and work ran against the same profile");
    }

    @Test
    @DisplayName("Re-opening the active profile keeps unsaved session state")
    void testReopenKeepsSelection() {
        printTestHeader("Re-open Active Profile");

        Account first = addAccount("Checking", "100.00", AccountCategory.ASSET);
        addAccount("Savings", "200.00", AccountCategory.ASSET);
        ledgerService.selectAccount(first.getId());

        ledgerService.openProfile(profileId);

        assertEquals(first.getId(), ledgerService.selectedAccount().map(Account::getId).orElseThrow());
        printSuccess("Selection survives re-opening the same profile");
    }

    @Test
    @DisplayName("Without a profile nothing is persisted")
    void testNoProfile() {
        printTestHeader("No Profile");

        ledgerService.openProfile(null);
        addAccount("Wallet", "20.00", AccountCategory.ASSET);

        assertTrue(ledgerService.getActiveProfileId().isEmpty());
        assertEquals(1, ledgerService.accounts().size());
        assertTrue(storage.get(LedgerSnapshotStore.keyFor("null")).isEmpty());

        ledgerService.openProfile(" ");
        assertTrue(ledgerService.accounts().isEmpty());

        printSuccess("Anonymous ledger stays in memory");
    }

    @Test
    @DisplayName("Preferences are persisted with the snapshot")
    void testPreferencesPersisted() {
        printTestHeader("Preferences");

        ledgerService.updatePreferences(NetWorthViewMode.MINIMAL, true);
        ledgerService.updatePreferences(null, null);

        LedgerSnapshot stored = snapshotStore.load(profileId).orElseThrow();
        printOutput("Stored view mode", stored.getNetWorthViewMode());

        assertEquals(NetWorthViewMode.MINIMAL, stored.getNetWorthViewMode());
        assertEquals(Boolean.TRUE, stored.getHideMoney());
        assertTrue(ledgerService.isHideMoney());

        printSuccess("Preferences round-trip through storage");
    }

    @Test
    @DisplayName("Full reset keeps payoff settings and clears the rest")
    void testResetEverything() {
        printTestHeader("Reset Everything");

        Account checking = addAccount("Checking", "100.00", AccountCategory.ASSET);
        ledgerService.addTransaction(checking.getId(), new BigDecimal("10.00"), null, "Refund", false);
        ledgerService.updateDebtPayoffSettings(DebtPayoffSettings.builder()
            .mode(DebtPayoffMode.AVALANCHE)
            .monthlyAllocation(new BigDecimal("250"))
            .build());

        MutationResult<Integer> result = ledgerService.reset(ResetScope.EVERYTHING);
        printOutput("Transactions removed", result.getValue());

        assertTrue(result.isApplied());
        assertEquals(1, result.getValue());

        LedgerSnapshot stored = snapshotStore.load(profileId).orElseThrow();
        assertTrue(stored.getAccounts().isEmpty());
        assertTrue(stored.getTransactions().isEmpty());
        assertTrue(stored.getNetWorthHistory().isEmpty());
        assertEquals(DebtPayoffMode.AVALANCHE, stored.getDebtPayoffSettings().getMode());

        printSuccess("Reset cleared data and kept settings");
    }

    @Test
    @DisplayName("Payoff projection uses the profile's debts and saved settings")
    void testProjectDebtPayoff() {
        printTestHeader("Debt Payoff Projection");

        addAccount("Checking", "5000.00", AccountCategory.ASSET);
        Account card = addAccount("Visa", "-300.00", AccountCategory.DEBT);
        ledgerService.updateDebtPayoffSettings(DebtPayoffSettings.builder()
            .mode(DebtPayoffMode.AVALANCHE)
            .monthlyAllocation(new BigDecimal("100"))
            .build());

        DebtPayoffResult result = ledgerService.projectDebtPayoff();
        printOutput("Debt-free date", result.getOverallEstimatedDebtFreeDate());
        printOutput("Months", result.getSchedule().size());

        assertEquals(DebtPayoffMode.AVALANCHE, result.getMode());
        assertFalse(result.isInsufficientAllocation());
        assertEquals(1, result.getDebts().size());
        assertEquals(card.getId(), result.getDebts().get(0).getId());
        assertEquals(card.getId(), result.getNextDebtId());
        assertNotNull(result.getOverallEstimatedDebtFreeDate());
        assertFalse(result.getSchedule().isEmpty());
        assertEquals(0.0, result.getSchedule().get(result.getSchedule().size() - 1).getTotalRemaining(), 0.005);

        printSuccess("Projection produced a payoff schedule");
    }

    @Test
    @DisplayName("Allocation below minimum payments skips the simulation")
    void testProjectInsufficientAllocation() {
        printTestHeader("Insufficient Allocation");

        addAccount("Visa", "-1000.00", AccountCategory.DEBT);
        ledgerService.updateDebtPayoffSettings(DebtPayoffSettings.builder()
            .mode(DebtPayoffMode.SNOWBALL)
            .monthlyAllocation(new BigDecimal("5"))
            .build());

        DebtPayoffResult result = ledgerService.projectDebtPayoff();
        printOutput("Total minimum payments", result.getTotalMinimumPayments());

        assertTrue(result.isInsufficientAllocation());
        assertTrue(result.getSchedule().isEmpty());
        assertNull(result.getOverallEstimatedDebtFreeDate());

        printSuccess("Insufficient allocation reported without a schedule");
    }
}
