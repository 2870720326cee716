package com.flagship.finance_tracker.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_tracker.config.JacksonConfig;
import com.flagship.finance_tracker.ledger.Account;
import com.flagship.finance_tracker.ledger.AccountCategory;
import com.flagship.finance_tracker.ledger.Bill;
import com.flagship.finance_tracker.ledger.BillFrequency;
import com.flagship.finance_tracker.ledger.Ledger;
import com.flagship.finance_tracker.ledger.LedgerSnapshot;
import com.flagship.finance_tracker.ledger.NetWorthViewMode;
import com.flagship.finance_tracker.ledger.Transaction;
import com.flagship.finance_tracker.ledger.TransactionChanges;
import com.flagship.finance_tracker.ledger.TransactionKind;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.payoff.DebtPayoffMode;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Snapshot store tests.
 *
 * These tests verify that:
 * - Snapshots survive a save/load cycle under the profile's key
 * - Malformed or partial data loads leniently or not at all, never throwing
 * - Storage failures are counted and swallowed
 */
class LedgerSnapshotStoreTest {

    private InMemorySnapshotStorage storage;
    private SimpleMeterRegistry registry;
    private LedgerSnapshotStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemorySnapshotStorage();
        registry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        store = new LedgerSnapshotStore(storage, objectMapper, new LedgerMetrics(registry));
    }

    private double failures(String operation) {
        return registry.counter("ledger.persistence.failures", "operation", operation).count();
    }

    @Test
    @DisplayName("Saved snapshot loads back unchanged")
    void testSaveAndLoad() {
        LedgerSnapshot snapshot = LedgerSnapshot.builder()
            .accounts(List.of(Account.builder()
                .id("card")
                .name("Visa")
                .balance(new BigDecimal("-250.75"))
                .category(AccountCategory.DEBT)
                .annualPercentageRate(new BigDecimal("0.1999"))
                .minimumPayment(new BigDecimal("10.00"))
                .startingBalance(new BigDecimal("300"))
                .build()))
            .transactions(List.of(Transaction.builder()
                .id("t1")
                .accountId("card")
                .amount(new BigDecimal("49.25"))
                .date(LocalDate.of(2024, 2, 1))
                .description("Payment")
                .kind(TransactionKind.PLAIN)
                .build()))
            .bills(List.of(Bill.builder()
                .id("b1")
                .name("Phone")
                .amount(new BigDecimal("45"))
                .dueDate(LocalDate.of(2024, 2, 20))
                .accountId("card")
                .frequency(BillFrequency.MONTHLY)
                .build()))
            .netWorthViewMode(NetWorthViewMode.MINIMAL)
            .hideMoney(true)
            .debtPayoffSettings(DebtPayoffSettings.builder()
                .mode(DebtPayoffMode.AVALANCHE)
                .monthlyAllocation(new BigDecimal("400"))
                .showInterest(true)
                .build())
            .build();

        assertTrue(store.save("alice", snapshot));
        assertTrue(storage.get("finance-tracker:dashboard:alice").isPresent());

        LedgerSnapshot loaded = store.load("alice").orElseThrow();

        assertEquals(snapshot.normalized(), loaded);
    }

    @Test
    @DisplayName("Profiles are stored under separate keys")
    void testProfilesIsolated() {
        store.save("alice", LedgerSnapshot.builder().hideMoney(true).build());

        assertTrue(store.load("bob").isEmpty());
        assertTrue(store.load("alice").isPresent());
    }

    @Test
    @DisplayName("Missing profile id never touches storage")
    void testNoProfile() {
        assertFalse(store.save(null, LedgerSnapshot.empty()));
        assertTrue(store.load(" ").isEmpty());
    }

    @Test
    @DisplayName("Saved JSON always contains every list field")
    void testSaveWritesAllLists() {
        store.save("alice", LedgerSnapshot.builder().accounts(null).bills(null).build());

        String json = storage.get(LedgerSnapshotStore.keyFor("alice")).orElseThrow();

        assertTrue(json.contains("\"accounts\":[]"));
        assertTrue(json.contains("\"deletedAccounts\":[]"));
        assertTrue(json.contains("\"transactions\":[]"));
        assertTrue(json.contains("\"bills\":[]"));
        assertTrue(json.contains("\"netWorthHistory\":[]"));
    }

    @Test
    @DisplayName("Non-array fields load as empty and unknown categories load as assets")
    void testLenientLoad() {
        storage.set(LedgerSnapshotStore.keyFor("legacy"), """
            {
              "accounts": [
                {"id": "a1", "name": "Cash", "balance": 20, "accountCategory": "wallet"},
                null,
                {"id": "d1", "name": "Loan", "balance": -900, "accountCategory": "debt", "apr": 0.05}
              ],
              "deletedAccounts": "oops",
              "transactions": {"not": "an array"},
              "bills": [{"id": "b1", "name": "Water", "amount": 30, "accountId": "a1", "frequency": "yearly"}],
              "netWorthViewMode": "fancy",
              "hideMoney": "yes",
              "someFutureField": 42
            }
            """);

        LedgerSnapshot loaded = store.load("legacy").orElseThrow();

        assertEquals(2, loaded.getAccounts().size());
        assertEquals(AccountCategory.ASSET, loaded.getAccounts().get(0).getCategory());
        assertEquals(AccountCategory.DEBT, loaded.getAccounts().get(1).getCategory());
        assertEquals(0, new BigDecimal("0.05").compareTo(loaded.getAccounts().get(1).getAnnualPercentageRate()));
        assertTrue(loaded.getDeletedAccounts().isEmpty());
        assertTrue(loaded.getTransactions().isEmpty());
        assertEquals(BillFrequency.ONCE, loaded.getBills().get(0).getFrequency());
        assertNull(loaded.getNetWorthViewMode());
        assertNull(loaded.getHideMoney());
        assertEquals(DebtPayoffSettings.defaults(), loaded.getDebtPayoffSettings());
        assertEquals(0.0, failures("load"));
    }

    @Test
    @DisplayName("Records missing required fields are dropped and the ledger stays writable")
    void testIncompleteRecordsDropped() {
        storage.set(LedgerSnapshotStore.keyFor("partial"), """
            {
              "accounts": [{"id": "a1", "name": "Cash", "balance": 20, "accountCategory": "asset"}],
              "transactions": [
                {"id": "t1", "accountId": "a1", "amount": 5, "date": "2024-03-01", "description": "Transfer in"},
                {"id": "t2", "amount": -5, "date": "2024-03-01", "description": "Transfer out"}
              ],
              "bills": [
                {"id": "b1", "name": "Water", "amount": 30, "accountId": "a1"},
                {"id": "b2", "name": "Orphan", "amount": 10}
              ],
              "netWorthHistory": [
                {"date": "2024-03-01", "value": 20, "totalAssets": 20, "totalDebts": 0},
                {"value": 15, "totalAssets": 15, "totalDebts": 0}
              ]
            }
            """);

        LedgerSnapshot loaded = store.load("partial").orElseThrow();

        assertEquals(List.of("t1"), loaded.getTransactions().stream().map(Transaction::getId).toList());
        assertEquals(List.of("b1"), loaded.getBills().stream().map(Bill::getId).toList());
        assertEquals(1, loaded.getNetWorthHistory().size());
        assertEquals(LocalDate.of(2024, 3, 1), loaded.getNetWorthHistory().get(0).getDate());

        // Later mutations touch history upsert and transfer pairing
        Ledger ledger = new Ledger(loaded, Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
        assertTrue(ledger.addTransaction("a1", new BigDecimal("1"), null, "Coffee refund").isApplied());
        assertTrue(ledger.updateTransaction("t1",
            TransactionChanges.builder().amount(new BigDecimal("6")).build()).isApplied());
        assertEquals(2, ledger.getNetWorthHistory().size());
    }

    @Test
    @DisplayName("Corrupt data loads as absent and is counted")
    void testCorruptData() {
        storage.set(LedgerSnapshotStore.keyFor("broken"), "{not json");
        storage.set(LedgerSnapshotStore.keyFor("array"), "[1, 2, 3]");

        assertTrue(store.load("broken").isEmpty());
        assertTrue(store.load("array").isEmpty());
        assertEquals(2.0, failures("load"));
    }

    @Test
    @DisplayName("Storage failures are swallowed and counted")
    void testStorageFailure() {
        SnapshotStorage failing = new SnapshotStorage() {
            @Override
            public Optional<String> get(String key) {
                throw new IllegalStateException("disk unplugged");
            }

            @Override
            public void set(String key, String value) {
                throw new IllegalStateException("disk unplugged");
            }

            @Override
            public void remove(String key) {
                throw new IllegalStateException("disk unplugged");
            }

            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public String describe() {
                return "failing";
            }
        };
        LedgerSnapshotStore failingStore =
            new LedgerSnapshotStore(failing, new JacksonConfig().objectMapper(), new LedgerMetrics(registry));

        assertFalse(failingStore.save("alice", LedgerSnapshot.empty()));
        assertTrue(failingStore.load("alice").isEmpty());
        assertEquals(1.0, failures("save"));
        assertEquals(1.0, failures("load"));
    }
}
