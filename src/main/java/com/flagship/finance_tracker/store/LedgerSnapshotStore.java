package com.flagship.finance_tracker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_tracker.ledger.Account;
import com.flagship.finance_tracker.ledger.Bill;
import com.flagship.finance_tracker.ledger.LedgerSnapshot;
import com.flagship.finance_tracker.ledger.NetWorthViewMode;
import com.flagship.finance_tracker.ledger.Transaction;
import com.flagship.finance_tracker.networth.NetWorthSnapshot;
import com.flagship.finance_tracker.observability.LedgerMetrics;
import com.flagship.finance_tracker.payoff.DebtPayoffSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Profile-keyed persistence of ledger snapshots on top of a {@link SnapshotStorage}.
 *
 * Loading is lenient: list fields that are missing or not arrays load as
 * empty lists and null elements are dropped. Anything that is not a JSON
 * object at all is treated as corrupt, logged, and reported as absent.
 *
 * Failures never propagate. The in-memory ledger stays authoritative and the
 * next successful save overwrites whatever is stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerSnapshotStore {

    static final String KEY_PREFIX = "finance-tracker:dashboard:";

    private final SnapshotStorage storage;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    public static String keyFor(String profileId) {
        return KEY_PREFIX + profileId;
    }

    /**
     * @return the stored snapshot, or empty if none exists or it cannot be read
     */
    public Optional<LedgerSnapshot> load(String profileId) {
        if (profileId == null || profileId.isBlank()) {
            return Optional.empty();
        }

        String key = keyFor(profileId);
        Optional<String> raw;
        try {
            raw = storage.get(key);
        } catch (RuntimeException e) {
            log.error("Failed to read snapshot: key={}, error={}", key, e.getMessage());
            metrics.recordPersistenceFailure("load");
            return Optional.empty();
        }

        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }

        try {
            JsonNode root = objectMapper.readTree(raw.get());
            if (root == null || !root.isObject()) {
                log.error("Stored snapshot is not a JSON object, ignoring it: key={}", key);
                metrics.recordPersistenceFailure("load");
                return Optional.empty();
            }
            return Optional.of(parse(root));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Stored snapshot is corrupt, ignoring it: key={}, error={}", key, e.getMessage());
            metrics.recordPersistenceFailure("load");
            return Optional.empty();
        }
    }

    /**
     * Writes the snapshot with every list field present.
     *
     * @return true if the write succeeded
     */
    public boolean save(String profileId, LedgerSnapshot snapshot) {
        if (profileId == null || profileId.isBlank()) {
            return false;
        }

        String key = keyFor(profileId);
        try {
            String json = objectMapper.writeValueAsString(snapshot.normalized());
            storage.set(key, json);
            log.debug("Saved snapshot: key={}, bytes={}", key, json.length());
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to save snapshot: key={}, error={}", key, e.getMessage());
            metrics.recordPersistenceFailure("save");
            return false;
        }
    }

    private LedgerSnapshot parse(JsonNode root) throws JsonProcessingException {
        JsonNode viewMode = root.get("netWorthViewMode");
        JsonNode hideMoney = root.get("hideMoney");
        JsonNode settings = root.get("debtPayoffSettings");

        return LedgerSnapshot.builder()
            .accounts(readList(root, "accounts", Account.class))
            .deletedAccounts(readList(root, "deletedAccounts", Account.class))
            .transactions(readList(root, "transactions", Transaction.class))
            .bills(readList(root, "bills", Bill.class))
            .netWorthHistory(readList(root, "netWorthHistory", NetWorthSnapshot.class))
            .netWorthViewMode(viewMode != null && viewMode.isTextual()
                ? NetWorthViewMode.fromCode(viewMode.asText())
                : null)
            .hideMoney(hideMoney != null && hideMoney.isBoolean() ? hideMoney.booleanValue() : null)
            .debtPayoffSettings(settings != null && settings.isObject()
                ? objectMapper.treeToValue(settings, DebtPayoffSettings.class)
                : null)
            .build()
            .normalized();
    }

    private <T> List<T> readList(JsonNode root, String field, Class<T> type) throws JsonProcessingException {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<T> items = new ArrayList<>();
        for (JsonNode element : node) {
            if (element == null || element.isNull()) {
                continue;
            }
            T item = objectMapper.treeToValue(element, type);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }
}
