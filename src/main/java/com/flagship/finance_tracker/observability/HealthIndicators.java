package com.flagship.finance_tracker.observability;

import com.flagship.finance_tracker.store.SnapshotStorage;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the finance tracker.
 */
public class HealthIndicators {

    /**
     * Reports whether snapshots can be persisted. The ledger keeps working in
     * memory when storage is down, so an unwritable medium is DEGRADED, not DOWN.
     */
    @Component("snapshotStorageHealth")
    public static class SnapshotStorageHealthIndicator implements HealthIndicator {

        private final SnapshotStorage storage;

        public SnapshotStorageHealthIndicator(SnapshotStorage storage) {
            this.storage = storage;
        }

        @Override
        public Health health() {
            try {
                Health.Builder builder = storage.isAvailable()
                        ? Health.up()
                        : Health.status("DEGRADED")
                                .withDetail("note", "Changes are kept in memory but will not survive a restart");

                return builder
                        .withDetail("storage", storage.describe())
                        .build();

            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
