package com.flagship.finance_tracker.config;

import com.flagship.finance_tracker.store.FileSnapshotStorage;
import com.flagship.finance_tracker.store.InMemorySnapshotStorage;
import com.flagship.finance_tracker.store.SnapshotStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the snapshot storage and the clock.
 *
 * ledger.storage.type: file (default) or memory
 * ledger.storage.directory: where file storage keeps one JSON file per profile
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SnapshotStorage snapshotStorage(
            @Value("${ledger.storage.type:file}") String type,
            @Value("${ledger.storage.directory:${user.home}/.finance-tracker}") String directory) {

        if ("memory".equalsIgnoreCase(type)) {
            log.info("Using in-memory snapshot storage; data will not survive a restart");
            return new InMemorySnapshotStorage();
        }
        if (!"file".equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unsupported ledger.storage.type: " + type);
        }

        log.info("Using file snapshot storage: directory={}", directory);
        return new FileSnapshotStorage(Path.of(directory));
    }
}
