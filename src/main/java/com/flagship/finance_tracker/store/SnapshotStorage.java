package com.flagship.finance_tracker.store;

import java.util.Optional;

/**
 * Key to blob storage backing the snapshot store.
 *
 * Implementations throw {@link java.io.UncheckedIOException} (or another
 * runtime exception) when the medium fails. Callers decide whether that is fatal.
 */
public interface SnapshotStorage {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);

    /**
     * Whether the storage can currently accept reads and writes.
     */
    boolean isAvailable();

    /**
     * Short human readable description for health output.
     */
    String describe();
}
