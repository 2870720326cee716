package com.flagship.finance_tracker.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each key as a JSON file in one directory.
 *
 * Writes go to a temporary file first and are moved into place, so a crash
 * mid-write leaves the previous snapshot intact.
 */
@Slf4j
public class FileSnapshotStorage implements SnapshotStorage {

    private static final String FILE_SUFFIX = ".json";

    private final Path directory;

    public FileSnapshotStorage(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to plain replace", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    @Override
    public void remove(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + file, e);
        }
    }

    @Override
    public boolean isAvailable() {
        if (Files.isDirectory(directory)) {
            return Files.isWritable(directory);
        }
        if (Files.exists(directory)) {
            return false;
        }
        Path parent = directory.toAbsolutePath().getParent();
        return parent != null && Files.isWritable(parent);
    }

    @Override
    public String describe() {
        return "file (" + directory.toAbsolutePath() + ")";
    }

    Path fileFor(String key) {
        String safeName = key.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve(safeName + FILE_SUFFIX);
    }
}
