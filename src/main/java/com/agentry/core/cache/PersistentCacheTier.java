package com.agentry.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Slow cache tier: one JSON file per entry, named by the SHA-256 of the key.
 * <p>
 * File modification time doubles as the recency marker; reads touch the file
 * and the byte ceiling is enforced by deleting the least recently touched files.
 * Every I/O failure is logged and reported as a miss.
 * <p>
 * Operations on one tier are serialized by a lock. Entries are written to a
 * temporary file and moved into place, so a reader never sees a partial entry.
 */
public class PersistentCacheTier {

    private static final Logger log = LoggerFactory.getLogger(PersistentCacheTier.class);
    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * On-disk entry layout.
     *
     * @param key       the full cache key
     * @param storedAt  epoch millis when written
     * @param expiresAt epoch millis after which the entry is dead, null for no expiry
     * @param value     the cached JSON value
     */
    public record PersistedEntry(String key, long storedAt, Long expiresAt, JsonNode value) {}

    private final Path directory;
    private final long maxBytes;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public PersistentCacheTier(Path directory, long maxBytes, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.maxBytes = maxBytes;
        this.mapper = mapper;
        this.clock = clock;
        ensureDirectory();
    }

    public Optional<JsonNode> read(String key) {
        lock.lock();
        try {
            return readLocked(key);
        } finally {
            lock.unlock();
        }
    }

    private Optional<JsonNode> readLocked(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            PersistedEntry entry = mapper.readValue(file.toFile(), PersistedEntry.class);
            if (!key.equals(entry.key())) {
                log.debug("Cache file {} holds a different key, ignoring", file.getFileName());
                return Optional.empty();
            }
            if (entry.expiresAt() != null && clock.millis() >= entry.expiresAt()) {
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            Files.setLastModifiedTime(file, FileTime.from(clock.instant()));
            return Optional.ofNullable(entry.value());
        } catch (IOException e) {
            log.warn("Failed to read cache entry {}, deleting it: {}", file.getFileName(), e.getMessage());
            deleteQuietly(file);
            return Optional.empty();
        }
    }

    /**
     * Writes the entry and trims the tier back under its byte ceiling.
     *
     * @return false when the write failed or the entry alone exceeds the ceiling
     */
    public boolean write(String key, JsonNode value, Duration ttl) {
        lock.lock();
        try {
            return writeLocked(key, value, ttl);
        } finally {
            lock.unlock();
        }
    }

    private boolean writeLocked(String key, JsonNode value, Duration ttl) {
        Instant now = clock.instant();
        Long expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : now.plus(ttl).toEpochMilli();
        Path file = fileFor(key);
        try {
            ensureDirectory();
            byte[] bytes = mapper.writeValueAsBytes(new PersistedEntry(key, now.toEpochMilli(), expiresAt, value));
            if (bytes.length > maxBytes) {
                log.debug("Cache entry {} ({} bytes) exceeds disk tier ceiling", key, bytes.length);
                return false;
            }
            replaceAtomically(file, bytes);
            Files.setLastModifiedTime(file, FileTime.from(now));
            enforceCeiling(file);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write cache entry {}: {}", key, e.getMessage());
            return false;
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            log.warn("Failed to delete cache entry {}: {}", key, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every entry whose key starts with the prefix.
     */
    public int deleteByPrefix(String keyPrefix) {
        lock.lock();
        try {
            return deleteByPrefixLocked(keyPrefix);
        } finally {
            lock.unlock();
        }
    }

    private int deleteByPrefixLocked(String keyPrefix) {
        int removed = 0;
        for (Path file : listFiles()) {
            try {
                PersistedEntry entry = mapper.readValue(file.toFile(), PersistedEntry.class);
                if (entry.key() != null && entry.key().startsWith(keyPrefix)) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            } catch (IOException e) {
                log.debug("Skipping unreadable cache file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return removed;
    }

    public void clear() {
        lock.lock();
        try {
            for (Path file : listFiles()) {
                deleteQuietly(file);
            }
        } finally {
            lock.unlock();
        }
    }

    public int purgeExpired() {
        lock.lock();
        try {
            return purgeExpiredLocked();
        } finally {
            lock.unlock();
        }
    }

    private int purgeExpiredLocked() {
        long now = clock.millis();
        int removed = 0;
        for (Path file : listFiles()) {
            try {
                PersistedEntry entry = mapper.readValue(file.toFile(), PersistedEntry.class);
                if (entry.expiresAt() != null && now >= entry.expiresAt()) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            } catch (IOException e) {
                log.debug("Removing unreadable cache file {}", file.getFileName());
                deleteQuietly(file);
                removed++;
            }
        }
        return removed;
    }

    public long totalBytes() {
        lock.lock();
        try {
            long total = 0;
            for (Path file : listFiles()) {
                total += sizeOf(file);
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    public int entryCount() {
        lock.lock();
        try {
            return listFiles().size();
        } finally {
            lock.unlock();
        }
    }

    public long maxBytes() {
        return maxBytes;
    }

    public Path directory() {
        return directory;
    }

    private void enforceCeiling(Path justWritten) {
        List<Path> files = listFiles();
        long total = files.stream().mapToLong(PersistentCacheTier::sizeOf).sum();
        if (total <= maxBytes) {
            return;
        }
        files.sort(Comparator.comparing(PersistentCacheTier::lastModified));
        for (Path file : files) {
            if (total <= maxBytes) {
                break;
            }
            if (file.equals(justWritten)) {
                continue;
            }
            long size = sizeOf(file);
            if (deleteQuietly(file)) {
                total -= size;
            }
        }
    }

    private void replaceAtomically(Path file, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(directory, "entry-", TEMP_SUFFIX);
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private List<Path> listFiles() {
        if (!Files.isDirectory(directory)) {
            return new ArrayList<>();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return new ArrayList<>(stream
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .toList());
        } catch (IOException e) {
            log.warn("Failed to list cache directory {}: {}", directory, e.getMessage());
            return new ArrayList<>();
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(Digests.sha256Hex(key) + SUFFIX);
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Failed to create cache directory {}: {}", directory, e.getMessage());
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0;
        }
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
