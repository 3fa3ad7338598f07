package com.forecastsync.engine.cache;

import com.forecastsync.core.error.InvalidInputException;
import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.Snapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

public class CacheStore {
    private static final Logger LOGGER = Logger.getLogger(CacheStore.class.getName());

    private final CacheBackend backend;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();

    public CacheStore(CacheBackend backend, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        entries.putAll(backend.loadAll());
        LOGGER.fine(() -> "Loaded " + entries.size() + " cached snapshots");
    }

    public Optional<CacheEntry> get(String key) {
        String normalized = requireKey(key);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(normalized));
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheEntry put(String key, Snapshot snapshot, Duration dailyTtl, Duration hourlyTtl) {
        String normalized = requireKey(key);
        Objects.requireNonNull(snapshot, "snapshot is required");
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(snapshot, now, now.plus(dailyTtl), now.plus(hourlyTtl));
        lock.writeLock().lock();
        try {
            backend.write(normalized, entry);
            entries.put(normalized, entry);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<CacheEntry> patchHourly(String key, List<ForecastPoint> hourly, Duration hourlyTtl) {
        String normalized = requireKey(key);
        lock.writeLock().lock();
        try {
            CacheEntry current = entries.get(normalized);
            if (current == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            CacheEntry patched = new CacheEntry(
                    current.snapshot().withHourly(hourly),
                    current.storedAt(),
                    current.dailyExpiresAt(),
                    now.plus(hourlyTtl)
            );
            backend.write(normalized, patched);
            entries.put(normalized, patched);
            return Optional.of(patched);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Duration> age(String key) {
        return get(key).map(entry -> Duration.between(entry.storedAt(), clock.instant()));
    }

    public void clear(String key) {
        String normalized = requireKey(key);
        lock.writeLock().lock();
        try {
            backend.remove(normalized);
            entries.remove(normalized);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearAll() {
        lock.writeLock().lock();
        try {
            backend.removeAll();
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> keys() {
        lock.readLock().lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidInputException("Location key is required");
        }
        return key.trim();
    }
}
