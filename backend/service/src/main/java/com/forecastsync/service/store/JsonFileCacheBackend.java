package com.forecastsync.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.engine.cache.CacheBackend;
import com.forecastsync.engine.cache.CacheEntry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class JsonFileCacheBackend implements CacheBackend {
    private static final Logger LOGGER = Logger.getLogger(JsonFileCacheBackend.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final TypeReference<Map<String, CacheEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

    public JsonFileCacheBackend(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public Map<String, CacheEntry> loadAll() {
        lock.lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(String key, CacheEntry entry) {
        lock.lock();
        try {
            Map<String, CacheEntry> next = new LinkedHashMap<>(entries);
            next.put(key, entry);
            persist(next);
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(String key) {
        lock.lock();
        try {
            if (!entries.containsKey(key)) {
                return;
            }
            Map<String, CacheEntry> next = new LinkedHashMap<>(entries);
            next.remove(key);
            persist(next);
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeAll() {
        lock.lock();
        try {
            persist(Map.of());
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, CacheEntry> loaded = MAPPER.readValue(in, ENTRIES);
            if (loaded != null) {
                entries.putAll(loaded);
            }
        } catch (IOException e) {
            // Cached forecasts can always be fetched again.
            LOGGER.log(Level.WARNING, "Ignoring unreadable forecast cache " + file, e);
        }
    }

    private void persist(Map<String, CacheEntry> next) {
        try {
            JsonUtils.writeAtomically(file, next);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing forecast cache to " + file, e);
        }
    }
}
