package com.forecastsync.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.engine.alert.SeenAlertStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileSeenAlertStore implements SeenAlertStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> seen = new LinkedHashSet<>();

    public JsonFileSeenAlertStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public boolean contains(String alertId) {
        lock.lock();
        try {
            return seen.contains(alertId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addAll(Collection<String> alertIds) {
        lock.lock();
        try {
            if (seen.containsAll(alertIds)) {
                return;
            }
            Set<String> next = new TreeSet<>(seen);
            next.addAll(alertIds);
            persist(next);
            seen.addAll(alertIds);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> all() {
        lock.lock();
        try {
            return Set.copyOf(seen);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            persist(Set.of());
            seen.clear();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            SeenAlertsFile loaded = MAPPER.readValue(in, SeenAlertsFile.class);
            if (loaded.alertIds() != null) {
                seen.addAll(loaded.alertIds());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading seen alerts from " + file, e);
        }
    }

    private void persist(Set<String> next) {
        try {
            JsonUtils.writeAtomically(file, new SeenAlertsFile(new TreeSet<>(next)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing seen alerts to " + file, e);
        }
    }

    private record SeenAlertsFile(Set<String> alertIds) {
    }
}
