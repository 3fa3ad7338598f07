package com.forecastsync.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastsync.core.error.InvalidInputException;
import com.forecastsync.core.model.Location;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.engine.api.LocationStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileLocationStore implements LocationStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Location> locations = new TreeMap<>();

    public JsonFileLocationStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public List<Location> listAll() {
        lock.lock();
        try {
            return List.copyOf(locations.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Location> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(locations.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void upsert(Location location) {
        if (location == null) {
            throw new InvalidInputException("Location is required");
        }
        lock.lock();
        try {
            Location existing = locations.get(location.id());
            if (existing != null && !existing.coordinate().cacheKey().equals(location.coordinate().cacheKey())) {
                throw new InvalidInputException("Location " + location.id() + " already exists at "
                        + existing.coordinate().cacheKey() + "; coordinates cannot change");
            }
            Map<String, Location> next = new TreeMap<>(locations);
            next.put(location.id(), location);
            persist(next);
            locations.put(location.id(), location);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.lock();
        try {
            if (!locations.containsKey(id)) {
                return false;
            }
            Map<String, Location> next = new TreeMap<>(locations);
            next.remove(id);
            persist(next);
            locations.remove(id);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            LocationsFile loaded = MAPPER.readValue(in, LocationsFile.class);
            if (loaded.locations() != null) {
                loaded.locations().forEach(location -> locations.put(location.id(), location));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading locations from " + file, e);
        }
    }

    private void persist(Map<String, Location> next) {
        try {
            JsonUtils.writeAtomically(file, new LocationsFile(new ArrayList<>(next.values())));
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing locations to " + file, e);
        }
    }

    private record LocationsFile(List<Location> locations) {
    }
}
