package com.forecastsync.engine.api;

import com.forecastsync.core.model.Location;

import java.util.List;
import java.util.Optional;

public interface LocationStore {
    List<Location> listAll();

    Optional<Location> find(String id);

    void upsert(Location location);

    boolean delete(String id);
}
