package com.forecastsync.engine.cache;

import java.util.Map;

/**
 * Durable storage behind {@link CacheStore}: one record per location key. Writes must be durable when
 * the call returns.
 */
public interface CacheBackend {
    Map<String, CacheEntry> loadAll();

    void write(String key, CacheEntry entry);

    void remove(String key);

    void removeAll();
}
