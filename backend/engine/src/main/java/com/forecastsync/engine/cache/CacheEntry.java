package com.forecastsync.engine.cache;

import com.forecastsync.core.model.Snapshot;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry(
        Snapshot snapshot,
        Instant storedAt,
        Instant dailyExpiresAt,
        Instant hourlyExpiresAt
) {
    public CacheEntry {
        Objects.requireNonNull(snapshot, "snapshot is required");
        Objects.requireNonNull(storedAt, "storedAt is required");
        Objects.requireNonNull(dailyExpiresAt, "dailyExpiresAt is required");
        Objects.requireNonNull(hourlyExpiresAt, "hourlyExpiresAt is required");
    }

    public boolean isUsable(Instant now) {
        return now.isBefore(dailyExpiresAt);
    }

    public boolean isHourlyFresh(Instant now) {
        return now.isBefore(hourlyExpiresAt);
    }

    public boolean isFullyFresh(Instant now) {
        return isUsable(now) && isHourlyFresh(now);
    }

    public boolean isFullyExpired(Instant now) {
        return !isUsable(now);
    }
}
