package com.forecastsync.engine.cache;

import java.time.Duration;
import java.util.Objects;

public record CachePolicy(Duration dailyTtl, Duration hourlyTtl) {
    public static final CachePolicy DEFAULT = new CachePolicy(Duration.ofHours(3), Duration.ofHours(1));

    public CachePolicy {
        Objects.requireNonNull(dailyTtl, "dailyTtl is required");
        Objects.requireNonNull(hourlyTtl, "hourlyTtl is required");
        if (dailyTtl.isNegative() || dailyTtl.isZero() || hourlyTtl.isNegative() || hourlyTtl.isZero()) {
            throw new IllegalArgumentException("Cache TTLs must be positive");
        }
    }
}
