package com.forecastsync.engine.refresh;

import com.forecastsync.core.model.TemperatureUnit;

import java.time.Duration;
import java.util.Objects;

public record RefreshSettings(int maxConcurrency, Duration perLocationTimeout, TemperatureUnit unit) {
    public static final RefreshSettings DEFAULT =
            new RefreshSettings(4, Duration.ofSeconds(20), TemperatureUnit.FAHRENHEIT);

    public RefreshSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Objects.requireNonNull(perLocationTimeout, "perLocationTimeout is required");
        if (perLocationTimeout.isNegative() || perLocationTimeout.isZero()) {
            throw new IllegalArgumentException("perLocationTimeout must be positive");
        }
        unit = unit == null ? TemperatureUnit.FAHRENHEIT : unit;
    }
}
