package com.forecastsync.engine.config;

import com.forecastsync.core.model.AlertSeverity;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.engine.cache.CachePolicy;
import com.forecastsync.engine.refresh.RefreshSettings;

import java.time.Duration;

public record EngineConfig(
        Duration dailyTtl,
        Duration hourlyTtl,
        TemperatureUnit unit,
        Duration refreshInterval,
        int refreshConcurrency,
        Duration perLocationTimeout,
        Duration refreshBudget,
        AlertSeverity notifyMinSeverity
) {
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_REFRESH_BUDGET = Duration.ofMinutes(2);

    public EngineConfig {
        dailyTtl = dailyTtl == null ? CachePolicy.DEFAULT.dailyTtl() : dailyTtl;
        hourlyTtl = hourlyTtl == null ? CachePolicy.DEFAULT.hourlyTtl() : hourlyTtl;
        unit = unit == null ? TemperatureUnit.FAHRENHEIT : unit;
        refreshInterval = refreshInterval == null ? DEFAULT_REFRESH_INTERVAL : refreshInterval;
        refreshConcurrency = refreshConcurrency <= 0 ? RefreshSettings.DEFAULT.maxConcurrency() : refreshConcurrency;
        perLocationTimeout = perLocationTimeout == null
                ? RefreshSettings.DEFAULT.perLocationTimeout()
                : perLocationTimeout;
        refreshBudget = refreshBudget == null ? DEFAULT_REFRESH_BUDGET : refreshBudget;
        notifyMinSeverity = notifyMinSeverity == null ? AlertSeverity.MINOR : notifyMinSeverity;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, 0, null, null, null);
    }

    public CachePolicy cachePolicy() {
        return new CachePolicy(dailyTtl, hourlyTtl);
    }

    public RefreshSettings refreshSettings() {
        return new RefreshSettings(refreshConcurrency, perLocationTimeout, unit);
    }
}
