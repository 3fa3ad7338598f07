package com.forecastsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public record Snapshot(
        String locationKey,
        List<ForecastPoint> daily,
        List<ForecastPoint> hourly,
        List<Alert> alerts,
        SnapshotMetadata metadata
) {
    public Snapshot {
        Objects.requireNonNull(metadata, "metadata is required");
        daily = daily == null ? List.of() : List.copyOf(daily);
        hourly = hourly == null ? List.of() : List.copyOf(hourly);
        alerts = uniqueById(alerts);
    }

    public Snapshot withLocationKey(String key) {
        return new Snapshot(key, daily, hourly, alerts, metadata);
    }

    public Snapshot withHourly(List<ForecastPoint> replacement) {
        return new Snapshot(locationKey, daily, replacement, alerts, metadata);
    }

    public Snapshot asStale(String reason) {
        return new Snapshot(locationKey, daily, hourly, alerts, metadata.asStale(reason));
    }

    public Snapshot inUnit(TemperatureUnit unit) {
        TemperatureUnit current = metadata.unit();
        if (unit == null || unit == current) {
            return this;
        }
        return new Snapshot(
                locationKey,
                daily.stream().map(point -> point.convert(current, unit)).toList(),
                hourly.stream().map(point -> point.convert(current, unit)).toList(),
                alerts,
                metadata.withUnit(unit)
        );
    }

    @JsonIgnore
    public boolean isStale() {
        return metadata.stale();
    }

    public Set<String> alertIds() {
        return alerts.stream().map(Alert::id).collect(Collectors.toUnmodifiableSet());
    }

    private static List<Alert> uniqueById(List<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return List.of();
        }
        Map<String, Alert> byId = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            byId.putIfAbsent(alert.id(), alert);
        }
        return List.copyOf(byId.values());
    }
}
