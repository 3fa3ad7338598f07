package com.forecastsync.core.model;

import java.time.Instant;

/**
 * @param providerRef provider-specific reference for the forecast, e.g. an NWS grid id or request URL
 * @param stale       true only on stale-fallback results, never on stored entries
 * @param staleReason message of the failure that forced the fallback
 */
public record SnapshotMetadata(
        ProviderId providerId,
        Instant updatedAt,
        String providerRef,
        String locationName,
        String timezone,
        TemperatureUnit unit,
        boolean stale,
        String staleReason
) {
    public SnapshotMetadata {
        unit = unit == null ? TemperatureUnit.FAHRENHEIT : unit;
    }

    public static SnapshotMetadata fresh(
            ProviderId providerId,
            Instant updatedAt,
            String providerRef,
            String locationName,
            String timezone,
            TemperatureUnit unit
    ) {
        return new SnapshotMetadata(providerId, updatedAt, providerRef, locationName, timezone, unit, false, null);
    }

    public SnapshotMetadata asStale(String reason) {
        return new SnapshotMetadata(providerId, updatedAt, providerRef, locationName, timezone, unit, true, reason);
    }

    public SnapshotMetadata withUnit(TemperatureUnit value) {
        return new SnapshotMetadata(providerId, updatedAt, providerRef, locationName, timezone, value, stale, staleReason);
    }
}
