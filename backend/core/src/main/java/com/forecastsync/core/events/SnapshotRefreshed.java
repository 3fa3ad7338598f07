package com.forecastsync.core.events;

import java.time.Instant;

public record SnapshotRefreshed(
        Instant timestamp,
        String locationId,
        String providerId,
        boolean stale,
        int newAlerts
) implements Event {
    @Override
    public String type() {
        return "SnapshotRefreshed";
    }
}
