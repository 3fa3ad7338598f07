package com.forecastsync.core.events;

import java.time.Instant;

public record RefreshCompleted(
        Instant timestamp,
        int succeeded,
        int failed,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RefreshCompleted";
    }
}
