package com.forecastsync.core.events;

import java.time.Instant;

public record RefreshStarted(Instant timestamp, int locationCount) implements Event {
    @Override
    public String type() {
        return "RefreshStarted";
    }
}
