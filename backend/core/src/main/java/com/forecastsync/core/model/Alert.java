package com.forecastsync.core.model;

import com.forecastsync.core.error.InvalidInputException;

import java.time.Instant;

public record Alert(
        String id,
        String headline,
        String description,
        AlertSeverity severity,
        String event,
        Instant start,
        Instant end
) {
    public Alert {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Alert id is required");
        }
        severity = severity == null ? AlertSeverity.MODERATE : severity;
        headline = headline == null || headline.isBlank() ? event : headline;
    }
}
