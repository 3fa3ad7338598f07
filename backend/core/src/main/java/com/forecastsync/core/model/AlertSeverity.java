package com.forecastsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

// ascending; compareTo is the filtering order
public enum AlertSeverity {
    MINOR,
    MODERATE,
    SEVERE,
    EXTREME;

    @JsonCreator
    public static AlertSeverity parse(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MODERATE;
        }
    }

    public boolean isAtLeast(AlertSeverity threshold) {
        return compareTo(threshold) >= 0;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
