package com.forecastsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.forecastsync.core.error.InvalidInputException;

import java.util.Locale;

public record Coordinate(double latitude, double longitude) {
    public Coordinate {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidInputException("Latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidInputException("Longitude out of range: " + longitude);
        }
    }

    public static Coordinate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Coordinate is required");
        }
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new InvalidInputException("Coordinate must be 'lat,lon': " + value);
        }
        try {
            return new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Coordinate must be numeric: " + value, e);
        }
    }

    @JsonIgnore
    public String cacheKey() {
        return String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude);
    }
}
