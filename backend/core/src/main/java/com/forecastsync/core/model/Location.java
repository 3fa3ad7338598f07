package com.forecastsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.forecastsync.core.error.InvalidInputException;

// coordinates are fixed once the id exists; stores reject moves
public record Location(String id, String name, double latitude, double longitude, boolean favorite) {
    public Location {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Location id is required");
        }
        new Coordinate(latitude, longitude);
        name = name == null || name.isBlank() ? "Unknown Location" : name;
    }

    @JsonIgnore
    public Coordinate coordinate() {
        return new Coordinate(latitude, longitude);
    }

    public Location withFavorite(boolean value) {
        return new Location(id, name, latitude, longitude, value);
    }
}
