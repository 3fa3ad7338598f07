package com.forecastsync.engine.routing;

import com.forecastsync.core.model.Coordinate;

public record BoundingBox(String name, double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {
    public BoundingBox {
        if (minLatitude > maxLatitude || minLongitude > maxLongitude) {
            throw new IllegalArgumentException("Invalid bounding box " + name);
        }
    }

    public boolean contains(Coordinate coordinate) {
        double lat = coordinate.latitude();
        double lon = coordinate.longitude();
        return lat >= minLatitude && lat <= maxLatitude && lon >= minLongitude && lon <= maxLongitude;
    }
}
