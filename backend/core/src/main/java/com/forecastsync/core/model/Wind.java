package com.forecastsync.core.model;

public record Wind(Double speed, String direction) {
    private static final String[] COMPASS = {
            "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
            "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"
    };

    public static Wind fromDegrees(Double speed, double degrees) {
        return new Wind(speed, compass(degrees));
    }

    public static String compass(double degrees) {
        double normalized = ((degrees % 360.0) + 360.0) % 360.0;
        int index = (int) ((normalized + 11.25) / 22.5) % 16;
        return COMPASS[index];
    }
}
