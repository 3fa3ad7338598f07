package com.forecastsync.core.model;

public enum TemperatureUnit {
    CELSIUS,
    FAHRENHEIT;

    public Double convert(Double value, TemperatureUnit from) {
        if (value == null || from == this) {
            return value;
        }
        if (this == CELSIUS) {
            return (value - 32.0) * 5.0 / 9.0;
        }
        return value * 9.0 / 5.0 + 32.0;
    }
}
