package com.forecastsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WeatherIcon {
    CLEAR_DAY("clear-day"),
    CLEAR_NIGHT("clear-night"),
    PARTLY_CLOUDY_DAY("partly-cloudy-day"),
    PARTLY_CLOUDY_NIGHT("partly-cloudy-night"),
    CLOUDY("cloudy"),
    DRIZZLE("drizzle"),
    RAIN("rain"),
    THUNDERSTORM("thunderstorm"),
    SNOW("snow"),
    SLEET("sleet"),
    FOG("fog"),
    WIND("wind");

    private final String code;

    WeatherIcon(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static WeatherIcon fromCode(String code) {
        if (code == null) {
            return CLOUDY;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (WeatherIcon icon : values()) {
            if (icon.code.equals(normalized) || icon.name().equalsIgnoreCase(normalized)) {
                return icon;
            }
        }
        return CLOUDY;
    }
}
