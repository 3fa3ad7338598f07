package com.forecastsync.core.model;

import java.time.Instant;

public record ForecastPoint(
        Instant time,
        Double temperature,
        Double high,
        Double low,
        Double precipitationChance,
        Wind wind,
        Double humidity,
        Double dewpoint,
        Double pressure,
        Double skyCover,
        Integer uvIndex,
        WeatherIcon icon,
        String shortForecast,
        String detailedForecast,
        Boolean daytime
) {
    public ForecastPoint {
        icon = icon == null ? WeatherIcon.CLOUDY : icon;
    }

    public static ForecastPoint daily(
            Instant time,
            Double high,
            Double low,
            Double precipitationChance,
            Wind wind,
            WeatherIcon icon,
            String shortForecast
    ) {
        return new ForecastPoint(time, null, high, low, precipitationChance, wind,
                null, null, null, null, null, icon, shortForecast, null, Boolean.TRUE);
    }

    public static ForecastPoint hourly(
            Instant time,
            Double temperature,
            Double precipitationChance,
            Wind wind,
            WeatherIcon icon,
            String shortForecast,
            Boolean daytime
    ) {
        return new ForecastPoint(time, temperature, null, null, precipitationChance, wind,
                null, null, null, null, null, icon, shortForecast, null, daytime);
    }

    public ForecastPoint withDetails(
            Double humidity,
            Double dewpoint,
            Double pressure,
            Double skyCover,
            Integer uvIndex,
            String detailedForecast
    ) {
        return new ForecastPoint(time, temperature, high, low, precipitationChance, wind,
                humidity, dewpoint, pressure, skyCover, uvIndex, icon, shortForecast, detailedForecast, daytime);
    }

    public ForecastPoint convert(TemperatureUnit from, TemperatureUnit to) {
        if (from == to) {
            return this;
        }
        return new ForecastPoint(time, to.convert(temperature, from), to.convert(high, from), to.convert(low, from),
                precipitationChance, wind, humidity, to.convert(dewpoint, from), pressure, skyCover, uvIndex,
                icon, shortForecast, detailedForecast, daytime);
    }
}
