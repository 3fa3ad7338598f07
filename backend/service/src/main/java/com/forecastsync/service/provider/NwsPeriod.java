package com.forecastsync.service.provider;

import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.core.model.Wind;

import java.time.Instant;

record NwsPeriod(
        Instant start,
        boolean daytime,
        Double temperature,
        Double precipitationChance,
        Wind wind,
        WeatherIcon icon,
        String shortForecast,
        String detailedForecast,
        Double humidity,
        Double dewpoint,
        Double skyCover
) {
}
