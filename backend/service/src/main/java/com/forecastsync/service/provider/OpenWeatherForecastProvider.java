package com.forecastsync.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.forecastsync.core.error.DecodeException;
import com.forecastsync.core.error.ProviderException;
import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.AlertSeverity;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.SnapshotMetadata;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.core.model.Wind;
import com.forecastsync.core.util.HashingUtils;
import com.forecastsync.engine.api.ForecastProvider;
import com.forecastsync.service.config.ProvidersConfig;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class OpenWeatherForecastProvider implements ForecastProvider {
    static final int DAILY_LIMIT = 7;
    static final int HOURLY_LIMIT = 24;

    private final ProviderHttp http;
    private final String baseUrl;
    private final String apiKey;
    private final Clock clock;

    public OpenWeatherForecastProvider(HttpClient httpClient, ProvidersConfig.OpenWeather config, Clock clock) {
        this.http = new ProviderHttp(httpClient, config.timeout(), "application/json", "forecast-sync");
        this.baseUrl = config.baseUrl();
        this.apiKey = config.apiKey();
        this.clock = clock;
    }

    @Override
    public ProviderId id() {
        return ProviderId.OPEN_WEATHER;
    }

    @Override
    public Snapshot fetch(Coordinate coordinate, TemperatureUnit unit) {
        if (apiKey.isBlank()) {
            throw new ProviderException("OpenWeather API key is not configured");
        }
        String query = String.format(Locale.ROOT, "lat=%.4f&lon=%.4f&units=%s&exclude=minutely",
                coordinate.latitude(), coordinate.longitude(), unit == TemperatureUnit.CELSIUS ? "metric" : "imperial");
        String path = baseUrl + "/onecall?" + query;
        URI uri = URI.create(path + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        JsonNode body = http.getJson(uri, path + "&appid=***");

        List<ForecastPoint> daily = daily(body.path("daily"));
        if (daily.isEmpty()) {
            throw new DecodeException("OpenWeather response for " + coordinate.cacheKey() + " has no daily data");
        }
        SnapshotMetadata metadata = SnapshotMetadata.fresh(
                ProviderId.OPEN_WEATHER,
                clock.instant(),
                "onecall:" + coordinate.cacheKey(),
                null,
                body.path("timezone").isTextual() ? body.path("timezone").asText() : null,
                unit
        );
        return new Snapshot(coordinate.cacheKey(), daily, hourly(body.path("hourly")), alerts(body.path("alerts")), metadata);
    }

    private static List<ForecastPoint> daily(JsonNode days) {
        List<ForecastPoint> points = new ArrayList<>();
        for (JsonNode day : days) {
            if (points.size() >= DAILY_LIMIT) {
                break;
            }
            JsonNode condition = day.path("weather").path(0);
            JsonNode clouds = day.path("clouds");
            String description = condition.path("description").asText("");
            points.add(ForecastPoint.daily(
                    epoch(day.path("dt")),
                    NwsPeriods.numberOrNull(day.path("temp").path("max")),
                    NwsPeriods.numberOrNull(day.path("temp").path("min")),
                    percent(day.path("pop")),
                    wind(day),
                    icon(condition.path("id").asInt(0), condition.path("icon").asText("")),
                    condition.path("main").asText(null)
            ).withDetails(
                    NwsPeriods.numberOrNull(day.path("humidity")),
                    NwsPeriods.numberOrNull(day.path("dew_point")),
                    NwsPeriods.numberOrNull(day.path("pressure")),
                    NwsPeriods.numberOrNull(clouds),
                    day.path("uvi").isNumber() ? (int) day.path("uvi").asDouble() : null,
                    description.isBlank() ? null : capitalize(description)
            ));
        }
        return points;
    }

    private static List<ForecastPoint> hourly(JsonNode hours) {
        List<ForecastPoint> points = new ArrayList<>();
        for (JsonNode hour : hours) {
            if (points.size() >= HOURLY_LIMIT) {
                break;
            }
            JsonNode condition = hour.path("weather").path(0);
            String iconCode = condition.path("icon").asText("");
            points.add(ForecastPoint.hourly(
                    epoch(hour.path("dt")),
                    NwsPeriods.numberOrNull(hour.path("temp")),
                    percent(hour.path("pop")),
                    wind(hour),
                    icon(condition.path("id").asInt(0), iconCode),
                    condition.path("main").asText(null),
                    !iconCode.contains("n")
            ).withDetails(
                    NwsPeriods.numberOrNull(hour.path("humidity")),
                    NwsPeriods.numberOrNull(hour.path("dew_point")),
                    NwsPeriods.numberOrNull(hour.path("pressure")),
                    NwsPeriods.numberOrNull(hour.path("clouds")),
                    hour.path("uvi").isNumber() ? (int) hour.path("uvi").asDouble() : null,
                    null
            ));
        }
        return points;
    }

    private static List<Alert> alerts(JsonNode alerts) {
        List<Alert> result = new ArrayList<>();
        for (JsonNode alert : alerts) {
            String event = alert.path("event").asText("Weather Alert");
            String start = alert.path("start").asText("");
            String id = "owm-" + HashingUtils.sha256(alert.path("sender_name").asText("") + "|" + event + "|" + start);
            result.add(new Alert(
                    id,
                    event,
                    alert.path("description").asText(null),
                    severity(alert.path("tags")),
                    event,
                    epoch(alert.path("start")),
                    epoch(alert.path("end"))
            ));
        }
        return result;
    }

    static AlertSeverity severity(JsonNode tags) {
        if (!tags.isArray() || tags.isEmpty()) {
            return AlertSeverity.MODERATE;
        }
        Set<String> values = new HashSet<>();
        tags.forEach(tag -> values.add(tag.asText()));
        if (values.contains("Extreme")) {
            return AlertSeverity.EXTREME;
        }
        if (values.contains("Severe")) {
            return AlertSeverity.SEVERE;
        }
        if (values.contains("Moderate")) {
            return AlertSeverity.MODERATE;
        }
        return AlertSeverity.MINOR;
    }

    static WeatherIcon icon(int conditionId, String iconCode) {
        boolean daytime = !iconCode.contains("n");
        if (conditionId >= 200 && conditionId < 300) {
            return WeatherIcon.THUNDERSTORM;
        }
        if (conditionId >= 300 && conditionId < 400) {
            return WeatherIcon.DRIZZLE;
        }
        if (conditionId >= 500 && conditionId < 600) {
            return WeatherIcon.RAIN;
        }
        if (conditionId >= 600 && conditionId < 700) {
            return WeatherIcon.SNOW;
        }
        if (conditionId >= 700 && conditionId < 800) {
            return WeatherIcon.FOG;
        }
        if (conditionId == 800) {
            return daytime ? WeatherIcon.CLEAR_DAY : WeatherIcon.CLEAR_NIGHT;
        }
        if (conditionId == 801 || conditionId == 802) {
            return daytime ? WeatherIcon.PARTLY_CLOUDY_DAY : WeatherIcon.PARTLY_CLOUDY_NIGHT;
        }
        return WeatherIcon.CLOUDY;
    }

    private static Wind wind(JsonNode node) {
        Double speed = NwsPeriods.numberOrNull(node.path("wind_speed"));
        if (node.path("wind_deg").isNumber()) {
            return Wind.fromDegrees(speed, node.path("wind_deg").asDouble());
        }
        return new Wind(speed, null);
    }

    private static Double percent(JsonNode fraction) {
        return fraction.isNumber() ? Math.round(fraction.asDouble() * 1000.0) / 10.0 : null;
    }

    private static Instant epoch(JsonNode seconds) {
        return seconds.isNumber() ? Instant.ofEpochSecond(seconds.asLong()) : null;
    }

    private static String capitalize(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        boolean upper = true;
        for (char c : text.toCharArray()) {
            builder.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return builder.toString();
    }
}
