package com.forecastsync.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.core.model.Wind;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class NwsPeriods {
    private static final List<Pattern> PRECIPITATION_PATTERNS = List.of(
            Pattern.compile("chance of precipitation is (\\d+)%", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)% chance of precipitation", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)% chance of rain", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)% chance of snow", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");
    private static final Pattern UV_INDEX = Pattern.compile("UV index[^0-9]{0,20}(\\d+)", Pattern.CASE_INSENSITIVE);

    private NwsPeriods() {
    }

    static NwsPeriod parse(JsonNode period) {
        boolean daytime = period.path("isDaytime").asBoolean(true);
        String shortForecast = period.path("shortForecast").asText("");
        String detailed = period.path("detailedForecast").asText("");
        return new NwsPeriod(
                parseTime(period.path("startTime").asText("")),
                daytime,
                temperatureF(period),
                precipitationChance(period.path("probabilityOfPrecipitation"), detailed, shortForecast),
                new Wind(windSpeed(period.path("windSpeed").asText("")), blankToNull(period.path("windDirection").asText(""))),
                icon(period.path("icon").asText(""), daytime),
                shortForecast,
                blankToNull(detailed),
                numberOrNull(period.path("relativeHumidity").path("value")),
                TemperatureUnit.FAHRENHEIT.convert(numberOrNull(period.path("dewpoint").path("value")), TemperatureUnit.CELSIUS),
                estimateSkyCover(shortForecast)
        );
    }

    static Double temperatureF(JsonNode period) {
        Double value = numberOrNull(period.path("temperature"));
        if ("C".equalsIgnoreCase(period.path("temperatureUnit").asText("F"))) {
            return TemperatureUnit.FAHRENHEIT.convert(value, TemperatureUnit.CELSIUS);
        }
        return value;
    }

    static Double precipitationChance(JsonNode structured, String detailedForecast, String shortForecast) {
        Double value = numberOrNull(structured.path("value"));
        if (value != null && value > 0) {
            return value;
        }
        Integer extracted = extractPrecipitationChance(detailedForecast);
        if (extracted != null) {
            return extracted.doubleValue();
        }
        return (double) estimatePrecipitationChance(shortForecast);
    }

    static Integer extractPrecipitationChance(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Pattern pattern : PRECIPITATION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return null;
    }

    static int estimatePrecipitationChance(String shortForecast) {
        if (shortForecast == null) {
            return 0;
        }
        if (!(shortForecast.contains("Rain") || shortForecast.contains("Showers") || shortForecast.contains("Thunderstorms"))) {
            return 0;
        }
        if (shortForecast.contains("Slight Chance")) {
            return 20;
        }
        if (shortForecast.contains("Chance")) {
            return 40;
        }
        if (shortForecast.contains("Likely")) {
            return 70;
        }
        if (shortForecast.contains("Definite") || shortForecast.contains("Heavy")) {
            return 90;
        }
        return 50;
    }

    static double estimateSkyCover(String shortForecast) {
        if (shortForecast == null) {
            return 50;
        }
        // "Mostly" and "Partly" variants are tested before the bare words they contain.
        if (shortForecast.contains("Mostly Clear") || shortForecast.contains("Mostly Sunny")) {
            return 25;
        }
        if (shortForecast.contains("Partly Cloudy") || shortForecast.contains("Partly Sunny")) {
            return 50;
        }
        if (shortForecast.contains("Mostly Cloudy")) {
            return 75;
        }
        if (shortForecast.contains("Clear") || shortForecast.contains("Sunny")) {
            return 0;
        }
        if (shortForecast.contains("Cloudy")) {
            return 100;
        }
        return 50;
    }

    static WeatherIcon icon(String iconUrl, boolean daytime) {
        String url = iconUrl == null ? "" : iconUrl.toLowerCase(Locale.ROOT);
        boolean night = url.contains("/night/") || !daytime;
        if (url.contains("sunny") || url.contains("clear") || url.contains("skc") || url.contains("few")) {
            return night ? WeatherIcon.CLEAR_NIGHT : WeatherIcon.CLEAR_DAY;
        }
        if (url.contains("cloudy") || url.contains("sct") || url.contains("bkn") || url.contains("ovc")) {
            if (url.contains("partly") || url.contains("sct")) {
                return night ? WeatherIcon.PARTLY_CLOUDY_NIGHT : WeatherIcon.PARTLY_CLOUDY_DAY;
            }
            return WeatherIcon.CLOUDY;
        }
        if (url.contains("tsra")) {
            return WeatherIcon.THUNDERSTORM;
        }
        if (url.contains("rain") || url.contains("shower")) {
            return WeatherIcon.RAIN;
        }
        if (url.contains("snow")) {
            return WeatherIcon.SNOW;
        }
        if (url.contains("sleet") || url.contains("ice") || url.contains("fzra")) {
            return WeatherIcon.SLEET;
        }
        if (url.contains("fog")) {
            return WeatherIcon.FOG;
        }
        if (url.contains("wind")) {
            return WeatherIcon.WIND;
        }
        return WeatherIcon.CLOUDY;
    }

    static Integer uvIndex(String detailedForecast) {
        if (detailedForecast == null) {
            return null;
        }
        Matcher matcher = UV_INDEX.matcher(detailedForecast);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    static Double windSpeed(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(text);
        Double max = null;
        while (matcher.find()) {
            double value = Double.parseDouble(matcher.group(1));
            max = max == null ? value : Math.max(max, value);
        }
        return max;
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Double numberOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
