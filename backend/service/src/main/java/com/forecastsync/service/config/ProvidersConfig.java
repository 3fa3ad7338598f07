package com.forecastsync.service.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record ProvidersConfig(String mode, Nws nws, OpenWeather openWeather, String fixtureFile) {
    public static final String MODE_LIVE = "live";
    public static final String MODE_FIXTURE = "fixture";

    public ProvidersConfig {
        mode = mode == null || mode.isBlank() ? MODE_LIVE : mode.trim().toLowerCase(Locale.ROOT);
        nws = nws == null ? new Nws(null, null, null) : nws;
        openWeather = openWeather == null ? new OpenWeather(null, null, null) : openWeather;
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(null, null, null, null);
    }

    public boolean fixtureMode() {
        return MODE_FIXTURE.equals(mode);
    }

    public ProvidersConfig withEnvironment(Map<String, String> environment) {
        String userAgent = firstNonBlank(environment.get("NWS_USER_AGENT"), nws.userAgent());
        String apiKey = firstNonBlank(environment.get("OPENWEATHER_API_KEY"), openWeather.apiKey());
        return new ProvidersConfig(
                firstNonBlank(environment.get("FORECAST_PROVIDER_MODE"), mode),
                new Nws(nws.baseUrl(), userAgent, nws.timeout()),
                new OpenWeather(openWeather.baseUrl(), apiKey, openWeather.timeout()),
                fixtureFile
        );
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? fallback : preferred;
    }

    public record Nws(String baseUrl, String userAgent, Duration timeout) {
        public static final String DEFAULT_BASE_URL = "https://api.weather.gov";
        public static final String DEFAULT_USER_AGENT = "forecast-sync/0.1 (contact: support@example.com)";

        public Nws {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl);
            userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }

    public record OpenWeather(String baseUrl, String apiKey, Duration timeout) {
        public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/3.0";

        public OpenWeather {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl);
            apiKey = apiKey == null ? "" : apiKey.trim();
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
