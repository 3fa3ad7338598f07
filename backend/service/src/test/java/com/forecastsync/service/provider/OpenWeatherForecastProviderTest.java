package com.forecastsync.service.provider;

import com.forecastsync.core.error.ProviderException;
import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.AlertSeverity;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.service.config.ProvidersConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenWeatherForecastProviderTest {
    private static final Coordinate LONDON = new Coordinate(51.5074, -0.1278);
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private HttpServer server;
    private String baseUrl;
    private final List<String> queries = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void mapsOneCallResponse() {
        server.createContext("/onecall", exchange -> {
            queries.add(exchange.getRequestURI().getRawQuery());
            writeResponse(exchange, 200, oneCallBody(10, 30));
        });

        Snapshot snapshot = provider("secret-key").fetch(LONDON, TemperatureUnit.CELSIUS);

        String query = queries.get(0);
        assertTrue(query.contains("units=metric"));
        assertTrue(query.contains("exclude=minutely"));
        assertTrue(query.contains("appid=secret-key"));

        assertEquals(ProviderId.OPEN_WEATHER, snapshot.metadata().providerId());
        assertEquals(TemperatureUnit.CELSIUS, snapshot.metadata().unit());
        assertEquals("Europe/London", snapshot.metadata().timezone());
        assertEquals(NOW, snapshot.metadata().updatedAt());
        assertEquals("51.5074,-0.1278", snapshot.locationKey());

        assertEquals(7, snapshot.daily().size());
        ForecastPoint day = snapshot.daily().get(0);
        assertEquals(12.5, day.high());
        assertEquals(4.0, day.low());
        assertEquals(35.0, day.precipitationChance());
        assertEquals("SW", day.wind().direction());
        assertEquals(WeatherIcon.RAIN, day.icon());
        assertEquals("Light Rain", day.detailedForecast());
        assertEquals(3, day.uvIndex());
        assertEquals(1012.0, day.pressure());

        assertEquals(24, snapshot.hourly().size());
        ForecastPoint hour = snapshot.hourly().get(0);
        assertEquals(WeatherIcon.CLEAR_NIGHT, hour.icon());
        assertFalse(hour.daytime());

        Alert alert = snapshot.alerts().get(0);
        assertEquals("Wind warning", alert.headline());
        assertEquals(AlertSeverity.SEVERE, alert.severity());
        assertTrue(alert.id().startsWith("owm-"));
    }

    @Test
    void alertIdsAreStableAcrossFetches() {
        server.createContext("/onecall", exchange -> writeResponse(exchange, 200, oneCallBody(1, 1)));
        OpenWeatherForecastProvider provider = provider("k");

        String first = provider.fetch(LONDON, TemperatureUnit.FAHRENHEIT).alerts().get(0).id();
        String second = provider.fetch(LONDON, TemperatureUnit.FAHRENHEIT).alerts().get(0).id();

        assertEquals(first, second);
    }

    @Test
    void requestsImperialUnitsForFahrenheit() {
        server.createContext("/onecall", exchange -> {
            queries.add(exchange.getRequestURI().getRawQuery());
            writeResponse(exchange, 200, oneCallBody(1, 1));
        });

        Snapshot snapshot = provider("k").fetch(LONDON, TemperatureUnit.FAHRENHEIT);

        assertTrue(queries.get(0).contains("units=imperial"));
        assertEquals(TemperatureUnit.FAHRENHEIT, snapshot.metadata().unit());
    }

    @Test
    void missingApiKeyFailsWithoutCallingProvider() {
        server.createContext("/onecall", exchange -> {
            queries.add(exchange.getRequestURI().getRawQuery());
            writeResponse(exchange, 200, oneCallBody(1, 1));
        });

        assertThrows(ProviderException.class, () -> provider("").fetch(LONDON, TemperatureUnit.CELSIUS));
        assertTrue(queries.isEmpty());
    }

    @Test
    void errorMessagesDoNotLeakApiKey() {
        server.createContext("/onecall", exchange -> writeResponse(exchange, 401, "{\"cod\":401}"));

        ProviderException error = assertThrows(ProviderException.class,
                () -> provider("super-secret").fetch(LONDON, TemperatureUnit.CELSIUS));

        assertEquals(401, error.statusCode());
        assertFalse(error.getMessage().contains("super-secret"));
    }

    @Test
    void severityFromTags() {
        assertEquals(AlertSeverity.MODERATE, OpenWeatherForecastProvider.severity(JsonUtils.objectMapper().createArrayNode()));
        assertEquals(AlertSeverity.EXTREME, OpenWeatherForecastProvider.severity(
                JsonUtils.objectMapper().createArrayNode().add("Flood").add("Extreme")));
        assertEquals(AlertSeverity.MINOR, OpenWeatherForecastProvider.severity(
                JsonUtils.objectMapper().createArrayNode().add("Fog")));
    }

    @Test
    void conditionIdsMapToIcons() {
        assertEquals(WeatherIcon.THUNDERSTORM, OpenWeatherForecastProvider.icon(211, "11d"));
        assertEquals(WeatherIcon.DRIZZLE, OpenWeatherForecastProvider.icon(301, "09d"));
        assertEquals(WeatherIcon.SNOW, OpenWeatherForecastProvider.icon(600, "13d"));
        assertEquals(WeatherIcon.FOG, OpenWeatherForecastProvider.icon(741, "50d"));
        assertEquals(WeatherIcon.CLEAR_DAY, OpenWeatherForecastProvider.icon(800, "01d"));
        assertEquals(WeatherIcon.PARTLY_CLOUDY_NIGHT, OpenWeatherForecastProvider.icon(802, "03n"));
        assertEquals(WeatherIcon.CLOUDY, OpenWeatherForecastProvider.icon(804, "04d"));
        assertNotEquals(WeatherIcon.CLEAR_NIGHT, OpenWeatherForecastProvider.icon(800, "01d"));
    }

    private OpenWeatherForecastProvider provider(String apiKey) {
        ProvidersConfig.OpenWeather config = new ProvidersConfig.OpenWeather(baseUrl, apiKey, Duration.ofSeconds(2));
        return new OpenWeatherForecastProvider(HttpClient.newHttpClient(), config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String oneCallBody(int days, int hours) {
        StringBuilder daily = new StringBuilder();
        for (int i = 0; i < days; i++) {
            if (i > 0) {
                daily.append(',');
            }
            daily.append("""
                    {"dt":%d,"temp":{"min":4.0,"max":12.5},"pop":0.35,"wind_speed":5.5,"wind_deg":225,
                     "humidity":70,"dew_point":3.1,"pressure":1012,"clouds":80,"uvi":3.4,
                     "weather":[{"id":500,"main":"Rain","description":"light rain","icon":"10d"}]}
                    """.formatted(1772452800L + 86400L * i));
        }
        StringBuilder hourly = new StringBuilder();
        for (int i = 0; i < hours; i++) {
            if (i > 0) {
                hourly.append(',');
            }
            hourly.append("""
                    {"dt":%d,"temp":6.0,"pop":0.0,"wind_speed":3.0,"wind_deg":10,
                     "weather":[{"id":800,"main":"Clear","description":"clear sky","icon":"01n"}]}
                    """.formatted(1772452800L + 3600L * i));
        }
        return """
                {"timezone":"Europe/London","daily":[%s],"hourly":[%s],
                 "alerts":[{"sender_name":"Met Office","event":"Wind warning","start":1772452800,"end":1772496000,
                            "description":"Strong winds","tags":["Wind","Severe"]}]}
                """.formatted(daily, hourly);
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
