package com.forecastsync.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.forecastsync.core.error.DecodeException;
import com.forecastsync.core.error.ForecastException;
import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.AlertSeverity;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.SnapshotMetadata;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.util.HashingUtils;
import com.forecastsync.engine.api.ForecastProvider;
import com.forecastsync.service.config.ProvidersConfig;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class NwsForecastProvider implements ForecastProvider {
    private static final Logger LOGGER = Logger.getLogger(NwsForecastProvider.class.getName());
    static final int HOURLY_LIMIT = 24;

    private final ProviderHttp http;
    private final String baseUrl;
    private final Clock clock;

    public NwsForecastProvider(HttpClient httpClient, ProvidersConfig.Nws config, Clock clock) {
        this.http = new ProviderHttp(httpClient, config.timeout(), "application/geo+json,application/json", config.userAgent());
        this.baseUrl = config.baseUrl();
        this.clock = clock;
    }

    @Override
    public ProviderId id() {
        return ProviderId.NWS;
    }

    @Override
    public Snapshot fetch(Coordinate coordinate, TemperatureUnit unit) {
        String point = coordinate.cacheKey();
        JsonNode properties = http.getJson(URI.create(baseUrl + "/points/" + point)).path("properties");
        String forecastUrl = requiredText(properties, "forecast", point);
        String hourlyUrl = requiredText(properties, "forecastHourly", point);

        JsonNode forecast = http.getJson(URI.create(forecastUrl));
        JsonNode hourlyForecast = http.getJson(URI.create(hourlyUrl));

        List<ForecastPoint> daily = NwsPeriodPairing.pair(periods(forecast));
        List<ForecastPoint> hourly = hourly(hourlyForecast);
        if (daily.isEmpty()) {
            throw new DecodeException("NWS forecast for " + point + " has no periods");
        }
        List<Alert> alerts = alerts(point);

        SnapshotMetadata metadata = SnapshotMetadata.fresh(
                ProviderId.NWS,
                clock.instant(),
                gridRef(properties),
                locationName(properties),
                textOrNull(properties.path("timeZone")),
                TemperatureUnit.FAHRENHEIT
        );
        return new Snapshot(point, daily, hourly, alerts, metadata).inUnit(unit);
    }

    private static List<NwsPeriod> periods(JsonNode forecast) {
        JsonNode periods = forecast.path("properties").path("periods");
        if (!periods.isArray()) {
            throw new DecodeException("NWS forecast response has no periods array");
        }
        List<NwsPeriod> parsed = new ArrayList<>();
        for (JsonNode period : periods) {
            parsed.add(NwsPeriods.parse(period));
        }
        return parsed;
    }

    private static List<ForecastPoint> hourly(JsonNode hourlyForecast) {
        List<ForecastPoint> points = new ArrayList<>();
        for (NwsPeriod period : periods(hourlyForecast)) {
            if (points.size() >= HOURLY_LIMIT) {
                break;
            }
            points.add(ForecastPoint.hourly(
                    period.start(),
                    period.temperature(),
                    period.precipitationChance(),
                    period.wind(),
                    period.icon(),
                    period.shortForecast(),
                    period.daytime()
            ).withDetails(period.humidity(), period.dewpoint(), null, period.skyCover(), null, null));
        }
        return points;
    }

    // best effort: a failed alerts call still yields a forecast
    private List<Alert> alerts(String point) {
        URI uri = URI.create(baseUrl + "/alerts/active?point=" + URLEncoder.encode(point, StandardCharsets.UTF_8));
        JsonNode body;
        try {
            body = http.getJson(uri);
        } catch (ForecastException e) {
            LOGGER.log(Level.WARNING, "NWS alerts unavailable for " + point + ": " + e.getMessage());
            return List.of();
        }
        List<Alert> alerts = new ArrayList<>();
        for (JsonNode feature : body.path("features")) {
            JsonNode props = feature.path("properties");
            String id = textOrNull(props.path("id"));
            if (id == null) {
                id = textOrNull(feature.path("id"));
            }
            String event = textOrNull(props.path("event"));
            if (id == null) {
                id = HashingUtils.sha256(props.path("senderName").asText("") + "|" + event + "|" + props.path("onset").asText(""));
            }
            alerts.add(new Alert(
                    id,
                    textOrNull(props.path("headline")),
                    textOrNull(props.path("description")),
                    AlertSeverity.parse(textOrNull(props.path("severity"))),
                    event,
                    NwsPeriods.parseTime(firstText(props, "onset", "effective")),
                    NwsPeriods.parseTime(firstText(props, "ends", "expires"))
            ));
        }
        return alerts;
    }

    private static String gridRef(JsonNode properties) {
        String gridId = textOrNull(properties.path("gridId"));
        if (gridId == null) {
            return null;
        }
        return gridId + "/" + properties.path("gridX").asInt() + "," + properties.path("gridY").asInt();
    }

    private static String locationName(JsonNode properties) {
        JsonNode relative = properties.path("relativeLocation").path("properties");
        String city = textOrNull(relative.path("city"));
        String state = textOrNull(relative.path("state"));
        if (city == null) {
            return state;
        }
        return state == null ? city : city + ", " + state;
    }

    private static String requiredText(JsonNode node, String field, String point) {
        String value = textOrNull(node.path(field));
        if (value == null) {
            throw new DecodeException("NWS points response for " + point + " is missing " + field);
        }
        return value;
    }

    private static String firstText(JsonNode node, String first, String second) {
        String value = textOrNull(node.path(first));
        return value == null ? textOrNull(node.path(second)) : value;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
