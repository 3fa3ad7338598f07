package com.forecastsync.engine.provider;

import com.forecastsync.core.error.ProviderException;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.SnapshotMetadata;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.util.JsonUtils;
import com.forecastsync.engine.api.ForecastProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class FixtureForecastProvider implements ForecastProvider {
    private final ProviderId id;
    private final Clock clock;
    private final Map<String, Snapshot> forecasts = new ConcurrentHashMap<>();

    public FixtureForecastProvider(ProviderId id, Path jsonFile, Clock clock) {
        this.id = id;
        this.clock = clock;
        try (InputStream in = Files.newInputStream(jsonFile)) {
            ForecastFixture fixture = JsonUtils.objectMapper().readValue(in, ForecastFixture.class);
            if (fixture.forecasts() != null) {
                forecasts.putAll(fixture.forecasts());
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading forecast fixture: " + jsonFile, e);
        }
    }

    @Override
    public ProviderId id() {
        return id;
    }

    @Override
    public Snapshot fetch(Coordinate coordinate, TemperatureUnit unit) {
        String key = coordinate.cacheKey();
        Snapshot canned = forecasts.get(key);
        if (canned == null) {
            throw new ProviderException("No fixture forecast configured for " + key);
        }
        SnapshotMetadata source = canned.metadata();
        SnapshotMetadata metadata = SnapshotMetadata.fresh(
                id,
                clock.instant(),
                source.providerRef() == null ? "fixture:" + key : source.providerRef(),
                source.locationName(),
                source.timezone(),
                source.unit()
        );
        return new Snapshot(key, canned.daily(), canned.hourly(), canned.alerts(), metadata).inUnit(unit);
    }

    public int size() {
        return forecasts.size();
    }

    private record ForecastFixture(Map<String, Snapshot> forecasts) {
    }
}
