package com.forecastsync.engine.api;

import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.TemperatureUnit;

public interface ForecastProvider {
    ProviderId id();

    Snapshot fetch(Coordinate coordinate, TemperatureUnit unit);
}
