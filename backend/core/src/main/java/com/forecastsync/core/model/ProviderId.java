package com.forecastsync.core.model;

public enum ProviderId {
    NWS,
    OPEN_WEATHER
}
