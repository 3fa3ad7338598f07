package com.forecastsync.service;

import com.forecastsync.core.bus.EventBus;
import com.forecastsync.core.model.Location;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.engine.alert.AlertProcessor;
import com.forecastsync.engine.api.ForecastProvider;
import com.forecastsync.engine.cache.CacheStore;
import com.forecastsync.engine.config.EngineConfig;
import com.forecastsync.engine.fetch.FetchOrchestrator;
import com.forecastsync.engine.provider.FixtureForecastProvider;
import com.forecastsync.engine.refresh.BackgroundRefreshScheduler;
import com.forecastsync.engine.routing.ProviderSelector;
import com.forecastsync.service.config.ConfigLoader;
import com.forecastsync.service.config.ProvidersConfig;
import com.forecastsync.service.http.HttpClientFactory;
import com.forecastsync.service.http.TrustStoreSettings;
import com.forecastsync.service.notify.EventBusNotifier;
import com.forecastsync.service.provider.NwsForecastProvider;
import com.forecastsync.service.provider.OpenWeatherForecastProvider;
import com.forecastsync.service.runtime.RefreshTimer;
import com.forecastsync.service.store.JsonFileCacheBackend;
import com.forecastsync.service.store.JsonFileLocationStore;
import com.forecastsync.service.store.JsonFileSeenAlertStore;
import com.forecastsync.service.store.JsonlEventStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class ForecastSyncService {
    private static final Logger LOGGER = Logger.getLogger(ForecastSyncService.class.getName());
    static final int EVENT_LOG_KEEP_LINES = 10_000;

    private final EventBus eventBus;
    private final JsonFileLocationStore locationStore;
    private final CacheStore cacheStore;
    private final FetchOrchestrator orchestrator;
    private final AlertProcessor alertProcessor;
    private final JsonlEventStore eventStore;
    private final RefreshTimer refreshTimer;
    private final EngineConfig engineConfig;

    private ForecastSyncService(
            EventBus eventBus,
            JsonFileLocationStore locationStore,
            CacheStore cacheStore,
            FetchOrchestrator orchestrator,
            AlertProcessor alertProcessor,
            JsonlEventStore eventStore,
            RefreshTimer refreshTimer,
            EngineConfig engineConfig
    ) {
        this.eventBus = eventBus;
        this.locationStore = locationStore;
        this.cacheStore = cacheStore;
        this.orchestrator = orchestrator;
        this.alertProcessor = alertProcessor;
        this.eventStore = eventStore;
        this.refreshTimer = refreshTimer;
        this.engineConfig = engineConfig;
    }

    public static ForecastSyncService create(Path configDir, Path dataDir, Map<String, String> environment, Clock clock) {
        EngineConfig engineConfig = ConfigLoader.loadEngine(configDir);
        ProvidersConfig providersConfig = ConfigLoader.loadProviders(configDir).withEnvironment(environment);

        EventBus eventBus = new EventBus((event, error) ->
                LOGGER.warning("Event handler failed for " + event.type() + ": " + error.getMessage()));
        JsonlEventStore eventStore = new JsonlEventStore(dataDir.resolve("events.jsonl"));
        int dropped = eventStore.compact(EVENT_LOG_KEEP_LINES);
        if (dropped > 0) {
            LOGGER.info("Compacted event log; dropped " + dropped + " old lines");
        }
        eventBus.subscribeAll(eventStore::append);

        JsonFileLocationStore locationStore = new JsonFileLocationStore(dataDir.resolve("locations.json"));
        if (locationStore.listAll().isEmpty()) {
            List<Location> seeds = ConfigLoader.loadSeedLocations(configDir);
            seeds.forEach(locationStore::upsert);
            if (!seeds.isEmpty()) {
                LOGGER.info("Seeded " + seeds.size() + " locations from " + configDir);
            }
        }

        CacheStore cacheStore = new CacheStore(new JsonFileCacheBackend(dataDir.resolve("forecast-cache.json")), clock);
        FetchOrchestrator orchestrator = new FetchOrchestrator(
                cacheStore,
                new ProviderSelector(),
                providers(providersConfig, configDir, clock, environment),
                engineConfig.cachePolicy(),
                clock
        );
        AlertProcessor alertProcessor = new AlertProcessor(
                new JsonFileSeenAlertStore(dataDir.resolve("seen-alerts.json")),
                new EventBusNotifier(eventBus, clock),
                engineConfig.notifyMinSeverity()
        );
        BackgroundRefreshScheduler scheduler = new BackgroundRefreshScheduler(
                locationStore,
                orchestrator,
                alertProcessor,
                eventBus,
                clock,
                engineConfig.refreshSettings()
        );
        RefreshTimer refreshTimer = new RefreshTimer(scheduler, engineConfig.refreshInterval(), engineConfig.refreshBudget());
        return new ForecastSyncService(eventBus, locationStore, cacheStore, orchestrator, alertProcessor,
                eventStore, refreshTimer, engineConfig);
    }

    static Map<ProviderId, ForecastProvider> providers(
            ProvidersConfig config,
            Path configDir,
            Clock clock,
            Map<String, String> environment
    ) {
        Map<ProviderId, ForecastProvider> providers = new EnumMap<>(ProviderId.class);
        if (config.fixtureMode()) {
            String fixtureFile = config.fixtureFile() == null ? "fixtures/forecasts.json" : config.fixtureFile();
            Path fixture = configDir.resolve(fixtureFile);
            LOGGER.info("Provider mode fixture; serving forecasts from " + fixture);
            providers.put(ProviderId.NWS, new FixtureForecastProvider(ProviderId.NWS, fixture, clock));
            providers.put(ProviderId.OPEN_WEATHER, new FixtureForecastProvider(ProviderId.OPEN_WEATHER, fixture, clock));
            return providers;
        }
        Optional<TrustStoreSettings> trustStore = TrustStoreSettings.fromEnvironment(environment);
        providers.put(ProviderId.NWS, new NwsForecastProvider(
                HttpClientFactory.forProvider(config.nws().timeout(), trustStore), config.nws(), clock));
        providers.put(ProviderId.OPEN_WEATHER, new OpenWeatherForecastProvider(
                HttpClientFactory.forProvider(config.openWeather().timeout(), trustStore), config.openWeather(), clock));
        if (config.openWeather().apiKey().isBlank()) {
            LOGGER.warning("OPENWEATHER_API_KEY is not set; locations outside NWS coverage will fail to refresh");
        }
        return providers;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public JsonFileLocationStore locationStore() {
        return locationStore;
    }

    public CacheStore cacheStore() {
        return cacheStore;
    }

    public FetchOrchestrator orchestrator() {
        return orchestrator;
    }

    public AlertProcessor alertProcessor() {
        return alertProcessor;
    }

    public JsonlEventStore eventStore() {
        return eventStore;
    }

    public RefreshTimer refreshTimer() {
        return refreshTimer;
    }

    public EngineConfig engineConfig() {
        return engineConfig;
    }
}
