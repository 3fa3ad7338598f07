package com.forecastsync.engine.fetch;

import com.forecastsync.core.error.DecodeException;
import com.forecastsync.core.error.ForecastException;
import com.forecastsync.core.error.InvalidInputException;
import com.forecastsync.core.error.NotFoundException;
import com.forecastsync.core.error.ProviderException;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.engine.api.ForecastProvider;
import com.forecastsync.engine.cache.CacheEntry;
import com.forecastsync.engine.cache.CachePolicy;
import com.forecastsync.engine.cache.CacheStore;
import com.forecastsync.engine.routing.ProviderSelector;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves a location to a snapshot: from cache when fresh, from cache plus a background hourly patch
 * when only the hourly portion expired, otherwise from a full provider fetch that concurrent callers
 * for the same key share.
 *
 * <p>Failed full fetches fall back to whatever the cache still holds, flagged stale. Only when nothing
 * is cached does the caller see {@link NotFoundException}.
 */
public class FetchOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(FetchOrchestrator.class.getName());

    private final CacheStore cacheStore;
    private final ProviderSelector selector;
    private final Map<ProviderId, ForecastProvider> providers;
    private final CachePolicy policy;
    private final Clock clock;
    private final Executor executor;
    private final ConcurrentHashMap<String, CompletableFuture<Snapshot>> inFlight = new ConcurrentHashMap<>();
    private final Set<String> patchesInFlight = ConcurrentHashMap.newKeySet();

    public FetchOrchestrator(
            CacheStore cacheStore,
            ProviderSelector selector,
            Map<ProviderId, ForecastProvider> providers,
            CachePolicy policy,
            Clock clock
    ) {
        this(cacheStore, selector, providers, policy, clock, ForkJoinPool.commonPool());
    }

    public FetchOrchestrator(
            CacheStore cacheStore,
            ProviderSelector selector,
            Map<ProviderId, ForecastProvider> providers,
            CachePolicy policy,
            Clock clock,
            Executor executor
    ) {
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore is required");
        this.selector = Objects.requireNonNull(selector, "selector is required");
        this.providers = providers.isEmpty() ? Map.of() : new EnumMap<>(providers);
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    public CompletableFuture<Snapshot> resolve(String locationKey, Coordinate coordinate, TemperatureUnit unit) {
        if (locationKey == null || locationKey.isBlank()) {
            return CompletableFuture.failedFuture(new InvalidInputException("Location key is required"));
        }
        if (coordinate == null) {
            return CompletableFuture.failedFuture(new InvalidInputException("Coordinate is required"));
        }
        String key = locationKey.trim();
        TemperatureUnit requested = unit == null ? TemperatureUnit.FAHRENHEIT : unit;

        Optional<CacheEntry> cached = cacheStore.get(key);
        Instant now = clock.instant();
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            if (entry.isFullyFresh(now)) {
                LOGGER.fine(() -> "Cache hit for " + key);
                return CompletableFuture.completedFuture(entry.snapshot().inUnit(requested));
            }
            if (entry.isUsable(now)) {
                schedulePatch(key, coordinate, entry.snapshot().metadata().unit());
                return CompletableFuture.completedFuture(entry.snapshot().inUnit(requested));
            }
        }
        // Dependent stage: a caller cancelling or timing out must not complete the shared future.
        return sharedFetch(key, coordinate, requested).thenApply(snapshot -> snapshot.inUnit(requested));
    }

    boolean isFetching(String locationKey) {
        return inFlight.containsKey(locationKey);
    }

    boolean isPatching(String locationKey) {
        return patchesInFlight.contains(locationKey);
    }

    private CompletableFuture<Snapshot> sharedFetch(String key, Coordinate coordinate, TemperatureUnit unit) {
        CompletableFuture<Snapshot> created = new CompletableFuture<>();
        CompletableFuture<Snapshot> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            LOGGER.fine(() -> "Joining in-flight fetch for " + key);
            return existing;
        }
        try {
            executor.execute(() -> runFullFetch(key, coordinate, unit, created));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, created);
            created.completeExceptionally(new ProviderException("Fetch executor rejected work for " + key, e));
        }
        return created;
    }

    private void runFullFetch(String key, Coordinate coordinate, TemperatureUnit unit, CompletableFuture<Snapshot> promise) {
        Snapshot snapshot;
        try {
            snapshot = fetchOrFallback(key, coordinate, unit);
        } catch (RuntimeException e) {
            inFlight.remove(key, promise);
            promise.completeExceptionally(e);
            return;
        }
        // Removed before completion so a waiter reacting to the result starts a new fetch if it needs one.
        inFlight.remove(key, promise);
        promise.complete(snapshot);
    }

    private Snapshot fetchOrFallback(String key, Coordinate coordinate, TemperatureUnit unit) {
        Optional<CacheEntry> current = cacheStore.get(key);
        if (current.isPresent() && current.get().isFullyFresh(clock.instant())) {
            return current.get().snapshot();
        }
        try {
            Snapshot fetched = callProvider(coordinate, unit).withLocationKey(key);
            store(key, fetched);
            return fetched;
        } catch (ForecastException e) {
            Optional<CacheEntry> fallback = cacheStore.get(key);
            if (fallback.isPresent()) {
                LOGGER.log(Level.WARNING, "Fetch failed for " + key + "; serving stale cache: " + e.getMessage());
                return fallback.get().snapshot().asStale(e.getMessage());
            }
            throw new NotFoundException("No forecast available for " + key + ": " + e.getMessage(), e);
        }
    }

    private void store(String key, Snapshot snapshot) {
        try {
            cacheStore.put(key, snapshot, policy.dailyTtl(), policy.hourlyTtl());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed persisting snapshot for " + key, e);
        }
    }

    private void schedulePatch(String key, Coordinate coordinate, TemperatureUnit unit) {
        if (inFlight.containsKey(key) || !patchesInFlight.add(key)) {
            LOGGER.fine(() -> "Hourly refresh already running for " + key);
            return;
        }
        try {
            executor.execute(() -> runPatch(key, coordinate, unit));
        } catch (RejectedExecutionException e) {
            patchesInFlight.remove(key);
            LOGGER.log(Level.WARNING, "Fetch executor rejected hourly patch for " + key, e);
        }
    }

    private void runPatch(String key, Coordinate coordinate, TemperatureUnit unit) {
        try {
            Snapshot fetched = callProvider(coordinate, unit);
            boolean patched = cacheStore.patchHourly(key, fetched.hourly(), policy.hourlyTtl()).isPresent();
            LOGGER.fine(() -> patched ? "Patched hourly forecast for " + key : "Cache entry gone before patch for " + key);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Hourly patch failed for " + key + ": " + e.getMessage());
        } finally {
            patchesInFlight.remove(key);
        }
    }

    private Snapshot callProvider(Coordinate coordinate, TemperatureUnit unit) {
        ProviderId providerId = selector.select(coordinate);
        ForecastProvider provider = providers.get(providerId);
        if (provider == null) {
            throw new ProviderException("No provider registered for " + providerId);
        }
        Snapshot snapshot;
        try {
            snapshot = provider.fetch(coordinate, unit);
        } catch (ForecastException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException("Provider " + providerId + " failed: " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new DecodeException("Provider " + providerId + " returned no forecast");
        }
        return snapshot;
    }
}
