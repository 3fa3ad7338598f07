package com.forecastsync.engine.refresh;

import com.forecastsync.core.bus.EventBus;
import com.forecastsync.core.events.AlertRaised;
import com.forecastsync.core.events.RefreshCompleted;
import com.forecastsync.core.events.RefreshStarted;
import com.forecastsync.core.events.SnapshotRefreshed;
import com.forecastsync.core.model.Location;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.engine.alert.AlertDelta;
import com.forecastsync.engine.alert.AlertProcessor;
import com.forecastsync.engine.api.LocationStore;
import com.forecastsync.engine.fetch.FetchOrchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class BackgroundRefreshScheduler {
    private static final Logger LOGGER = Logger.getLogger(BackgroundRefreshScheduler.class.getName());

    private final LocationStore locationStore;
    private final FetchOrchestrator orchestrator;
    private final AlertProcessor alertProcessor;
    private final EventBus eventBus;
    private final Clock clock;
    private final RefreshSettings settings;

    public BackgroundRefreshScheduler(
            LocationStore locationStore,
            FetchOrchestrator orchestrator,
            AlertProcessor alertProcessor,
            EventBus eventBus,
            Clock clock,
            RefreshSettings settings
    ) {
        this.locationStore = Objects.requireNonNull(locationStore, "locationStore is required");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.alertProcessor = Objects.requireNonNull(alertProcessor, "alertProcessor is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public RefreshReport refreshAll(Duration budget) {
        return refreshAll(clock.instant().plus(budget));
    }

    public RefreshReport refreshAll(Instant deadline) {
        Instant startedAt = clock.instant();
        List<Location> locations = locationStore.listAll();
        alertProcessor.retainLocations(locations.stream().map(Location::id).toList());
        eventBus.publish(new RefreshStarted(startedAt, locations.size()));
        if (locations.isEmpty()) {
            eventBus.publish(new RefreshCompleted(clock.instant(), 0, 0, 0));
            return RefreshReport.empty();
        }

        int workers = Math.min(settings.maxConcurrency(), locations.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new RefreshThreadFactory());
        Map<Location, Future<Outcome>> tasks = new LinkedHashMap<>();
        List<String> succeeded = new ArrayList<>();
        List<String> servedStale = new ArrayList<>();
        List<RefreshReport.Failure> failed = new ArrayList<>();
        try {
            for (Location location : locations) {
                tasks.put(location, pool.submit(() -> refreshOne(location)));
            }
            boolean interrupted = false;
            for (Map.Entry<Location, Future<Outcome>> task : tasks.entrySet()) {
                String id = task.getKey().id();
                Future<Outcome> future = task.getValue();
                if (interrupted) {
                    future.cancel(true);
                    recordFailure(failed, id, new InterruptedException("Refresh interrupted"));
                    continue;
                }
                try {
                    long remainingNanos = Math.max(0, Duration.between(clock.instant(), deadline).toNanos());
                    Outcome outcome = future.get(remainingNanos, TimeUnit.NANOSECONDS);
                    succeeded.add(id);
                    if (outcome.snapshot().isStale()) {
                        servedStale.add(id);
                    }
                    eventBus.publish(new SnapshotRefreshed(
                            clock.instant(),
                            id,
                            String.valueOf(outcome.snapshot().metadata().providerId()),
                            outcome.snapshot().isStale(),
                            outcome.newAlerts()
                    ));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    recordFailure(failed, id, new TimeoutException("Refresh deadline passed before " + id + " finished"));
                } catch (ExecutionException e) {
                    recordFailure(failed, id, e.getCause() == null ? e : e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    future.cancel(true);
                    recordFailure(failed, id, e);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        LOGGER.info("Refresh pass finished: " + succeeded.size() + " succeeded, " + failed.size()
                + " failed, " + servedStale.size() + " stale in " + durationMillis + " ms");
        eventBus.publish(new RefreshCompleted(clock.instant(), succeeded.size(), failed.size(), durationMillis));
        return new RefreshReport(succeeded, servedStale, failed);
    }

    private Outcome refreshOne(Location location) throws Exception {
        CompletableFuture<Snapshot> pending =
                orchestrator.resolve(location.id(), location.coordinate(), settings.unit());
        Snapshot snapshot;
        try {
            snapshot = pending.get(settings.perLocationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TimeoutException("Refresh of " + location.id() + " timed out after "
                    + settings.perLocationTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
        if (snapshot.isStale()) {
            return new Outcome(snapshot, 0);
        }
        try {
            AlertDelta delta = alertProcessor.process(snapshot.alerts(), location);
            return new Outcome(snapshot, delta.surfaced().size());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert processing failed for " + location.id(), e);
            return new Outcome(snapshot, 0);
        }
    }

    private void recordFailure(List<RefreshReport.Failure> failed, String locationId, Throwable error) {
        RefreshReport.Failure failure = new RefreshReport.Failure(locationId, error);
        failed.add(failure);
        LOGGER.warning("Refresh failed for " + locationId + ": " + failure.message());
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.CATEGORY_REFRESH,
                "Refresh failed: " + locationId + " - " + failure.message(),
                Map.of("locationId", locationId, "error", error.getClass().getSimpleName())
        ));
    }

    private record Outcome(Snapshot snapshot, int newAlerts) {
    }

    private static final class RefreshThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "forecast-refresh-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
