package com.forecastsync.service.support;

import com.forecastsync.core.error.NetworkException;
import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.Coordinate;
import com.forecastsync.core.model.ForecastPoint;
import com.forecastsync.core.model.ProviderId;
import com.forecastsync.core.model.Snapshot;
import com.forecastsync.core.model.SnapshotMetadata;
import com.forecastsync.core.model.TemperatureUnit;
import com.forecastsync.core.model.WeatherIcon;
import com.forecastsync.engine.api.ForecastProvider;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns a one-day snapshot carrying {@link #alerts}, optionally failing or blocking until released.
 */
public class StubForecastProvider implements ForecastProvider {
    private final ProviderId id;
    private final Clock clock;
    private final AtomicInteger calls = new AtomicInteger();
    private final CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);
    private volatile List<Alert> alerts = List.of();
    private volatile boolean failing;

    public StubForecastProvider(ProviderId id, Clock clock, boolean blockUntilReleased) {
        this.id = id;
        this.clock = clock;
        this.gate = new CountDownLatch(blockUntilReleased ? 1 : 0);
    }

    public void alerts(List<Alert> next) {
        this.alerts = List.copyOf(next);
    }

    public void failing(boolean value) {
        this.failing = value;
    }

    public void release() {
        gate.countDown();
    }

    public boolean awaitEntered(long seconds) throws InterruptedException {
        return entered.await(seconds, TimeUnit.SECONDS);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public ProviderId id() {
        return id;
    }

    @Override
    public Snapshot fetch(Coordinate coordinate, TemperatureUnit unit) {
        calls.incrementAndGet();
        entered.countDown();
        try {
            gate.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("interrupted", e);
        }
        if (failing) {
            throw new NetworkException("stub network down");
        }
        return new Snapshot(
                coordinate.cacheKey(),
                List.of(ForecastPoint.daily(clock.instant(), 70.0, 50.0, 10.0, null, WeatherIcon.CLEAR_DAY, "Sunny")),
                List.of(ForecastPoint.hourly(clock.instant(), 65.0, 5.0, null, WeatherIcon.CLEAR_DAY, "Sunny", true)),
                alerts,
                SnapshotMetadata.fresh(id, clock.instant(), "stub", null, "UTC", unit)
        );
    }
}
