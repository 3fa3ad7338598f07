package com.forecastsync.service.runtime;

import com.forecastsync.engine.refresh.BackgroundRefreshScheduler;
import com.forecastsync.engine.refresh.RefreshReport;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RefreshTimer {
    private static final Logger LOGGER = Logger.getLogger(RefreshTimer.class.getName());
    public static final Duration MIN_INTERVAL = Duration.ofMinutes(15);

    private final BackgroundRefreshScheduler scheduler;
    private final Duration interval;
    private final Duration budget;
    private final ReentrantLock running = new ReentrantLock();
    private final AtomicReference<RefreshReport> lastReport = new AtomicReference<>();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "forecast-refresh-timer");
        thread.setDaemon(true);
        return thread;
    });

    public RefreshTimer(BackgroundRefreshScheduler scheduler, Duration interval, Duration budget) {
        this(scheduler, interval, budget, MIN_INTERVAL);
    }

    RefreshTimer(BackgroundRefreshScheduler scheduler, Duration interval, Duration budget, Duration minInterval) {
        this.scheduler = scheduler;
        this.interval = interval.compareTo(minInterval) < 0 ? minInterval : interval;
        this.budget = budget;
    }

    public Duration interval() {
        return interval;
    }

    public void start() {
        timerExecutor.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public RefreshReport runOnce() {
        running.lock();
        try {
            return record(scheduler.refreshAll(budget));
        } finally {
            running.unlock();
        }
    }

    public Optional<RefreshReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void tick() {
        if (!running.tryLock()) {
            LOGGER.info("Skipping refresh tick; previous refresh still running");
            return;
        }
        try {
            record(scheduler.refreshAll(budget));
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later tick.
            LOGGER.log(Level.SEVERE, "Background refresh failed", e);
        } finally {
            running.unlock();
        }
    }

    private RefreshReport record(RefreshReport report) {
        lastReport.set(report);
        LOGGER.info("Refresh finished: " + report.succeeded().size() + " ok, "
                + report.servedStale().size() + " stale, " + report.failed().size() + " failed");
        return report;
    }
}
