package com.forecastsync.service;

import com.forecastsync.engine.refresh.RefreshReport;
import com.forecastsync.service.runtime.RefreshTimer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(System.getenv().getOrDefault("FORECAST_CONFIG_DIR", "config"));
        Path dataDir = Path.of(System.getenv().getOrDefault("FORECAST_DATA_DIR", "data"));
        boolean once = Arrays.asList(args).contains("--once");

        ForecastSyncService service = ForecastSyncService.create(configDir, dataDir, System.getenv(), Clock.systemUTC());
        RefreshTimer timer = service.refreshTimer();
        LOGGER.info("Tracking " + service.locationStore().listAll().size() + " locations; refresh every "
                + timer.interval().toMinutes() + " min");

        if (once) {
            RefreshReport report = timer.runOnce();
            report.failed().forEach(failure ->
                    LOGGER.warning("Refresh failed for " + failure.locationId() + ": " + failure.message()));
            int status = exitStatus(report);
            if (status != 0) {
                System.exit(status);
            }
            return;
        }

        timer.start();
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            timer.shutdown();
            LOGGER.info("Forecast sync stopped");
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static int exitStatus(RefreshReport report) {
        return report.total() > 0 && report.succeeded().isEmpty() ? 1 : 0;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to read logging.properties: " + e.getMessage());
        }
    }
}
