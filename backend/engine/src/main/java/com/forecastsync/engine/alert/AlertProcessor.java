package com.forecastsync.engine.alert;

import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.AlertSeverity;
import com.forecastsync.core.model.Location;
import com.forecastsync.engine.api.Notifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AlertProcessor {
    private static final Logger LOGGER = Logger.getLogger(AlertProcessor.class.getName());

    private final SeenAlertStore seenAlerts;
    private final Notifier notifier;
    private final AlertSeverity notifyThreshold;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Set<String>> activeByLocation = new HashMap<>();

    public AlertProcessor(SeenAlertStore seenAlerts, Notifier notifier) {
        this(seenAlerts, notifier, AlertSeverity.MINOR);
    }

    public AlertProcessor(SeenAlertStore seenAlerts, Notifier notifier, AlertSeverity notifyThreshold) {
        this.seenAlerts = Objects.requireNonNull(seenAlerts, "seenAlerts is required");
        this.notifier = Objects.requireNonNull(notifier, "notifier is required");
        this.notifyThreshold = notifyThreshold == null ? AlertSeverity.MINOR : notifyThreshold;
    }

    public AlertDelta process(Collection<Alert> incoming, Location location) {
        Objects.requireNonNull(location, "location is required");
        Map<String, Alert> current = new LinkedHashMap<>();
        if (incoming != null) {
            for (Alert alert : incoming) {
                current.putIfAbsent(alert.id(), alert);
            }
        }

        List<Alert> surfaced = new ArrayList<>();
        Set<String> ended = new LinkedHashSet<>();
        lock.lock();
        try {
            for (Alert alert : current.values()) {
                if (!seenAlerts.contains(alert.id())) {
                    surfaced.add(alert);
                }
            }
            if (!surfaced.isEmpty()) {
                seenAlerts.addAll(surfaced.stream().map(Alert::id).toList());
            }
            Set<String> previous = activeByLocation.getOrDefault(location.id(), Set.of());
            for (String id : previous) {
                if (!current.containsKey(id)) {
                    ended.add(id);
                }
            }
            activeByLocation.put(location.id(), Set.copyOf(current.keySet()));
        } finally {
            lock.unlock();
        }

        for (Alert alert : surfaced) {
            if (alert.severity().isAtLeast(notifyThreshold)) {
                deliver(alert, location);
            }
        }
        if (!surfaced.isEmpty() || !ended.isEmpty()) {
            LOGGER.info("Alerts for " + location.id() + ": " + surfaced.size() + " new, " + ended.size() + " ended");
        }
        return new AlertDelta(surfaced, ended);
    }

    public void resetSeen() {
        lock.lock();
        try {
            seenAlerts.clear();
            activeByLocation.clear();
        } finally {
            lock.unlock();
        }
    }

    public void retainLocations(Collection<String> locationIds) {
        lock.lock();
        try {
            activeByLocation.keySet().retainAll(Set.copyOf(locationIds));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> activeAlertIds(String locationId) {
        lock.lock();
        try {
            return activeByLocation.getOrDefault(locationId, Set.of());
        } finally {
            lock.unlock();
        }
    }

    public static List<Alert> filter(Collection<Alert> alerts, AlertSeverity minimum) {
        AlertSeverity threshold = minimum == null ? AlertSeverity.MINOR : minimum;
        return alerts.stream().filter(alert -> alert.severity().isAtLeast(threshold)).toList();
    }

    public static Optional<AlertSeverity> highestSeverity(Collection<Alert> alerts) {
        return alerts.stream().map(Alert::severity).max(Comparator.naturalOrder());
    }

    public static boolean hasSevereAlerts(Collection<Alert> alerts) {
        return alerts.stream().anyMatch(alert -> alert.severity().isAtLeast(AlertSeverity.SEVERE));
    }

    public static Map<AlertSeverity, Long> countBySeverity(Collection<Alert> alerts) {
        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        for (Alert alert : alerts) {
            counts.merge(alert.severity(), 1L, Long::sum);
        }
        return counts;
    }

    private void deliver(Alert alert, Location location) {
        try {
            notifier.notify(alert, location);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Notifier failed for alert " + alert.id() + " at " + location.id(), e);
        }
    }
}
