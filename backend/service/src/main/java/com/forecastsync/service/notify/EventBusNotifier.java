package com.forecastsync.service.notify;

import com.forecastsync.core.bus.EventBus;
import com.forecastsync.core.events.AlertRaised;
import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.Location;
import com.forecastsync.engine.api.Notifier;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

public class EventBusNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(EventBusNotifier.class.getName());

    private final EventBus eventBus;
    private final Clock clock;

    public EventBusNotifier(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void notify(Alert alert, Location location) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alertId", alert.id());
        details.put("locationId", location.id());
        details.put("locationName", location.name());
        details.put("severity", alert.severity().code());
        if (alert.event() != null) {
            details.put("event", alert.event());
        }
        if (alert.end() != null) {
            details.put("end", alert.end().toString());
        }
        String message = location.name() + ": " + (alert.headline() == null ? alert.id() : alert.headline());
        LOGGER.info("Weather alert [" + alert.severity().code() + "] " + message);
        eventBus.publish(new AlertRaised(clock.instant(), AlertRaised.CATEGORY_WEATHER, message, details));
    }
}
