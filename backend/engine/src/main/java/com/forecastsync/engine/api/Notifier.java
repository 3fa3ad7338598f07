package com.forecastsync.engine.api;

import com.forecastsync.core.model.Alert;
import com.forecastsync.core.model.Location;

public interface Notifier {
    void notify(Alert alert, Location location);
}
