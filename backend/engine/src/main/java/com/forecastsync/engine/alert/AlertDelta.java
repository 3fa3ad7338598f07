package com.forecastsync.engine.alert;

import com.forecastsync.core.model.Alert;

import java.util.List;
import java.util.Set;

/**
 * @param surfaced alerts seen for the first time, in input order
 * @param ended    ids active for the location last time that are absent now
 */
public record AlertDelta(List<Alert> surfaced, Set<String> ended) {
    public AlertDelta {
        surfaced = List.copyOf(surfaced);
        ended = Set.copyOf(ended);
    }

    public boolean isEmpty() {
        return surfaced.isEmpty() && ended.isEmpty();
    }
}
