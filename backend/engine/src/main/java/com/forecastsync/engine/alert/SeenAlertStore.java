package com.forecastsync.engine.alert;

import java.util.Collection;
import java.util.Set;

/**
 * Durable, grow-only set of alert ids that have already been surfaced. Only {@link #clear()} shrinks it.
 */
public interface SeenAlertStore {
    boolean contains(String alertId);

    void addAll(Collection<String> alertIds);

    Set<String> all();

    void clear();
}
